package com.rinkstats.domain.model;

/**
 * Authoritative roster line for one (game, team, sweater number).
 */
public record RosterEntry(
    GameId gameId,
    String team,
    Venue venue,
    int jersey,
    String playerName,
    String playerKey,
    Long apiId,
    Position position,
    RosterStatus status,
    boolean starter,
    boolean inApi,
    boolean inHtml
) {

    public String teamJersey() {
        return team + jersey;
    }

    public boolean isActive() {
        return status == RosterStatus.ACTIVE;
    }
}
