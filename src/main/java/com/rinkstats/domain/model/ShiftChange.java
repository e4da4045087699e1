package com.rinkstats.domain.model;

/**
 * A single player stepping on or off the ice. Players are referenced by identity key and resolved
 * against the roster when personnel is built.
 */
public record ShiftChange(
    GameId gameId,
    int period,
    int periodSeconds,
    int gameSeconds,
    String team,
    Venue venue,
    ChangeDirection direction,
    String playerKey,
    int jersey
) {

    public String teamJersey() {
        return team + jersey;
    }
}
