package com.rinkstats.domain.model;

/**
 * One shift row from a team's HTML shift report. Times are elapsed seconds within the period;
 * the end may be missing in historical reports.
 */
public record PlayerShift(
    GameId gameId,
    String team,
    Venue venue,
    String playerName,
    int jersey,
    int shiftNumber,
    int period,
    Integer startSeconds,
    Integer endSeconds,
    Integer durationSeconds
) {

    public String teamJersey() {
        return team + jersey;
    }

    public PlayerShift withTimes(int period, Integer startSeconds, Integer endSeconds) {
        Integer duration = startSeconds != null && endSeconds != null ? endSeconds - startSeconds : durationSeconds;
        return new PlayerShift(gameId, team, venue, playerName, jersey, shiftNumber, period,
            startSeconds, endSeconds, duration);
    }
}
