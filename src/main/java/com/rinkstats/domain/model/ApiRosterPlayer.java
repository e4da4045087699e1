package com.rinkstats.domain.model;

/**
 * Dressed player as listed by the structured API.
 */
public record ApiRosterPlayer(
    String team,
    Venue venue,
    long apiId,
    String firstName,
    String lastName,
    String playerName,
    int jersey,
    Position position,
    String headshotUrl
) {
}
