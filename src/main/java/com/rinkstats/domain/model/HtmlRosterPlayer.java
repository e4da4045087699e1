package com.rinkstats.domain.model;

/**
 * Player row from the HTML roster report, dressed or scratched.
 */
public record HtmlRosterPlayer(
    String team,
    String teamName,
    Venue venue,
    String playerName,
    int jersey,
    Position position,
    boolean starter,
    RosterStatus status
) {
}
