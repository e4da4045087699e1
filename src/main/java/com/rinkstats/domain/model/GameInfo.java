package com.rinkstats.domain.model;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Game header: teams, venue and schedule information.
 */
public record GameInfo(
    GameId gameId,
    TeamInfo homeTeam,
    TeamInfo awayTeam,
    String venueName,
    LocalDate gameDate,
    Instant startTimeUtc,
    String gameState
) {

    public TeamInfo team(Venue venue) {
        return venue == Venue.HOME ? homeTeam : awayTeam;
    }

    /**
     * Returns the venue of a team code, or null when the code belongs to neither team.
     */
    public Venue venueOf(String teamAbbrev) {
        if (teamAbbrev == null) {
            return null;
        }
        if (teamAbbrev.equals(homeTeam.abbrev())) {
            return Venue.HOME;
        }
        if (teamAbbrev.equals(awayTeam.abbrev())) {
            return Venue.AWAY;
        }
        return null;
    }
}
