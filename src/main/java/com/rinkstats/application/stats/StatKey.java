package com.rinkstats.application.stats;

import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.SessionType;

/**
 * Grouping key of one stat line. Fields the grouping does not split on are null; the player key is
 * null on team and line rows, and the line is the sorted player keys of the unit joined by '-'.
 */
public record StatKey(
    int season,
    SessionType session,
    GameId gameId,
    Integer period,
    String team,
    String playerKey,
    String line,
    String strengthState,
    String scoreState
) {
}
