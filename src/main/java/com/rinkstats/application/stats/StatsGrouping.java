package com.rinkstats.application.stats;

/**
 * How aggregated stats are keyed: by season, game or period, optionally split further by the
 * team's strength state and score state. Line stats group either the forwards or the defence
 * pair on the ice.
 */
public record StatsGrouping(Level level, boolean byStrengthState, boolean byScoreState, LineType lines) {

    public static final StatsGrouping DEFAULT = new StatsGrouping(Level.GAME, false, false);

    public enum Level {
        SEASON,
        GAME,
        PERIOD
    }

    public enum LineType {
        FORWARDS,
        DEFENSE
    }

    public StatsGrouping {
        if (level == null) {
            level = Level.GAME;
        }
        if (lines == null) {
            lines = LineType.FORWARDS;
        }
    }

    public StatsGrouping(Level level, boolean byStrengthState, boolean byScoreState) {
        this(level, byStrengthState, byScoreState, LineType.FORWARDS);
    }
}
