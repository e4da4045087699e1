package com.rinkstats.domain.model;

/**
 * Period lengths and game-second arithmetic.
 */
public final class GameClock {

    public static final int REGULATION_PERIOD_SECONDS = 1200;
    public static final int REGULAR_SEASON_OVERTIME_SECONDS = 300;
    public static final int REGULATION_PERIODS = 3;
    public static final int SHOOTOUT_PERIOD = 5;

    private GameClock() {
    }

    /**
     * Game seconds of a clock reading. The regular-season shootout is pinned to 3900 + elapsed.
     */
    public static int gameSeconds(SessionType session, int period, int periodSeconds) {
        if (isShootout(session, period)) {
            return REGULATION_PERIODS * REGULATION_PERIOD_SECONDS + REGULAR_SEASON_OVERTIME_SECONDS + periodSeconds;
        }
        return (period - 1) * REGULATION_PERIOD_SECONDS + periodSeconds;
    }

    public static int periodLength(SessionType session, int period) {
        if (period <= REGULATION_PERIODS || session == SessionType.PLAYOFF) {
            return REGULATION_PERIOD_SECONDS;
        }
        return REGULAR_SEASON_OVERTIME_SECONDS;
    }

    public static boolean isShootout(SessionType session, int period) {
        return period == SHOOTOUT_PERIOD && session != SessionType.PLAYOFF;
    }

    /**
     * Parses an elapsed clock reading such as "4:07" or "04:07"; returns null when it cannot be read.
     */
    public static Integer parseClock(String text) {
        if (text == null) {
            return null;
        }
        String[] parts = text.trim().split(":");
        if (parts.length != 2) {
            return null;
        }
        try {
            int minutes = Integer.parseInt(parts[0].trim());
            int seconds = Integer.parseInt(parts[1].trim());
            if (minutes < 0 || seconds < 0 || seconds > 59) {
                return null;
            }
            return minutes * 60 + seconds;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
