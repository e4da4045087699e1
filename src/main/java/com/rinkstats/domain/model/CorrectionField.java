package com.rinkstats.domain.model;

/**
 * Source event fields a correction rule can edit.
 */
public enum CorrectionField {
    EVENT,
    PERIOD,
    PERIOD_SECONDS,
    TIME,
    DESCRIPTION,
    EVENT_TEAM,
    EVENT_TYPE,
    PLAYER_1,
    PLAYER_2,
    PLAYER_3,
    OPPOSING_GOALIE;

    /** Player slot (0-based) for the PLAYER_n fields, -1 otherwise. */
    public int playerSlot() {
        return switch (this) {
            case PLAYER_1 -> 0;
            case PLAYER_2 -> 1;
            case PLAYER_3 -> 2;
            default -> -1;
        };
    }
}
