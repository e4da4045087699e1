package com.rinkstats.domain.model;

/**
 * Canonical event codes shared by both sources, with the tie-break order used when several events
 * carry the same clock reading.
 */
public enum EventType {
    PGSTR(1, false),
    PGEND(2, false),
    ANTHEM(3, false),
    EGT(3, false),
    CHL(3, false),
    DELPEN(3, false),
    BLOCK(3, true),
    GIVE(3, true),
    HIT(3, true),
    MISS(3, true),
    SHOT(3, true),
    TAKE(3, true),
    GOAL(5, true),
    STOP(6, false),
    PENL(7, true),
    PBOX(7, false),
    PSTR(7, false),
    EISTR(9, false),
    EIEND(10, false),
    FAC(12, true),
    PEND(13, false),
    SOC(14, false),
    GEND(15, false),
    GOFF(16, false);

    /** Sort position of line changes recorded at the same second. */
    public static final int CHANGE_SORT_ORDER = 8;

    private final int sortOrder;
    private final boolean inPlay;

    EventType(int sortOrder, boolean inPlay) {
        this.sortOrder = sortOrder;
        this.inPlay = inPlay;
    }

    public int getSortOrder() {
        return sortOrder;
    }

    /** Events that happen with the puck live and therefore need full on-ice personnel. */
    public boolean isInPlay() {
        return inPlay;
    }

    /** Whether line changes recorded at the same second are already in effect for this event. */
    public boolean seesChangesAtSameSecond() {
        return sortOrder > CHANGE_SORT_ORDER;
    }

    public boolean isUnblockedShotAttempt() {
        return this == GOAL || this == SHOT || this == MISS;
    }

    public boolean isShotAttempt() {
        return isUnblockedShotAttempt() || this == BLOCK;
    }

    public boolean isTeamEvent() {
        return switch (this) {
            case STOP, ANTHEM, PGSTR, PGEND, PSTR, PEND, EISTR, EIEND, GEND, SOC, EGT, PBOX, GOFF -> false;
            default -> true;
        };
    }

    /**
     * Returns the event type for a report code, or null for codes the engine does not track.
     */
    public static EventType fromCode(String code) {
        if (code == null) {
            return null;
        }
        try {
            return valueOf(code.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
