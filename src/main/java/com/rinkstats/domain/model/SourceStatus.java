package com.rinkstats.domain.model;

public enum SourceStatus {
    /** Payload retrieved. */
    PRESENT,
    /** Source legitimately has no data for the game (e.g. no HTML reports for a preseason game). */
    ABSENT,
    /** Retry budget exhausted. */
    FAILED
}
