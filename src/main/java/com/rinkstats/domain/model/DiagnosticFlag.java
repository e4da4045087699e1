package com.rinkstats.domain.model;

/**
 * Data-quality markers carried by events instead of dropping them.
 */
public enum DiagnosticFlag {
    /** A correction rule changed this event. */
    CORRECTED,
    /** Timestamp could not be made consistent and no correction rule exists. */
    UNCORRECTED_ANOMALY,
    /** A referenced player could not be matched to the roster. */
    IDENTITY_UNRESOLVED,
    /** On-ice counts at this event are outside the legal range. */
    ON_ICE_ANOMALY
}
