package com.rinkstats.domain.model;

public enum ArtifactState {
    /** Not computed yet. */
    MISSING,
    PRESENT,
    /** The inputs legitimately have no data, e.g. no HTML report for a preseason game. */
    ABSENT,
    /** The inputs were fetched but none of them could be read; the stage carries an empty result. */
    DEFECTIVE,
    FAILED
}
