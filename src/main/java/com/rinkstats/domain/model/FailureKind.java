package com.rinkstats.domain.model;

/**
 * Why a game could not produce a play-by-play.
 */
public enum FailureKind {
    /** A source the game cannot do without has no data. */
    SOURCE_UNAVAILABLE,
    /** Network or HTTP failure that outlasted the retry budget. */
    FETCH_FAILURE,
    /** A payload did not have the expected structure. */
    PARSE_DEFECT,
    INTERNAL
}
