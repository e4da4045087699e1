package com.rinkstats.domain.model;

/**
 * Derived artifacts held per game in the cache, in pipeline order.
 */
public enum ArtifactKind {
    GAME_INFO,
    ROSTERS,
    CHANGES,
    CANONICAL_EVENTS,
    ENRICHED_EVENTS
}
