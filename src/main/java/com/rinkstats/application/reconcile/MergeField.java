package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.SourceKind;

/**
 * Which source wins each field when an API event and a report event describe the same
 * occurrence. The other source fills the field when the preferred one has no value.
 */
public enum MergeField {
    CLOCK(SourceKind.HTML_EVENTS),
    DESCRIPTION(SourceKind.HTML_EVENTS),
    ZONE(SourceKind.HTML_EVENTS),
    COORDINATES(SourceKind.HTML_EVENTS),
    SHOT_DISTANCE(SourceKind.HTML_EVENTS),
    SHOT_TYPE(SourceKind.HTML_EVENTS),
    PENALTY(SourceKind.HTML_EVENTS),
    STRENGTH(SourceKind.HTML_EVENTS),
    EVENT_TYPE(SourceKind.API_EVENTS),
    EVENT_TEAM(SourceKind.API_EVENTS),
    PLAYERS(SourceKind.API_EVENTS),
    OPPOSING_GOALIE(SourceKind.API_EVENTS),
    PENALTY_MINUTES(SourceKind.API_EVENTS),
    MISS_REASON(SourceKind.API_EVENTS),
    STOPPAGE_REASON(SourceKind.API_EVENTS),
    SITUATION_CODE(SourceKind.API_EVENTS),
    DEFENDING_SIDE(SourceKind.API_EVENTS);

    private final SourceKind preferred;

    MergeField(SourceKind preferred) {
        this.preferred = preferred;
    }

    public SourceKind getPreferred() {
        return preferred;
    }

    /**
     * Picks the preferred source's value, falling back to the other one when it is null.
     */
    public <T> T choose(T apiValue, T htmlValue) {
        T first = preferred == SourceKind.API_EVENTS ? apiValue : htmlValue;
        return first != null ? first : (preferred == SourceKind.API_EVENTS ? htmlValue : apiValue);
    }
}
