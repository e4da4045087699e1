package com.rinkstats.domain.model;

/**
 * On-ice count that no legal strength state allows, recorded at the end of a change group.
 */
public record OnIceAnomaly(int period, int periodSeconds, Venue venue, int skaters, int goalies) {
}
