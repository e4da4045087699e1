package com.rinkstats.domain.model;

public enum Venue {
    HOME,
    AWAY;

    public Venue opposite() {
        return this == HOME ? AWAY : HOME;
    }
}
