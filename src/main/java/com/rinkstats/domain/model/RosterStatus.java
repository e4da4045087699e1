package com.rinkstats.domain.model;

public enum RosterStatus {
    ACTIVE,
    SCRATCH
}
