package com.rinkstats.domain.model;

public enum ChangeDirection {
    OFF,
    ON
}
