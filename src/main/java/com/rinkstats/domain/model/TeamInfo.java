package com.rinkstats.domain.model;

public record TeamInfo(Integer id, String abbrev, String name) {
}
