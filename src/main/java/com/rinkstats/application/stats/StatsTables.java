package com.rinkstats.application.stats;

import java.util.List;

public record StatsTables(List<StatLine> players, List<StatLine> teams, List<StatLine> lines) {

    public static final StatsTables EMPTY = new StatsTables(List.of(), List.of(), List.of());

    public StatsTables {
        players = List.copyOf(players);
        teams = List.copyOf(teams);
        lines = List.copyOf(lines);
    }
}
