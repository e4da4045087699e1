package com.rinkstats.domain.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Players on the ice for one team at one instant, grouped by position.
 */
public record OnIcePersonnel(List<PlayerRef> forwards, List<PlayerRef> defense, List<PlayerRef> goalies) {

    public static final OnIcePersonnel EMPTY = new OnIcePersonnel(List.of(), List.of(), List.of());

    public OnIcePersonnel {
        forwards = forwards == null ? List.of() : List.copyOf(forwards);
        defense = defense == null ? List.of() : List.copyOf(defense);
        goalies = goalies == null ? List.of() : List.copyOf(goalies);
    }

    public static OnIcePersonnel of(List<RosterEntry> entries) {
        List<PlayerRef> forwards = new ArrayList<>();
        List<PlayerRef> defense = new ArrayList<>();
        List<PlayerRef> goalies = new ArrayList<>();
        for (RosterEntry entry : entries) {
            PlayerRef ref = PlayerRef.of(entry);
            if (entry.position() == Position.G) {
                goalies.add(ref);
            } else if (entry.position() == Position.D) {
                defense.add(ref);
            } else {
                forwards.add(ref);
            }
        }
        return new OnIcePersonnel(forwards, defense, goalies);
    }

    public List<PlayerRef> skaters() {
        List<PlayerRef> skaters = new ArrayList<>(forwards);
        skaters.addAll(defense);
        return skaters;
    }

    public int skaterCount() {
        return forwards.size() + defense.size();
    }

    public boolean hasGoalie() {
        return !goalies.isEmpty();
    }

    public boolean contains(String playerKey) {
        if (playerKey == null) {
            return false;
        }
        for (PlayerRef ref : skaters()) {
            if (playerKey.equals(ref.playerKey())) {
                return true;
            }
        }
        return goalies.stream().anyMatch(ref -> playerKey.equals(ref.playerKey()));
    }
}
