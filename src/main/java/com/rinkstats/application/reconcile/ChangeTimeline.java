package com.rinkstats.application.reconcile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.rinkstats.domain.model.ChangeDirection;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.OnIceAnomaly;
import com.rinkstats.domain.model.ShiftChange;
import com.rinkstats.domain.model.Venue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;

/**
 * Ordered shift changes of one game, indexed per period and venue by the second at which each
 * group of changes completes. Every period starts from an empty ice surface.
 */
public class ChangeTimeline {

    /**
     * Whether changes recorded at the queried second are applied.
     */
    public enum Mode {
        BEFORE_CHANGES,
        AFTER_CHANGES
    }

    private final GameId gameId;
    private final List<ShiftChange> changes;
    private final List<OnIceAnomaly> anomalies;
    private final Map<Integer, Map<Venue, NavigableMap<Integer, Set<String>>>> snapshots = new HashMap<>();

    public ChangeTimeline(GameId gameId, List<ShiftChange> changes, List<OnIceAnomaly> anomalies) {
        this.gameId = gameId;
        this.changes = List.copyOf(changes);
        this.anomalies = List.copyOf(anomalies);

        Map<Integer, Map<Venue, Set<String>>> current = new HashMap<>();
        for (ShiftChange change : this.changes) {
            Set<String> onIce = current
                .computeIfAbsent(change.period(), period -> new EnumMap<>(Venue.class))
                .computeIfAbsent(change.venue(), venue -> new LinkedHashSet<>());
            if (change.direction() == ChangeDirection.ON) {
                onIce.add(change.playerKey());
            } else {
                onIce.remove(change.playerKey());
            }
            snapshots
                .computeIfAbsent(change.period(), period -> new EnumMap<>(Venue.class))
                .computeIfAbsent(change.venue(), venue -> new TreeMap<>())
                .put(change.periodSeconds(), Collections.unmodifiableSet(new LinkedHashSet<>(onIce)));
        }
    }

    public static ChangeTimeline empty(GameId gameId) {
        return new ChangeTimeline(gameId, List.of(), List.of());
    }

    public GameId getGameId() {
        return gameId;
    }

    public List<ShiftChange> getChanges() {
        return changes;
    }

    public List<OnIceAnomaly> getAnomalies() {
        return anomalies;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public boolean hasPeriod(int period) {
        return snapshots.containsKey(period);
    }

    public boolean hasPeriod(int period, Venue venue) {
        Map<Venue, NavigableMap<Integer, Set<String>>> byVenue = snapshots.get(period);
        return byVenue != null && byVenue.containsKey(venue);
    }

    /**
     * Identity keys on the ice for one venue at a clock reading. Never looks into another period.
     */
    public Set<String> onIce(int period, int periodSeconds, Venue venue, Mode mode) {
        Map<Venue, NavigableMap<Integer, Set<String>>> byVenue = snapshots.get(period);
        if (byVenue == null) {
            return Set.of();
        }
        NavigableMap<Integer, Set<String>> index = byVenue.get(venue);
        if (index == null) {
            return Set.of();
        }
        Map.Entry<Integer, Set<String>> entry = mode == Mode.AFTER_CHANGES
            ? index.floorEntry(periodSeconds)
            : index.lowerEntry(periodSeconds);
        return entry == null ? Set.of() : entry.getValue();
    }
}
