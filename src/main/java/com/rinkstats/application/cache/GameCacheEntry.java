package com.rinkstats.application.cache;

import com.rinkstats.application.reconcile.ChangeTimeline;
import com.rinkstats.domain.model.ArtifactKind;
import com.rinkstats.domain.model.ArtifactState;
import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.GameFailure;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.GameInfo;
import com.rinkstats.domain.model.RosterEntry;
import com.rinkstats.domain.model.SourceFetchResult;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceStatus;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Everything computed so far for one game. Each artifact has its own state so a run that stops
 * half-way keeps what it produced; failed fetches are not retained and are retried on the next
 * run. Reads and writes go through the entry's monitor; a pipeline run holds {@link #runLock()}
 * so a game is processed by one run at a time.
 */
public class GameCacheEntry {

    private final GameId gameId;
    private final Map<SourceKind, SourceFetchResult> rawSources = new EnumMap<>(SourceKind.class);
    private final Map<ArtifactKind, ArtifactState> states = new EnumMap<>(ArtifactKind.class);
    private final Set<GameFailure> sourceDefects = new LinkedHashSet<>();
    private final ReentrantLock runLock = new ReentrantLock();

    private GameInfo gameInfo;
    private List<RosterEntry> rosters;
    private ChangeTimeline changes;
    private List<CanonicalEvent> canonicalEvents;
    private List<EnrichedEvent> enrichedEvents;

    public GameCacheEntry(GameId gameId) {
        this.gameId = gameId;
        for (ArtifactKind kind : ArtifactKind.values()) {
            states.put(kind, ArtifactState.MISSING);
        }
    }

    public GameId getGameId() {
        return gameId;
    }

    public ReentrantLock runLock() {
        return runLock;
    }

    public synchronized SourceFetchResult rawSource(SourceKind kind) {
        return rawSources.get(kind);
    }

    public synchronized void putRawSource(SourceFetchResult result) {
        if (result.status() == SourceStatus.FAILED) {
            rawSources.remove(result.kind());
            return;
        }
        rawSources.put(result.kind(), result);
    }

    public synchronized Map<SourceKind, SourceFetchResult> rawSources() {
        return Collections.unmodifiableMap(new EnumMap<>(rawSources));
    }

    /**
     * Source states for every kind; kinds not fetched yet, or whose last fetch failed, are absent
     * from the map.
     */
    public synchronized Map<SourceKind, SourceStatus> sourceStates() {
        Map<SourceKind, SourceStatus> result = new EnumMap<>(SourceKind.class);
        rawSources.forEach((kind, fetch) -> result.put(kind, fetch.status()));
        return result;
    }

    public synchronized ArtifactState state(ArtifactKind kind) {
        return states.get(kind);
    }

    public synchronized Map<ArtifactKind, ArtifactState> artifactStates() {
        return Collections.unmodifiableMap(new EnumMap<>(states));
    }

    public synchronized void markFailed(ArtifactKind kind) {
        states.put(kind, ArtifactState.FAILED);
    }

    public synchronized void recordSourceDefect(GameFailure failure) {
        sourceDefects.add(failure);
    }

    public synchronized List<GameFailure> sourceDefects() {
        return List.copyOf(sourceDefects);
    }

    public synchronized GameInfo getGameInfo() {
        return gameInfo;
    }

    public synchronized void putGameInfo(GameInfo gameInfo) {
        this.gameInfo = gameInfo;
        states.put(ArtifactKind.GAME_INFO, ArtifactState.PRESENT);
    }

    public synchronized List<RosterEntry> getRosters() {
        return rosters;
    }

    public synchronized void putRosters(List<RosterEntry> rosters) {
        this.rosters = List.copyOf(rosters);
        states.put(ArtifactKind.ROSTERS, ArtifactState.PRESENT);
    }

    public synchronized ChangeTimeline getChanges() {
        return changes;
    }

    /**
     * @param absent no shift report exists for the game
     */
    public synchronized void putChanges(ChangeTimeline changes, ArtifactState state) {
        this.changes = changes;
        states.put(ArtifactKind.CHANGES, state);
    }

    public synchronized List<CanonicalEvent> getCanonicalEvents() {
        return canonicalEvents;
    }

    public synchronized void putCanonicalEvents(List<CanonicalEvent> canonicalEvents) {
        this.canonicalEvents = List.copyOf(canonicalEvents);
        states.put(ArtifactKind.CANONICAL_EVENTS, ArtifactState.PRESENT);
    }

    public synchronized List<EnrichedEvent> getEnrichedEvents() {
        return enrichedEvents;
    }

    public synchronized void putEnrichedEvents(List<EnrichedEvent> enrichedEvents) {
        this.enrichedEvents = List.copyOf(enrichedEvents);
        states.put(ArtifactKind.ENRICHED_EVENTS, ArtifactState.PRESENT);
    }

    /**
     * Whether the artifact is computed, as present, legitimately absent or built empty from
     * unreadable inputs.
     */
    public synchronized boolean isDone(ArtifactKind kind) {
        ArtifactState state = states.get(kind);
        return state == ArtifactState.PRESENT || state == ArtifactState.ABSENT || state == ArtifactState.DEFECTIVE;
    }
}
