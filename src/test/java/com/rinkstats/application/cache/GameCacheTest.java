package com.rinkstats.application.cache;

import com.rinkstats.application.reconcile.ChangeTimeline;
import com.rinkstats.domain.model.ArtifactKind;
import com.rinkstats.domain.model.ArtifactState;
import com.rinkstats.domain.model.FailureKind;
import com.rinkstats.domain.model.GameFailure;
import com.rinkstats.domain.model.SourceFetchResult;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceStatus;
import com.rinkstats.support.SyntheticGame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameCache and GameCacheEntry.
 */
class GameCacheTest {

    private GameCache cache;

    @BeforeEach
    void setUp() {
        cache = new GameCache();
    }

    @Test
    void testEntryIsCreatedOnce() {
        assertFalse(cache.contains(SyntheticGame.GAME_ID));
        assertTrue(cache.find(SyntheticGame.GAME_ID).isEmpty());

        GameCacheEntry first = cache.entry(SyntheticGame.GAME_ID);
        GameCacheEntry second = cache.entry(SyntheticGame.GAME_ID);

        assertSame(first, second);
        assertEquals(1, cache.size());
        assertSame(first, cache.find(SyntheticGame.GAME_ID).orElseThrow());
    }

    @Test
    void testInvalidateDropsEverything() {
        GameCacheEntry entry = cache.entry(SyntheticGame.GAME_ID);
        entry.putRosters(List.of());

        cache.invalidate(SyntheticGame.GAME_ID);
        cache.invalidate(SyntheticGame.PRESEASON_ID);

        assertEquals(0, cache.size());
        assertEquals(ArtifactState.MISSING, cache.entry(SyntheticGame.GAME_ID).state(ArtifactKind.ROSTERS));
    }

    @Test
    void testNewEntryHasNothingComputed() {
        GameCacheEntry entry = new GameCacheEntry(SyntheticGame.GAME_ID);

        for (ArtifactKind kind : ArtifactKind.values()) {
            assertEquals(ArtifactState.MISSING, entry.state(kind));
            assertFalse(entry.isDone(kind));
        }
        assertTrue(entry.sourceStates().isEmpty());
        assertNull(entry.getEnrichedEvents());
    }

    @Test
    void testFailedFetchIsNotRetained() {
        GameCacheEntry entry = new GameCacheEntry(SyntheticGame.GAME_ID);
        entry.putRawSource(SourceFetchResult.present(SyntheticGame.raw(SourceKind.HTML_EVENTS)));
        entry.putRawSource(SourceFetchResult.absent(SourceKind.HTML_HOME_SHIFTS, "HTTP 404"));

        // a later failure replaces an earlier success
        entry.putRawSource(SourceFetchResult.failed(SourceKind.HTML_EVENTS, "HTTP 503"));

        Map<SourceKind, SourceStatus> states = entry.sourceStates();
        assertEquals(1, states.size());
        assertEquals(SourceStatus.ABSENT, states.get(SourceKind.HTML_HOME_SHIFTS));
        assertNull(entry.rawSource(SourceKind.HTML_EVENTS));
    }

    @Test
    void testArtifactStates() {
        GameCacheEntry entry = new GameCacheEntry(SyntheticGame.GAME_ID);

        entry.putChanges(ChangeTimeline.empty(SyntheticGame.GAME_ID), ArtifactState.ABSENT);
        entry.putCanonicalEvents(List.of());
        entry.markFailed(ArtifactKind.ENRICHED_EVENTS);

        assertEquals(ArtifactState.ABSENT, entry.state(ArtifactKind.CHANGES));
        assertTrue(entry.isDone(ArtifactKind.CHANGES));
        assertTrue(entry.isDone(ArtifactKind.CANONICAL_EVENTS));
        assertEquals(ArtifactState.FAILED, entry.state(ArtifactKind.ENRICHED_EVENTS));
        assertFalse(entry.isDone(ArtifactKind.ENRICHED_EVENTS));
        assertThrows(UnsupportedOperationException.class,
            () -> entry.artifactStates().put(ArtifactKind.ROSTERS, ArtifactState.PRESENT));
    }

    @Test
    void testDefectiveChangesCountAsDone() {
        GameCacheEntry entry = new GameCacheEntry(SyntheticGame.GAME_ID);

        entry.putChanges(ChangeTimeline.empty(SyntheticGame.GAME_ID), ArtifactState.DEFECTIVE);

        assertEquals(ArtifactState.DEFECTIVE, entry.state(ArtifactKind.CHANGES));
        assertTrue(entry.isDone(ArtifactKind.CHANGES));
        assertTrue(entry.getChanges().isEmpty());
    }

    @Test
    void testSourceDefectsAreDeduplicated() {
        GameCacheEntry entry = new GameCacheEntry(SyntheticGame.GAME_ID);
        GameFailure defect = new GameFailure(SyntheticGame.GAME_ID, FailureKind.PARSE_DEFECT,
            SourceKind.HTML_ROSTERS, "No roster tables");

        entry.recordSourceDefect(defect);
        entry.recordSourceDefect(defect);

        assertEquals(List.of(defect), entry.sourceDefects());
    }
}
