package com.rinkstats.application.usecase;

import com.rinkstats.application.cache.GameCache;
import com.rinkstats.application.cache.GameCacheEntry;
import com.rinkstats.application.enrich.PlayByPlayAssembler;
import com.rinkstats.application.reconcile.ChangeReconciler;
import com.rinkstats.application.reconcile.ChangeTimeline;
import com.rinkstats.application.reconcile.EventReconciler;
import com.rinkstats.application.reconcile.PlayerNameMatcher;
import com.rinkstats.application.reconcile.RosterIndex;
import com.rinkstats.application.reconcile.RosterReconciler;
import com.rinkstats.application.scoring.ScoringAdapter;
import com.rinkstats.domain.model.ApiRosterPlayer;
import com.rinkstats.domain.model.ArtifactKind;
import com.rinkstats.domain.model.ArtifactState;
import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.FailureKind;
import com.rinkstats.domain.model.GameFailure;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.GameInfo;
import com.rinkstats.domain.model.GamePipelineException;
import com.rinkstats.domain.model.HtmlRosterPlayer;
import com.rinkstats.domain.model.PlayerShift;
import com.rinkstats.domain.model.RosterEntry;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceFetchResult;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.SourceStatus;
import com.rinkstats.domain.ports.PlayByPlayRepository;
import com.rinkstats.domain.ports.SourceFetcher;
import com.rinkstats.domain.ports.SourceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs the full pipeline for one game: fetch, normalize, reconcile rosters, changes and events,
 * assemble and score. Every stage first consults the game's cache entry, so a second run over a
 * finished game fetches nothing and returns the cached play-by-play.
 */
public class GamePipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GamePipeline.class);

    private final SourceFetcher fetcher;
    private final SourceNormalizers normalizers;
    private final RosterReconciler rosterReconciler;
    private final ChangeReconciler changeReconciler;
    private final EventReconciler eventReconciler;
    private final PlayByPlayAssembler assembler;
    private final ScoringAdapter scoringAdapter;
    private final GameCache cache;
    private final PlayerNameMatcher nameMatcher;
    private final PlayByPlayRepository repository;
    private final ExecutorService fetchExecutor;

    /**
     * @param repository durable store written after each finished game, or null to keep results
     *                   in memory only
     */
    public GamePipeline(SourceFetcher fetcher, SourceNormalizers normalizers, RosterReconciler rosterReconciler,
                        ChangeReconciler changeReconciler, EventReconciler eventReconciler,
                        PlayByPlayAssembler assembler, ScoringAdapter scoringAdapter, GameCache cache,
                        PlayerNameMatcher nameMatcher, PlayByPlayRepository repository, int fetchPoolSize) {
        this.fetcher = fetcher;
        this.normalizers = normalizers;
        this.rosterReconciler = rosterReconciler;
        this.changeReconciler = changeReconciler;
        this.eventReconciler = eventReconciler;
        this.assembler = assembler;
        this.scoringAdapter = scoringAdapter;
        this.cache = cache;
        this.nameMatcher = nameMatcher;
        this.repository = repository;
        this.fetchExecutor = Executors.newFixedThreadPool(Math.max(fetchPoolSize, 1));
    }

    /**
     * Produces the enriched play-by-play of a game, reusing whatever the cache already holds.
     *
     * @throws GamePipelineException when the game cannot produce output; artifacts computed before
     *                               the failure stay cached
     */
    public List<EnrichedEvent> runGame(GameId gameId) {
        GameCacheEntry entry = cache.entry(gameId);
        entry.runLock().lock();
        try {
            if (entry.isDone(ArtifactKind.ENRICHED_EVENTS)) {
                logger.debug("{} served from cache", gameId);
                return entry.getEnrichedEvents();
            }
            logger.info("Running pipeline for {}", gameId);
            fetchMissing(entry);

            stage(entry, ArtifactKind.GAME_INFO, () -> buildGameInfo(entry));
            stage(entry, ArtifactKind.ROSTERS, () -> buildRosters(entry));
            stage(entry, ArtifactKind.CHANGES, () -> buildChanges(entry));
            stage(entry, ArtifactKind.CANONICAL_EVENTS, () -> buildCanonicalEvents(entry));
            stage(entry, ArtifactKind.ENRICHED_EVENTS, () -> buildEnrichedEvents(entry));

            List<EnrichedEvent> events = entry.getEnrichedEvents();
            logger.info("{} finished with {} events", gameId, events.size());
            return events;
        } finally {
            entry.runLock().unlock();
        }
    }

    /**
     * Drops everything cached for the game and runs it again from the sources.
     */
    public List<EnrichedEvent> rescrape(GameId gameId) {
        cache.invalidate(gameId);
        return runGame(gameId);
    }

    public Map<SourceKind, SourceFetchResult> rawSources(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::rawSources).orElse(Collections.emptyMap());
    }

    public Map<SourceKind, SourceStatus> sourceStates(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::sourceStates).orElse(Collections.emptyMap());
    }

    public List<RosterEntry> rosters(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::getRosters).orElse(null);
    }

    public ChangeTimeline changes(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::getChanges).orElse(null);
    }

    public List<CanonicalEvent> canonicalEvents(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::getCanonicalEvents).orElse(null);
    }

    public List<EnrichedEvent> enrichedEvents(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::getEnrichedEvents).orElse(null);
    }

    public Map<ArtifactKind, ArtifactState> artifactStates(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::artifactStates).orElse(Collections.emptyMap());
    }

    public List<GameFailure> sourceDefects(GameId gameId) {
        return cache.find(gameId).map(GameCacheEntry::sourceDefects).orElse(List.of());
    }

    private void fetchMissing(GameCacheEntry entry) {
        GameId gameId = entry.getGameId();
        List<SourceKind> missing = Arrays.stream(SourceKind.values())
            .filter(kind -> entry.rawSource(kind) == null)
            .toList();
        if (missing.isEmpty()) {
            return;
        }
        logger.debug("{} fetching {}", gameId, missing);

        List<CompletableFuture<SourceFetchResult>> futures = missing.stream()
            .map(kind -> CompletableFuture.supplyAsync(() -> fetchOne(gameId, kind), fetchExecutor))
            .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<SourceFetchResult> failed = new ArrayList<>();
        for (CompletableFuture<SourceFetchResult> future : futures) {
            SourceFetchResult result = future.join();
            entry.putRawSource(result);
            if (result.status() == SourceStatus.FAILED) {
                failed.add(result);
            } else if (result.status() == SourceStatus.ABSENT) {
                logger.warn("{} {} absent: {}", gameId, result.kind(), result.reason());
            }
        }
        if (!failed.isEmpty()) {
            SourceFetchResult first = failed.get(0);
            throw new GamePipelineException(new GameFailure(gameId, FailureKind.FETCH_FAILURE, first.kind(),
                failed.size() + " source(s) failed, first " + first.kind() + ": " + first.reason()));
        }
    }

    private SourceFetchResult fetchOne(GameId gameId, SourceKind kind) {
        try {
            return fetcher.fetch(gameId, kind);
        } catch (RuntimeException e) {
            logger.error("{} fetch of {} failed", gameId, kind, e);
            return SourceFetchResult.failed(kind, e.getMessage());
        }
    }

    private void stage(GameCacheEntry entry, ArtifactKind artifact, Runnable work) {
        if (entry.isDone(artifact)) {
            return;
        }
        try {
            work.run();
        } catch (GamePipelineException e) {
            entry.markFailed(artifact);
            throw e;
        } catch (RuntimeException e) {
            entry.markFailed(artifact);
            logger.error("{} stage {} failed", entry.getGameId(), artifact, e);
            throw new GamePipelineException(GameFailure.of(entry.getGameId(), FailureKind.INTERNAL,
                artifact + " stage failed: " + e.getMessage()), e);
        }
    }

    private void buildGameInfo(GameCacheEntry entry) {
        GameInfo info = first(normalize(entry, normalizers.gameInfo(), SourceKind.API_GAME_INFO));
        if (info == null) {
            // the play-by-play payload carries the same header
            info = first(normalize(entry, normalizers.gameInfo(), SourceKind.API_EVENTS));
        }
        if (info == null) {
            throw unavailable(entry, ArtifactKind.GAME_INFO, SourceKind.API_GAME_INFO, SourceKind.API_EVENTS);
        }
        entry.putGameInfo(info);
    }

    private void buildRosters(GameCacheEntry entry) {
        List<ApiRosterPlayer> api = normalize(entry, normalizers.apiRosters(), SourceKind.API_ROSTERS);
        List<HtmlRosterPlayer> html = normalize(entry, normalizers.htmlRosters(), SourceKind.HTML_ROSTERS);
        if (api == null && html == null) {
            throw unavailable(entry, ArtifactKind.ROSTERS, SourceKind.API_ROSTERS, SourceKind.HTML_ROSTERS);
        }
        List<RosterEntry> rosters = rosterReconciler.reconcile(entry.getGameInfo(), orEmpty(api), orEmpty(html));
        entry.putRosters(rosters);
        logger.info("{} roster reconciled: {} players", entry.getGameId(), rosters.size());
    }

    private void buildChanges(GameCacheEntry entry) {
        List<PlayerShift> home = normalize(entry, normalizers.shifts(), SourceKind.HTML_HOME_SHIFTS);
        List<PlayerShift> away = normalize(entry, normalizers.shifts(), SourceKind.HTML_AWAY_SHIFTS);
        if (home == null && away == null) {
            if (isPresent(entry, SourceKind.HTML_HOME_SHIFTS) || isPresent(entry, SourceKind.HTML_AWAY_SHIFTS)) {
                logger.warn("{} shift reports could not be read, on-ice personnel will be empty", entry.getGameId());
                entry.putChanges(ChangeTimeline.empty(entry.getGameId()), ArtifactState.DEFECTIVE);
            } else {
                logger.warn("{} has no shift reports, on-ice personnel will be empty", entry.getGameId());
                entry.putChanges(ChangeTimeline.empty(entry.getGameId()), ArtifactState.ABSENT);
            }
            return;
        }
        List<PlayerShift> shifts = new ArrayList<>(orEmpty(home));
        shifts.addAll(orEmpty(away));
        ChangeTimeline timeline = changeReconciler.reconcile(entry.getGameInfo(), shifts, rosterIndex(entry));
        entry.putChanges(timeline, ArtifactState.PRESENT);
        logger.info("{} change timeline built: {} changes, {} anomalies", entry.getGameId(),
            timeline.getChanges().size(), timeline.getAnomalies().size());
    }

    private void buildCanonicalEvents(GameCacheEntry entry) {
        List<SourceEvent> api = normalize(entry, normalizers.apiEvents(), SourceKind.API_EVENTS);
        List<SourceEvent> html = normalize(entry, normalizers.htmlEvents(), SourceKind.HTML_EVENTS);
        if (api == null && html == null) {
            throw unavailable(entry, ArtifactKind.CANONICAL_EVENTS, SourceKind.API_EVENTS, SourceKind.HTML_EVENTS);
        }
        List<CanonicalEvent> events = eventReconciler.reconcile(entry.getGameId(), rosterIndex(entry),
            orEmpty(api), orEmpty(html));
        entry.putCanonicalEvents(events);
        logger.info("{} events reconciled: {} canonical events", entry.getGameId(), events.size());
    }

    private void buildEnrichedEvents(GameCacheEntry entry) {
        GameId gameId = entry.getGameId();
        List<EnrichedEvent> assembled = assembler.assemble(entry.getGameInfo(), entry.getCanonicalEvents(),
            entry.getChanges(), rosterIndex(entry));
        List<EnrichedEvent> scored = scoringAdapter.score(gameId, assembled);
        entry.putEnrichedEvents(scored);

        if (repository != null) {
            try {
                int saved = repository.saveGame(gameId, entry.getEnrichedEvents());
                logger.info("{} persisted {} events", gameId, saved);
            } catch (Exception e) {
                logger.error("{} could not be persisted", gameId, e);
            }
        }
    }

    private RosterIndex rosterIndex(GameCacheEntry entry) {
        return new RosterIndex(entry.getRosters(), nameMatcher);
    }

    /**
     * Normalizes a cached source. A missing or absent source yields null; a payload the normalizer
     * cannot read is recorded as a defect of the game and also yields null, so the remaining
     * sources still produce output.
     */
    private <T> List<T> normalize(GameCacheEntry entry, SourceNormalizer<T> normalizer, SourceKind kind) {
        SourceFetchResult fetch = entry.rawSource(kind);
        if (fetch == null || !fetch.isPresent()) {
            return null;
        }
        try {
            return normalizer.normalize(fetch.source());
        } catch (SourceParseException e) {
            logger.error("{} {} could not be parsed", entry.getGameId(), kind, e);
            entry.recordSourceDefect(new GameFailure(entry.getGameId(), FailureKind.PARSE_DEFECT, kind,
                e.getMessage()));
            return null;
        }
    }

    private GamePipelineException unavailable(GameCacheEntry entry, ArtifactKind artifact, SourceKind... kinds) {
        List<SourceKind> required = Arrays.asList(kinds);
        GameFailure defect = entry.sourceDefects().stream()
            .filter(failure -> required.contains(failure.source()))
            .findFirst()
            .orElse(null);
        if (defect != null) {
            return new GamePipelineException(defect);
        }
        return new GamePipelineException(new GameFailure(entry.getGameId(), FailureKind.SOURCE_UNAVAILABLE,
            kinds[0], "no usable source for " + artifact + " among " + required));
    }

    private static boolean isPresent(GameCacheEntry entry, SourceKind kind) {
        SourceFetchResult fetch = entry.rawSource(kind);
        return fetch != null && fetch.isPresent();
    }

    private static <T> T first(List<T> values) {
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    private static <T> List<T> orEmpty(List<T> values) {
        return values == null ? List.of() : values;
    }

    @Override
    public void close() {
        fetchExecutor.shutdown();
        try {
            if (!fetchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                fetchExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            fetchExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
