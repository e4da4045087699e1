package com.rinkstats.application.usecase;

import com.rinkstats.application.stats.StatsAggregator;
import com.rinkstats.application.stats.StatsGrouping;
import com.rinkstats.application.stats.StatsTables;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.FailureKind;
import com.rinkstats.domain.model.GameFailure;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.GamePipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the game pipeline over an ordered set of games on a bounded pool. One game failing never
 * stops the others; its failure is reported under its id. A cancel request applies to the runs in
 * progress when it arrives and takes effect between games, so a game already running completes
 * and stays cached.
 */
public class CollectionScraper implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CollectionScraper.class);

    private final GamePipeline pipeline;
    private final StatsAggregator aggregator;
    private final ExecutorService gameExecutor;
    private final Set<GameId> games = new LinkedHashSet<>();
    private final Map<GameId, GameFailure> failures = new ConcurrentHashMap<>();
    private final Set<AtomicBoolean> activeRuns = ConcurrentHashMap.newKeySet();

    private StatsGrouping statsGrouping;
    private List<List<EnrichedEvent>> statsInputs;
    private StatsTables stats;

    public CollectionScraper(GamePipeline pipeline, StatsAggregator aggregator, int gamePoolSize) {
        this.pipeline = pipeline;
        this.aggregator = aggregator;
        this.gameExecutor = Executors.newFixedThreadPool(Math.max(gamePoolSize, 1));
    }

    /**
     * Adds the games to the collection and runs every game of the request. Games finished by an
     * earlier run are served from the cache.
     */
    public CollectionSummary runCollection(Collection<GameId> gameIds) {
        List<GameId> requested = new ArrayList<>(new LinkedHashSet<>(gameIds));
        synchronized (this) {
            games.addAll(requested);
        }
        return run(requested);
    }

    /**
     * Adds games to the collection, running pipelines only for ids not already in it.
     */
    public CollectionSummary addGames(Collection<GameId> gameIds) {
        List<GameId> added = new ArrayList<>();
        synchronized (this) {
            for (GameId gameId : gameIds) {
                if (games.add(gameId)) {
                    added.add(gameId);
                }
            }
        }
        if (added.isEmpty()) {
            logger.info("No new games to add");
        }
        return run(added);
    }

    /**
     * Stops every run in progress before its next game starts. Runs started afterwards are not
     * affected.
     */
    public void cancel() {
        logger.info("Collection run cancel requested for {} runs", activeRuns.size());
        for (AtomicBoolean run : activeRuns) {
            run.set(true);
        }
    }

    private CollectionSummary run(List<GameId> requested) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        activeRuns.add(cancelled);
        logger.info("Starting collection run with {} games", requested.size());

        List<CompletableFuture<GameOutcome>> futures;
        try {
            futures = requested.stream()
                .map(gameId -> CompletableFuture.supplyAsync(() -> runGame(gameId, cancelled), gameExecutor))
                .toList();
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } finally {
            activeRuns.remove(cancelled);
        }

        int completed = 0;
        int events = 0;
        List<GameId> skipped = new ArrayList<>();
        Map<GameId, GameFailure> runFailures = new LinkedHashMap<>();
        for (CompletableFuture<GameOutcome> future : futures) {
            GameOutcome outcome = future.join();
            if (outcome.skipped()) {
                skipped.add(outcome.gameId());
            } else if (outcome.failure() != null) {
                runFailures.put(outcome.gameId(), outcome.failure());
            } else {
                completed++;
                events += outcome.events();
            }
        }
        logger.info("Collection run finished: {} completed, {} failed, {} skipped", completed,
            runFailures.size(), skipped.size());
        return new CollectionSummary(requested.size(), completed, events, runFailures, skipped, cancelled.get());
    }

    private GameOutcome runGame(GameId gameId, AtomicBoolean cancelled) {
        if (cancelled.get()) {
            return new GameOutcome(gameId, 0, null, true);
        }
        try {
            List<EnrichedEvent> events = pipeline.runGame(gameId);
            failures.remove(gameId);
            return new GameOutcome(gameId, events.size(), null, false);
        } catch (GamePipelineException e) {
            logger.error("Game {} failed: {}", gameId, e.getFailure());
            failures.put(gameId, e.getFailure());
            return new GameOutcome(gameId, 0, e.getFailure(), false);
        } catch (Exception e) {
            logger.error("Game {} failed", gameId, e);
            GameFailure failure = GameFailure.of(gameId, FailureKind.INTERNAL, e.getMessage());
            failures.put(gameId, failure);
            return new GameOutcome(gameId, 0, failure, false);
        }
    }

    public synchronized List<GameId> games() {
        return List.copyOf(games);
    }

    /**
     * Latest failure of every game whose last run did not produce output, in collection order.
     */
    public Map<GameId, GameFailure> failures() {
        Map<GameId, GameFailure> ordered = new LinkedHashMap<>();
        for (GameId gameId : games()) {
            GameFailure failure = failures.get(gameId);
            if (failure != null) {
                ordered.put(gameId, failure);
            }
        }
        return ordered;
    }

    /**
     * Play-by-play of every finished game, concatenated in collection order.
     */
    public List<EnrichedEvent> playByPlay() {
        List<EnrichedEvent> result = new ArrayList<>();
        finishedGames().forEach(result::addAll);
        return result;
    }

    /**
     * Aggregated stats of the finished games. The result is reused until the grouping changes or
     * the play-by-play of some game is produced anew.
     */
    public synchronized StatsTables stats(StatsGrouping grouping) {
        StatsGrouping requested = grouping == null ? StatsGrouping.DEFAULT : grouping;
        List<List<EnrichedEvent>> inputs = finishedGames();
        if (stats == null || !requested.equals(statsGrouping) || !sameInputs(inputs)) {
            List<EnrichedEvent> events = new ArrayList<>();
            inputs.forEach(events::addAll);
            stats = aggregator.aggregate(events, requested);
            statsGrouping = requested;
            statsInputs = inputs;
        }
        return stats;
    }

    private List<List<EnrichedEvent>> finishedGames() {
        List<List<EnrichedEvent>> finished = new ArrayList<>();
        for (GameId gameId : games()) {
            List<EnrichedEvent> events = pipeline.enrichedEvents(gameId);
            if (events != null) {
                finished.add(events);
            }
        }
        return finished;
    }

    // cached lists are shared, so identity tells whether a game was recomputed
    private boolean sameInputs(List<List<EnrichedEvent>> inputs) {
        if (statsInputs == null || statsInputs.size() != inputs.size()) {
            return false;
        }
        for (int i = 0; i < inputs.size(); i++) {
            if (statsInputs.get(i) != inputs.get(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public void close() {
        gameExecutor.shutdown();
        try {
            if (!gameExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                gameExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            gameExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record GameOutcome(GameId gameId, int events, GameFailure failure, boolean skipped) {}

    public record CollectionSummary(
        int requested,
        int completed,
        int events,
        Map<GameId, GameFailure> failures,
        List<GameId> skipped,
        boolean cancelled
    ) {}
}
