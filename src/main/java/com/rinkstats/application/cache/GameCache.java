package com.rinkstats.application.cache;

import com.rinkstats.domain.model.GameId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Per-game artifact cache shared by all pipelines. Entries are only removed by an explicit
 * re-scrape.
 */
public class GameCache {

    private static final Logger logger = LoggerFactory.getLogger(GameCache.class);

    private final ConcurrentMap<GameId, GameCacheEntry> entries = new ConcurrentHashMap<>();

    public GameCacheEntry entry(GameId gameId) {
        return entries.computeIfAbsent(gameId, GameCacheEntry::new);
    }

    public Optional<GameCacheEntry> find(GameId gameId) {
        return Optional.ofNullable(entries.get(gameId));
    }

    public boolean contains(GameId gameId) {
        return entries.containsKey(gameId);
    }

    public void invalidate(GameId gameId) {
        if (entries.remove(gameId) != null) {
            logger.info("{} cache entry invalidated for re-scrape", gameId);
        }
    }

    public int size() {
        return entries.size();
    }
}
