package com.rinkstats.domain.ports;

import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.GameId;

import java.util.List;

/**
 * Port for durable storage of finished play-by-play sequences.
 */
public interface PlayByPlayRepository {

    /**
     * Replaces the stored play-by-play of a game.
     *
     * @return number of events written
     */
    int saveGame(GameId gameId, List<EnrichedEvent> events);

    /**
     * @return stored events in order, or an empty list when the game has not been stored
     */
    List<EnrichedEvent> findByGameId(GameId gameId);
}
