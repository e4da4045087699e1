package com.rinkstats.domain.ports;

import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.SourceFetchResult;
import com.rinkstats.domain.model.SourceKind;

/**
 * Port for retrieving raw source payloads for a single game.
 */
public interface SourceFetcher {

    /**
     * Fetches one source. A source that legitimately has no data for the game is reported as
     * absent, transient failures that outlast the retry budget as failed; neither throws.
     *
     * @param gameId game to fetch
     * @param kind source to fetch
     * @return outcome of the fetch
     */
    SourceFetchResult fetch(GameId gameId, SourceKind kind);
}
