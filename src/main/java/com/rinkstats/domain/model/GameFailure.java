package com.rinkstats.domain.model;

/**
 * Structured per-game failure reported by collection runs and the REST layer.
 */
public record GameFailure(GameId gameId, FailureKind kind, SourceKind source, String message) {

    public static GameFailure of(GameId gameId, FailureKind kind, String message) {
        return new GameFailure(gameId, kind, null, message);
    }
}
