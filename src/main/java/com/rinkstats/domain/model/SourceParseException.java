package com.rinkstats.domain.model;

/**
 * A source payload did not match the structure its normalizer expects.
 */
public class SourceParseException extends Exception {

    private final GameId gameId;
    private final SourceKind source;

    public SourceParseException(GameId gameId, SourceKind source, String message) {
        super(gameId + " " + source + ": " + message);
        this.gameId = gameId;
        this.source = source;
    }

    public SourceParseException(GameId gameId, SourceKind source, String message, Throwable cause) {
        super(gameId + " " + source + ": " + message, cause);
        this.gameId = gameId;
        this.source = source;
    }

    public GameId getGameId() {
        return gameId;
    }

    public SourceKind getSource() {
        return source;
    }
}
