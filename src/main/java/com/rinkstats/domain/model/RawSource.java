package com.rinkstats.domain.model;

/**
 * Unparsed payload of one source for one game. Created by the fetcher, consumed by its normalizer.
 */
public record RawSource(GameId gameId, SourceKind kind, String url, String body) {

    @Override
    public String toString() {
        return "RawSource[" + gameId + ", " + kind + ", " + url + ", " + (body == null ? 0 : body.length()) + " chars]";
    }
}
