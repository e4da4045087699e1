package com.rinkstats.domain.model;

/**
 * Outcome of fetching one source for one game.
 */
public record SourceFetchResult(SourceKind kind, SourceStatus status, RawSource source, String reason) {

    public static SourceFetchResult present(RawSource source) {
        return new SourceFetchResult(source.kind(), SourceStatus.PRESENT, source, null);
    }

    public static SourceFetchResult absent(SourceKind kind, String reason) {
        return new SourceFetchResult(kind, SourceStatus.ABSENT, null, reason);
    }

    public static SourceFetchResult failed(SourceKind kind, String reason) {
        return new SourceFetchResult(kind, SourceStatus.FAILED, null, reason);
    }

    public boolean isPresent() {
        return status == SourceStatus.PRESENT;
    }
}
