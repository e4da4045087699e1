package com.rinkstats.domain.model;

/**
 * Thrown when a single game's pipeline cannot produce output. Carries the structured failure.
 */
public class GamePipelineException extends RuntimeException {

    private final GameFailure failure;

    public GamePipelineException(GameFailure failure) {
        super(failure.message());
        this.failure = failure;
    }

    public GamePipelineException(GameFailure failure, Throwable cause) {
        super(failure.message(), cause);
        this.failure = failure;
    }

    public GameFailure getFailure() {
        return failure;
    }
}
