package com.rinkstats.infrastructure.rest;

import com.rinkstats.application.usecase.GamePipeline;
import com.rinkstats.domain.model.ArtifactKind;
import com.rinkstats.domain.model.ArtifactState;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.GameFailure;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.GamePipelineException;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * REST controller for single-game operations.
 */
@RestController
@RequestMapping("/games")
public class GameController {

    private static final Logger logger = LoggerFactory.getLogger(GameController.class);

    private final GamePipeline gamePipeline;

    public GameController(GamePipeline gamePipeline) {
        this.gamePipeline = gamePipeline;
    }

    /**
     * Runs the pipeline for a game, or serves it from the cache.
     *
     * GET /games/{id}/play-by-play
     */
    @GetMapping("/{id}/play-by-play")
    public ResponseEntity<?> playByPlay(@PathVariable("id") String id) {
        return run(id, gamePipeline::runGame);
    }

    /**
     * Drops the cached game and runs it again from the sources.
     *
     * POST /games/{id}/rescrape
     */
    @PostMapping("/{id}/rescrape")
    public ResponseEntity<?> rescrape(@PathVariable("id") String id) {
        logger.info("Received request to re-scrape {}", id);
        return run(id, gamePipeline::rescrape);
    }

    @GetMapping("/{id}/rosters")
    public ResponseEntity<?> rosters(@PathVariable("id") String id) {
        return cached(id, gamePipeline::rosters);
    }

    @GetMapping("/{id}/changes")
    public ResponseEntity<?> changes(@PathVariable("id") String id) {
        return cached(id, gamePipeline::changes);
    }

    @GetMapping("/{id}/events")
    public ResponseEntity<?> events(@PathVariable("id") String id) {
        return cached(id, gamePipeline::canonicalEvents);
    }

    /**
     * State of every cached source and artifact of a game.
     *
     * GET /games/{id}/artifacts
     */
    @GetMapping("/{id}/artifacts")
    public ResponseEntity<?> artifacts(@PathVariable("id") String id) {
        GameId gameId = parse(id);
        if (gameId == null) {
            return badRequest(id);
        }
        Map<ArtifactKind, ArtifactState> states = gamePipeline.artifactStates(gameId);
        if (states.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(new ArtifactsResponse(gameId, gamePipeline.sourceStates(gameId), states,
            gamePipeline.sourceDefects(gameId)));
    }

    private ResponseEntity<?> run(String id, Function<GameId, List<EnrichedEvent>> action) {
        GameId gameId = parse(id);
        if (gameId == null) {
            return badRequest(id);
        }
        try {
            List<EnrichedEvent> events = action.apply(gameId);
            return ResponseEntity.ok(events);
        } catch (GamePipelineException e) {
            logger.error("Game {} failed: {}", gameId, e.getFailure());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(e.getFailure());
        } catch (Exception e) {
            logger.error("Error running game {}", gameId, e);
            return ResponseEntity.internalServerError().build();
        }
    }

    private ResponseEntity<?> cached(String id, Function<GameId, ?> accessor) {
        GameId gameId = parse(id);
        if (gameId == null) {
            return badRequest(id);
        }
        Object value = accessor.apply(gameId);
        return value == null ? ResponseEntity.notFound().build() : ResponseEntity.ok(value);
    }

    private static GameId parse(String id) {
        try {
            return GameId.of(id);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static ResponseEntity<?> badRequest(String id) {
        return ResponseEntity.badRequest().body(Map.of("error", id + " is not a valid game id"));
    }

    public record ArtifactsResponse(
        GameId gameId,
        Map<SourceKind, SourceStatus> sources,
        Map<ArtifactKind, ArtifactState> artifacts,
        List<GameFailure> sourceDefects
    ) {}
}
