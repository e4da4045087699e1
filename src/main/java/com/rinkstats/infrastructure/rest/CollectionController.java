package com.rinkstats.infrastructure.rest;

import com.rinkstats.application.stats.StatsGrouping;
import com.rinkstats.application.stats.StatsTables;
import com.rinkstats.application.usecase.CollectionScraper;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.GameFailure;
import com.rinkstats.domain.model.GameId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST controller for the game collection.
 */
@RestController
@RequestMapping("/collection")
public class CollectionController {

    private static final Logger logger = LoggerFactory.getLogger(CollectionController.class);

    private final CollectionScraper collectionScraper;

    public CollectionController(CollectionScraper collectionScraper) {
        this.collectionScraper = collectionScraper;
    }

    /**
     * Adds games to the collection and runs the ones not already in it.
     *
     * POST /collection/games with a JSON array of game ids
     */
    @PostMapping("/games")
    public ResponseEntity<?> addGames(@RequestBody List<String> ids) {
        logger.info("Received request to add {} games", ids.size());
        List<GameId> gameIds = new ArrayList<>();
        for (String id : ids) {
            try {
                gameIds.add(GameId.of(id));
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
            }
        }

        try {
            CollectionScraper.CollectionSummary summary = collectionScraper.addGames(gameIds);
            logger.info("Collection run completed. Games completed: {}", summary.completed());
            return ResponseEntity.ok(summary);
        } catch (Exception e) {
            logger.error("Error running collection", e);
            return ResponseEntity.internalServerError().build();
        }
    }

    @GetMapping("/games")
    public ResponseEntity<List<GameId>> games() {
        return ResponseEntity.ok(collectionScraper.games());
    }

    @GetMapping("/failures")
    public ResponseEntity<Map<GameId, GameFailure>> failures() {
        return ResponseEntity.ok(collectionScraper.failures());
    }

    @GetMapping("/play-by-play")
    public ResponseEntity<List<EnrichedEvent>> playByPlay() {
        return ResponseEntity.ok(collectionScraper.playByPlay());
    }

    /**
     * GET /collection/stats?level=game&amp;strength=true&amp;score=false&amp;lines=forwards
     */
    @GetMapping("/stats")
    public ResponseEntity<?> stats(@RequestParam(name = "level", defaultValue = "game") String level,
                                   @RequestParam(name = "strength", defaultValue = "false") boolean strength,
                                   @RequestParam(name = "score", defaultValue = "false") boolean score,
                                   @RequestParam(name = "lines", defaultValue = "forwards") String lines) {
        StatsGrouping.Level parsed;
        try {
            parsed = StatsGrouping.Level.valueOf(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "unknown level " + level));
        }
        StatsGrouping.LineType lineType;
        try {
            lineType = StatsGrouping.LineType.valueOf(lines.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "unknown lines " + lines));
        }
        StatsTables tables = collectionScraper.stats(new StatsGrouping(parsed, strength, score, lineType));
        return ResponseEntity.ok(tables);
    }

    @PostMapping("/cancel")
    public ResponseEntity<Void> cancel() {
        collectionScraper.cancel();
        return ResponseEntity.accepted().build();
    }
}
