package com.rinkstats.application.scoring;

import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.Position;
import com.rinkstats.domain.model.ShotFeatures;
import com.rinkstats.domain.ports.ScoringFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Applies the scoring function to goals, shots and missed shots that have a location.
 * Blocked shots and penalty-shot or shootout attempts are never scored.
 */
public class ScoringAdapter {

    private static final Logger logger = LoggerFactory.getLogger(ScoringAdapter.class);

    static final int MAX_SCORE_DIFF = 4;
    static final int REBOUND_SECONDS = 2;
    static final int RUSH_SECONDS = 4;

    private final ScoringFunction scoringFunction;

    public ScoringAdapter(ScoringFunction scoringFunction) {
        this.scoringFunction = scoringFunction;
    }

    public List<EnrichedEvent> score(GameId gameId, List<EnrichedEvent> events) {
        List<EnrichedEvent> scored = new ArrayList<>(events.size());
        int attempts = 0;
        int rejected = 0;
        EnrichedEvent previous = null;
        for (EnrichedEvent event : events) {
            EnrichedEvent result = event;
            if (isEligible(event)) {
                attempts++;
                ShotFeatures features = features(event, previous);
                double value = scoringFunction.predictGoal(features);
                if (Double.isNaN(value) || value < 0 || value > 1) {
                    rejected++;
                    logger.warn("{} event {}: scoring function returned {} outside [0, 1]", gameId,
                        event.getEvent().getEventIdx(), value);
                } else {
                    result = event.withPredictedGoal(value);
                }
            }
            scored.add(result);
            previous = event;
        }
        logger.debug("{} scored {} shot attempts ({} rejected)", gameId, attempts - rejected, rejected);
        return scored;
    }

    public static boolean isEligible(EnrichedEvent event) {
        CanonicalEvent canonical = event.getEvent();
        return canonical.getEventType().isUnblockedShotAttempt()
            && canonical.getCoordsX() != null
            && canonical.getCoordsY() != null
            && event.getShotDistance() != null
            && !"1v0".equals(event.getStrengthState())
            && !canonical.isPenaltyShot();
    }

    static ShotFeatures features(EnrichedEvent event, EnrichedEvent previous) {
        CanonicalEvent shot = event.getEvent();
        Integer secondsSinceLast = event.getSecondsSinceLast();
        Double distanceFromLast = null;
        EventType lastType = null;
        boolean sameTeam = false;
        boolean rebound = false;
        boolean rush = false;
        if (previous != null) {
            CanonicalEvent last = previous.getEvent();
            lastType = last.getEventType();
            sameTeam = shot.getEventTeam() != null && shot.getEventTeam().equals(last.getEventTeam());
            if (last.getCoordsX() != null && last.getCoordsY() != null) {
                distanceFromLast = Math.hypot(shot.getCoordsX() - last.getCoordsX(), shot.getCoordsY() - last.getCoordsY());
            }
            if (secondsSinceLast != null) {
                rebound = lastType.isShotAttempt() && sameTeam && secondsSinceLast <= REBOUND_SECONDS;
                rush = secondsSinceLast <= RUSH_SECONDS && previous.getZone() != null
                    && isOwnHalfZone(previous, sameTeam);
            }
        }

        return new ShotFeatures(
            shot.getEventType(),
            shot.getShotType(),
            event.getShotDistance(),
            event.getShotAngle() == null ? 0.0 : event.getShotAngle(),
            event.getStrengthState(),
            Math.max(-MAX_SCORE_DIFF, Math.min(MAX_SCORE_DIFF, event.getScoreDiff())),
            secondsSinceLast,
            distanceFromLast,
            lastType,
            sameTeam,
            rebound,
            rush,
            positionGroup(shot.player(0)),
            isEmptyNet(event.getStrengthState()),
            event.isHighDanger(),
            event.isDanger()
        );
    }

    /**
     * The previous event happened in the shooting team's neutral or defensive zone. Zones are
     * recorded from the previous event team's side.
     */
    private static boolean isOwnHalfZone(EnrichedEvent previous, boolean sameTeam) {
        String zone = previous.getZone();
        if (zone.equals("NEU")) {
            return true;
        }
        return sameTeam ? zone.equals("DEF") : zone.equals("OFF");
    }

    static String positionGroup(PlayerRef shooter) {
        if (shooter == null || shooter.position() == null) {
            return null;
        }
        Position position = shooter.position();
        if (position.isGoalie()) {
            return "G";
        }
        return position == Position.D ? "D" : "F";
    }

    private static boolean isEmptyNet(String strengthState) {
        return strengthState != null && strengthState.endsWith("vE");
    }
}
