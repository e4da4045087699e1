package com.rinkstats.infrastructure.scoring;

import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.ShotFeatures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for LogisticShotModel.
 */
class LogisticShotModelTest {

    private LogisticShotModel model;

    @BeforeEach
    void setUp() {
        model = new LogisticShotModel();
    }

    @Test
    void testProbabilityRange() {
        for (double distance = 0; distance <= 200; distance += 10) {
            double value = model.predictGoal(features(distance, "5v5", false, false));
            assertTrue(value > 0 && value < 1, "value " + value + " at " + distance);
        }
    }

    @Test
    void testCloserShotsAreMoreDangerous() {
        assertTrue(model.predictGoal(features(10, "5v5", false, false))
            > model.predictGoal(features(50, "5v5", false, false)));
    }

    @Test
    void testBonuses() {
        double base = model.predictGoal(features(30, "5v5", false, false));

        assertTrue(model.predictGoal(features(30, "5v4", false, false)) > base);
        assertTrue(model.predictGoal(features(30, "4v5", false, false)) < base);
        assertTrue(model.predictGoal(features(30, "5v5", true, false)) > base);
        assertTrue(model.predictGoal(features(30, "5v5", false, true)) > base);
    }

    @Test
    void testInterceptOnly() {
        LogisticShotModel flat = new LogisticShotModel(0, 0, 0, 0, 0, 0, 0, 0);

        assertEquals(0.5, flat.predictGoal(features(40, "5v5", true, true)), 1e-12);
    }

    @Test
    void testSkaterAdvantage() {
        assertEquals(1, LogisticShotModel.skaterAdvantage("5v4"));
        assertEquals(2, LogisticShotModel.skaterAdvantage("6v3"));
        assertEquals(-2, LogisticShotModel.skaterAdvantage("3v6"));
        assertEquals(0, LogisticShotModel.skaterAdvantage("6vE"));
        assertEquals(0, LogisticShotModel.skaterAdvantage(null));
        assertEquals(0, LogisticShotModel.skaterAdvantage("ILLEGAL"));
    }

    private static ShotFeatures features(double distance, String state, boolean rebound, boolean emptyNet) {
        return new ShotFeatures(EventType.SHOT, "WRIST", distance, 15.0, state, 0, 10, null, EventType.FAC,
            false, rebound, false, "F", emptyNet, false, false);
    }
}
