package com.rinkstats.infrastructure.scoring;

import com.rinkstats.domain.model.ShotFeatures;
import com.rinkstats.domain.ports.ScoringFunction;

import java.util.Map;

/**
 * Baseline logistic shot model used when no trained model is plugged in. Coefficients are on the
 * log-odds scale.
 */
public class LogisticShotModel implements ScoringFunction {

    private static final Map<String, Double> SHOT_TYPE_OFFSETS = Map.of(
        "WRIST", 0.0,
        "SNAP", 0.1,
        "SLAP", 0.05,
        "BACKHAND", -0.05,
        "TIP-IN", 0.2,
        "DEFLECTED", 0.15,
        "WRAP-AROUND", -0.3
    );

    private final double intercept;
    private final double distanceWeight;
    private final double angleWeight;
    private final double reboundWeight;
    private final double rushWeight;
    private final double emptyNetWeight;
    private final double highDangerWeight;
    private final double powerPlayWeight;

    public LogisticShotModel() {
        this(-1.2, -0.045, -0.012, 0.9, 0.35, 3.0, 0.4, 0.3);
    }

    public LogisticShotModel(double intercept, double distanceWeight, double angleWeight, double reboundWeight,
                             double rushWeight, double emptyNetWeight, double highDangerWeight,
                             double powerPlayWeight) {
        this.intercept = intercept;
        this.distanceWeight = distanceWeight;
        this.angleWeight = angleWeight;
        this.reboundWeight = reboundWeight;
        this.rushWeight = rushWeight;
        this.emptyNetWeight = emptyNetWeight;
        this.highDangerWeight = highDangerWeight;
        this.powerPlayWeight = powerPlayWeight;
    }

    @Override
    public double predictGoal(ShotFeatures features) {
        double logit = intercept
            + distanceWeight * features.distance()
            + angleWeight * features.angle()
            + SHOT_TYPE_OFFSETS.getOrDefault(features.shotType(), 0.0);
        if (features.rebound()) {
            logit += reboundWeight;
        }
        if (features.rushAttempt()) {
            logit += rushWeight;
        }
        if (features.emptyNet()) {
            logit += emptyNetWeight;
        }
        if (features.highDanger()) {
            logit += highDangerWeight;
        }
        logit += powerPlayWeight * skaterAdvantage(features.strengthState());
        return 1.0 / (1.0 + Math.exp(-logit));
    }

    /**
     * Skater difference from the shooting side, clamped to [-2, 2]; 0 when unknown.
     */
    static int skaterAdvantage(String strengthState) {
        if (strengthState == null) {
            return 0;
        }
        String[] sides = strengthState.split("v");
        if (sides.length != 2) {
            return 0;
        }
        try {
            int difference = Integer.parseInt(sides[0]) - Integer.parseInt(sides[1]);
            return Math.max(-2, Math.min(2, difference));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
