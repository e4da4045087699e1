package com.rinkstats.domain.ports;

import com.rinkstats.domain.model.ShotFeatures;

/**
 * Externally supplied shot model.
 */
public interface ScoringFunction {

    /**
     * @return probability in [0, 1] that the attempt described by the features is a goal
     */
    double predictGoal(ShotFeatures features);
}
