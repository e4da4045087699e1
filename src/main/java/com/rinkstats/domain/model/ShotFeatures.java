package com.rinkstats.domain.model;

/**
 * Feature vector handed to the scoring function for one unblocked shot attempt.
 *
 * @param strengthState event-team strength, e.g. "5v4"
 * @param scoreDiff event-team goal differential clamped to [-4, 4]
 * @param positionGroup F, D or G
 * @param emptyNet no goalie defending the shot
 */
public record ShotFeatures(
    EventType eventType,
    String shotType,
    double distance,
    double angle,
    String strengthState,
    int scoreDiff,
    Integer secondsSinceLast,
    Double distanceFromLast,
    EventType lastEventType,
    boolean sameTeamAsLast,
    boolean rebound,
    boolean rushAttempt,
    String positionGroup,
    boolean emptyNet,
    boolean highDanger,
    boolean danger
) {
}
