package com.rinkstats.domain.model;

/**
 * A player slot on an event with the role the source assigns to it.
 */
public record EventPlayer(PlayerRef player, String role) {

    public static final String WINNER = "WINNER";
    public static final String LOSER = "LOSER";
    public static final String HITTER = "HITTER";
    public static final String HITTEE = "HITTEE";
    public static final String GIVER = "GIVER";
    public static final String TAKER = "TAKER";
    public static final String SHOOTER = "SHOOTER";
    public static final String BLOCKER = "BLOCKER";
    public static final String GOAL_SCORER = "GOAL SCORER";
    public static final String PRIMARY_ASSIST = "PRIMARY ASSIST";
    public static final String SECONDARY_ASSIST = "SECONDARY ASSIST";
    public static final String COMMITTED_BY = "COMMITTED BY";
    public static final String DRAWN_BY = "DRAWN BY";
    public static final String SERVED_BY = "SERVED BY";

    public EventPlayer withPlayer(PlayerRef replacement) {
        return new EventPlayer(replacement, role);
    }

    public EventPlayer withRole(String replacement) {
        return new EventPlayer(player, replacement);
    }
}
