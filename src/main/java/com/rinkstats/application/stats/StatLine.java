package com.rinkstats.application.stats;

import com.rinkstats.domain.model.Position;

/**
 * Counting stats for one player or team under one {@link StatKey}. Individual counts credit the
 * player (or, on team lines, any player of the team); the for/against counts are on-ice totals.
 */
public class StatLine {

    private final StatKey key;
    private String playerName;
    private Position position;

    private int goals;
    private int primaryAssists;
    private int secondaryAssists;
    private int shots;
    private int fenwick;
    private int corsi;
    private double expectedGoals;
    private int blocks;
    private int hits;
    private int hitsTaken;
    private int penaltiesTaken;
    private int penaltyMinutes;
    private int penaltiesDrawn;
    private int giveaways;
    private int takeaways;
    private int faceoffsWon;
    private int faceoffsLost;

    private int goalsFor;
    private int goalsAgainst;
    private int shotsFor;
    private int shotsAgainst;
    private int fenwickFor;
    private int fenwickAgainst;
    private int corsiFor;
    private int corsiAgainst;
    private double expectedGoalsFor;
    private double expectedGoalsAgainst;
    private int timeOnIce;

    StatLine(StatKey key) {
        this.key = key;
    }

    void describe(String playerName, Position position) {
        if (this.playerName == null) {
            this.playerName = playerName;
        }
        if (this.position == null) {
            this.position = position;
        }
    }

    void addGoal() {
        goals++;
    }

    void addPrimaryAssist() {
        primaryAssists++;
    }

    void addSecondaryAssist() {
        secondaryAssists++;
    }

    /**
     * Credits an individual shot attempt.
     *
     * @param onGoal the attempt reached the net
     * @param blocked the attempt was blocked
     */
    void addAttempt(boolean onGoal, boolean blocked, double xg) {
        corsi++;
        if (!blocked) {
            fenwick++;
            expectedGoals += xg;
        }
        if (onGoal) {
            shots++;
        }
    }

    void addBlock() {
        blocks++;
    }

    void addHit() {
        hits++;
    }

    void addHitTaken() {
        hitsTaken++;
    }

    void addPenaltyTaken(int minutes) {
        penaltiesTaken++;
        penaltyMinutes += minutes;
    }

    void addPenaltyDrawn() {
        penaltiesDrawn++;
    }

    void addGiveaway() {
        giveaways++;
    }

    void addTakeaway() {
        takeaways++;
    }

    void addFaceoff(boolean won) {
        if (won) {
            faceoffsWon++;
        } else {
            faceoffsLost++;
        }
    }

    /**
     * Adds play time, in seconds, from one event to the next.
     */
    void addTimeOnIce(int seconds) {
        timeOnIce += seconds;
    }

    void addOnIceAttempt(boolean forTeam, boolean goal, boolean onGoal, boolean blocked, double xg) {
        if (forTeam) {
            corsiFor++;
            fenwickFor += blocked ? 0 : 1;
            shotsFor += onGoal ? 1 : 0;
            goalsFor += goal ? 1 : 0;
            expectedGoalsFor += blocked ? 0 : xg;
        } else {
            corsiAgainst++;
            fenwickAgainst += blocked ? 0 : 1;
            shotsAgainst += onGoal ? 1 : 0;
            goalsAgainst += goal ? 1 : 0;
            expectedGoalsAgainst += blocked ? 0 : xg;
        }
    }

    public StatKey getKey() {
        return key;
    }

    public String getPlayerName() {
        return playerName;
    }

    public Position getPosition() {
        return position;
    }

    public int getGoals() {
        return goals;
    }

    public int getPrimaryAssists() {
        return primaryAssists;
    }

    public int getSecondaryAssists() {
        return secondaryAssists;
    }

    public int getPoints() {
        return goals + primaryAssists + secondaryAssists;
    }

    public int getShots() {
        return shots;
    }

    public int getFenwick() {
        return fenwick;
    }

    public int getCorsi() {
        return corsi;
    }

    public double getExpectedGoals() {
        return expectedGoals;
    }

    public int getBlocks() {
        return blocks;
    }

    public int getHits() {
        return hits;
    }

    public int getHitsTaken() {
        return hitsTaken;
    }

    public int getPenaltiesTaken() {
        return penaltiesTaken;
    }

    public int getPenaltyMinutes() {
        return penaltyMinutes;
    }

    public int getPenaltiesDrawn() {
        return penaltiesDrawn;
    }

    public int getGiveaways() {
        return giveaways;
    }

    public int getTakeaways() {
        return takeaways;
    }

    public int getFaceoffsWon() {
        return faceoffsWon;
    }

    public int getFaceoffsLost() {
        return faceoffsLost;
    }

    public int getGoalsFor() {
        return goalsFor;
    }

    public int getGoalsAgainst() {
        return goalsAgainst;
    }

    public int getShotsFor() {
        return shotsFor;
    }

    public int getShotsAgainst() {
        return shotsAgainst;
    }

    public int getFenwickFor() {
        return fenwickFor;
    }

    public int getFenwickAgainst() {
        return fenwickAgainst;
    }

    public int getCorsiFor() {
        return corsiFor;
    }

    public int getCorsiAgainst() {
        return corsiAgainst;
    }

    public double getExpectedGoalsFor() {
        return expectedGoalsFor;
    }

    public double getExpectedGoalsAgainst() {
        return expectedGoalsAgainst;
    }

    /**
     * Seconds on the ice; for a team, seconds played under the key.
     */
    public int getTimeOnIce() {
        return timeOnIce;
    }
}
