package com.rinkstats.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Canonical event with on-ice personnel, game state and shot geometry attached. Built once per
 * event by the assembler; the predicted-goal value is the only field added afterwards, through
 * {@link #withPredictedGoal(Double)}, which returns a copy.
 */
@JsonDeserialize(builder = EnrichedEvent.Builder.class)
@JsonIgnoreProperties(value = {"gameId"}, allowGetters = true)
public final class EnrichedEvent {

    private final CanonicalEvent event;
    private final String homeTeam;
    private final String awayTeam;
    private final Venue eventVenue;
    private final OnIcePersonnel homeOnIce;
    private final OnIcePersonnel awayOnIce;
    private final int homeSkaters;
    private final int awaySkaters;
    private final String strengthState;
    private final String homeStrengthState;
    private final int homeScore;
    private final int awayScore;
    private final int scoreDiff;
    private final String zone;
    private final Double shotDistance;
    private final Double shotAngle;
    private final boolean danger;
    private final boolean highDanger;
    private final Integer secondsSinceLast;
    private final Set<DiagnosticFlag> flags;
    private final Double predictedGoal;

    private EnrichedEvent(Builder builder) {
        this.event = builder.event;
        this.homeTeam = builder.homeTeam;
        this.awayTeam = builder.awayTeam;
        this.eventVenue = builder.eventVenue;
        this.homeOnIce = builder.homeOnIce == null ? OnIcePersonnel.EMPTY : builder.homeOnIce;
        this.awayOnIce = builder.awayOnIce == null ? OnIcePersonnel.EMPTY : builder.awayOnIce;
        this.homeSkaters = builder.homeSkaters;
        this.awaySkaters = builder.awaySkaters;
        this.strengthState = builder.strengthState;
        this.homeStrengthState = builder.homeStrengthState;
        this.homeScore = builder.homeScore;
        this.awayScore = builder.awayScore;
        this.scoreDiff = builder.scoreDiff;
        this.zone = builder.zone;
        this.shotDistance = builder.shotDistance;
        this.shotAngle = builder.shotAngle;
        this.danger = builder.danger;
        this.highDanger = builder.highDanger;
        this.secondsSinceLast = builder.secondsSinceLast;
        this.flags = builder.flags == null || builder.flags.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(EnumSet.copyOf(builder.flags));
        this.predictedGoal = builder.predictedGoal;
    }

    public static Builder builder() {
        return new Builder();
    }

    public EnrichedEvent withPredictedGoal(Double value) {
        Builder copy = new Builder()
            .event(event)
            .homeTeam(homeTeam)
            .awayTeam(awayTeam)
            .eventVenue(eventVenue)
            .homeOnIce(homeOnIce)
            .awayOnIce(awayOnIce)
            .homeSkaters(homeSkaters)
            .awaySkaters(awaySkaters)
            .strengthState(strengthState)
            .homeStrengthState(homeStrengthState)
            .homeScore(homeScore)
            .awayScore(awayScore)
            .scoreDiff(scoreDiff)
            .zone(zone)
            .shotDistance(shotDistance)
            .shotAngle(shotAngle)
            .danger(danger)
            .highDanger(highDanger)
            .secondsSinceLast(secondsSinceLast)
            .flags(flags)
            .predictedGoal(value);
        return copy.build();
    }

    public GameId getGameId() {
        return event.getGameId();
    }

    public OnIcePersonnel onIce(Venue venue) {
        return venue == Venue.HOME ? homeOnIce : awayOnIce;
    }

    public CanonicalEvent getEvent() {
        return event;
    }

    public String getHomeTeam() {
        return homeTeam;
    }

    public String getAwayTeam() {
        return awayTeam;
    }

    /** Venue of the team credited with the event; null for non-team events. */
    public Venue getEventVenue() {
        return eventVenue;
    }

    public OnIcePersonnel getHomeOnIce() {
        return homeOnIce;
    }

    public OnIcePersonnel getAwayOnIce() {
        return awayOnIce;
    }

    public int getHomeSkaters() {
        return homeSkaters;
    }

    public int getAwaySkaters() {
        return awaySkaters;
    }

    /** Strength from the event team's point of view, e.g. "5v4"; home point of view for non-team events. */
    public String getStrengthState() {
        return strengthState;
    }

    public String getHomeStrengthState() {
        return homeStrengthState;
    }

    /** Home goals scored strictly before this event. */
    public int getHomeScore() {
        return homeScore;
    }

    public int getAwayScore() {
        return awayScore;
    }

    /** Goal differential from the event team's point of view. */
    public int getScoreDiff() {
        return scoreDiff;
    }

    public String getZone() {
        return zone;
    }

    public Double getShotDistance() {
        return shotDistance;
    }

    public Double getShotAngle() {
        return shotAngle;
    }

    public boolean isDanger() {
        return danger;
    }

    public boolean isHighDanger() {
        return highDanger;
    }

    public Integer getSecondsSinceLast() {
        return secondsSinceLast;
    }

    public Set<DiagnosticFlag> getFlags() {
        return flags;
    }

    public Double getPredictedGoal() {
        return predictedGoal;
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {

        private CanonicalEvent event;
        private String homeTeam;
        private String awayTeam;
        private Venue eventVenue;
        private OnIcePersonnel homeOnIce;
        private OnIcePersonnel awayOnIce;
        private int homeSkaters;
        private int awaySkaters;
        private String strengthState;
        private String homeStrengthState;
        private int homeScore;
        private int awayScore;
        private int scoreDiff;
        private String zone;
        private Double shotDistance;
        private Double shotAngle;
        private boolean danger;
        private boolean highDanger;
        private Integer secondsSinceLast;
        private Set<DiagnosticFlag> flags;
        private Double predictedGoal;

        private Builder() {
        }

        public Builder event(CanonicalEvent event) {
            this.event = event;
            return this;
        }

        public Builder homeTeam(String homeTeam) {
            this.homeTeam = homeTeam;
            return this;
        }

        public Builder awayTeam(String awayTeam) {
            this.awayTeam = awayTeam;
            return this;
        }

        public Builder eventVenue(Venue eventVenue) {
            this.eventVenue = eventVenue;
            return this;
        }

        public Builder homeOnIce(OnIcePersonnel homeOnIce) {
            this.homeOnIce = homeOnIce;
            return this;
        }

        public Builder awayOnIce(OnIcePersonnel awayOnIce) {
            this.awayOnIce = awayOnIce;
            return this;
        }

        public Builder homeSkaters(int homeSkaters) {
            this.homeSkaters = homeSkaters;
            return this;
        }

        public Builder awaySkaters(int awaySkaters) {
            this.awaySkaters = awaySkaters;
            return this;
        }

        public Builder strengthState(String strengthState) {
            this.strengthState = strengthState;
            return this;
        }

        public Builder homeStrengthState(String homeStrengthState) {
            this.homeStrengthState = homeStrengthState;
            return this;
        }

        public Builder homeScore(int homeScore) {
            this.homeScore = homeScore;
            return this;
        }

        public Builder awayScore(int awayScore) {
            this.awayScore = awayScore;
            return this;
        }

        public Builder scoreDiff(int scoreDiff) {
            this.scoreDiff = scoreDiff;
            return this;
        }

        public Builder zone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder shotDistance(Double shotDistance) {
            this.shotDistance = shotDistance;
            return this;
        }

        public Builder shotAngle(Double shotAngle) {
            this.shotAngle = shotAngle;
            return this;
        }

        public Builder danger(boolean danger) {
            this.danger = danger;
            return this;
        }

        public Builder highDanger(boolean highDanger) {
            this.highDanger = highDanger;
            return this;
        }

        public Builder secondsSinceLast(Integer secondsSinceLast) {
            this.secondsSinceLast = secondsSinceLast;
            return this;
        }

        public Builder flags(Set<DiagnosticFlag> flags) {
            this.flags = flags;
            return this;
        }

        public Builder predictedGoal(Double predictedGoal) {
            this.predictedGoal = predictedGoal;
            return this;
        }

        public EnrichedEvent build() {
            if (event == null) {
                throw new IllegalStateException("event is required");
            }
            return new EnrichedEvent(this);
        }
    }
}
