package com.rinkstats.domain.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single real-world game occurrence after both event streams have been merged.
 */
@JsonDeserialize(builder = CanonicalEvent.Builder.class)
public final class CanonicalEvent {

    private final GameId gameId;
    private final int eventIdx;
    private final int period;
    private final Integer periodSeconds;
    private final Integer gameSeconds;
    private final String periodTime;
    private final EventType eventType;
    private final String description;
    private final String eventTeam;
    private final String strength;
    private final String zone;
    private final Double coordsX;
    private final Double coordsY;
    private final List<EventPlayer> players;
    private final PlayerRef opposingGoalie;
    private final String shotType;
    private final Integer shotDistance;
    private final String missReason;
    private final String penalty;
    private final Integer penaltyMinutes;
    private final String stoppageReason;
    private final String situationCode;
    private final String homeDefendingSide;
    private final boolean penaltyShot;
    private final EventProvenance provenance;

    private CanonicalEvent(Builder builder) {
        this.gameId = builder.gameId;
        this.eventIdx = builder.eventIdx;
        this.period = builder.period;
        this.periodSeconds = builder.periodSeconds;
        this.gameSeconds = builder.gameSeconds;
        this.periodTime = builder.periodTime;
        this.eventType = builder.eventType;
        this.description = builder.description;
        this.eventTeam = builder.eventTeam;
        this.strength = builder.strength;
        this.zone = builder.zone;
        this.coordsX = builder.coordsX;
        this.coordsY = builder.coordsY;
        this.players = builder.players == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(builder.players));
        this.opposingGoalie = builder.opposingGoalie;
        this.shotType = builder.shotType;
        this.shotDistance = builder.shotDistance;
        this.missReason = builder.missReason;
        this.penalty = builder.penalty;
        this.penaltyMinutes = builder.penaltyMinutes;
        this.stoppageReason = builder.stoppageReason;
        this.situationCode = builder.situationCode;
        this.homeDefendingSide = builder.homeDefendingSide;
        this.penaltyShot = builder.penaltyShot;
        this.provenance = builder.provenance;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .gameId(gameId)
            .eventIdx(eventIdx)
            .period(period)
            .periodSeconds(periodSeconds)
            .gameSeconds(gameSeconds)
            .periodTime(periodTime)
            .eventType(eventType)
            .description(description)
            .eventTeam(eventTeam)
            .strength(strength)
            .zone(zone)
            .coordsX(coordsX)
            .coordsY(coordsY)
            .players(players)
            .opposingGoalie(opposingGoalie)
            .shotType(shotType)
            .shotDistance(shotDistance)
            .missReason(missReason)
            .penalty(penalty)
            .penaltyMinutes(penaltyMinutes)
            .stoppageReason(stoppageReason)
            .situationCode(situationCode)
            .homeDefendingSide(homeDefendingSide)
            .penaltyShot(penaltyShot)
            .provenance(provenance);
    }

    /** Player in the given slot (0-based), or null when the slot is empty. */
    public PlayerRef player(int slot) {
        return slot < players.size() ? players.get(slot).player() : null;
    }

    public String role(int slot) {
        return slot < players.size() ? players.get(slot).role() : null;
    }

    public GameId getGameId() {
        return gameId;
    }

    public int getEventIdx() {
        return eventIdx;
    }

    public int getPeriod() {
        return period;
    }

    public Integer getPeriodSeconds() {
        return periodSeconds;
    }

    public Integer getGameSeconds() {
        return gameSeconds;
    }

    public String getPeriodTime() {
        return periodTime;
    }

    public EventType getEventType() {
        return eventType;
    }

    public String getDescription() {
        return description;
    }

    public String getEventTeam() {
        return eventTeam;
    }

    public String getStrength() {
        return strength;
    }

    public String getZone() {
        return zone;
    }

    public Double getCoordsX() {
        return coordsX;
    }

    public Double getCoordsY() {
        return coordsY;
    }

    public List<EventPlayer> getPlayers() {
        return players;
    }

    public PlayerRef getOpposingGoalie() {
        return opposingGoalie;
    }

    public String getShotType() {
        return shotType;
    }

    public Integer getShotDistance() {
        return shotDistance;
    }

    public String getMissReason() {
        return missReason;
    }

    public String getPenalty() {
        return penalty;
    }

    public Integer getPenaltyMinutes() {
        return penaltyMinutes;
    }

    public String getStoppageReason() {
        return stoppageReason;
    }

    public String getSituationCode() {
        return situationCode;
    }

    public String getHomeDefendingSide() {
        return homeDefendingSide;
    }

    public boolean isPenaltyShot() {
        return penaltyShot;
    }

    public EventProvenance getProvenance() {
        return provenance;
    }

    @Override
    public String toString() {
        return "CanonicalEvent[" + gameId + " #" + eventIdx + " " + eventType + " P" + period + " "
            + periodTime + " " + eventTeam + " " + provenance.sources() + "]";
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {

        private GameId gameId;
        private int eventIdx;
        private int period;
        private Integer periodSeconds;
        private Integer gameSeconds;
        private String periodTime;
        private EventType eventType;
        private String description;
        private String eventTeam;
        private String strength;
        private String zone;
        private Double coordsX;
        private Double coordsY;
        private List<EventPlayer> players;
        private PlayerRef opposingGoalie;
        private String shotType;
        private Integer shotDistance;
        private String missReason;
        private String penalty;
        private Integer penaltyMinutes;
        private String stoppageReason;
        private String situationCode;
        private String homeDefendingSide;
        private boolean penaltyShot;
        private EventProvenance provenance = new EventProvenance(null, null, null, null);

        private Builder() {
        }

        public Builder gameId(GameId gameId) {
            this.gameId = gameId;
            return this;
        }

        public Builder eventIdx(int eventIdx) {
            this.eventIdx = eventIdx;
            return this;
        }

        public Builder period(int period) {
            this.period = period;
            return this;
        }

        public Builder periodSeconds(Integer periodSeconds) {
            this.periodSeconds = periodSeconds;
            return this;
        }

        public Builder gameSeconds(Integer gameSeconds) {
            this.gameSeconds = gameSeconds;
            return this;
        }

        public Builder periodTime(String periodTime) {
            this.periodTime = periodTime;
            return this;
        }

        public Builder eventType(EventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder eventTeam(String eventTeam) {
            this.eventTeam = eventTeam;
            return this;
        }

        public Builder strength(String strength) {
            this.strength = strength;
            return this;
        }

        public Builder zone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder coordsX(Double coordsX) {
            this.coordsX = coordsX;
            return this;
        }

        public Builder coordsY(Double coordsY) {
            this.coordsY = coordsY;
            return this;
        }

        public Builder players(List<EventPlayer> players) {
            this.players = players;
            return this;
        }

        public Builder opposingGoalie(PlayerRef opposingGoalie) {
            this.opposingGoalie = opposingGoalie;
            return this;
        }

        public Builder shotType(String shotType) {
            this.shotType = shotType;
            return this;
        }

        public Builder shotDistance(Integer shotDistance) {
            this.shotDistance = shotDistance;
            return this;
        }

        public Builder missReason(String missReason) {
            this.missReason = missReason;
            return this;
        }

        public Builder penalty(String penalty) {
            this.penalty = penalty;
            return this;
        }

        public Builder penaltyMinutes(Integer penaltyMinutes) {
            this.penaltyMinutes = penaltyMinutes;
            return this;
        }

        public Builder stoppageReason(String stoppageReason) {
            this.stoppageReason = stoppageReason;
            return this;
        }

        public Builder situationCode(String situationCode) {
            this.situationCode = situationCode;
            return this;
        }

        public Builder homeDefendingSide(String homeDefendingSide) {
            this.homeDefendingSide = homeDefendingSide;
            return this;
        }

        public Builder penaltyShot(boolean penaltyShot) {
            this.penaltyShot = penaltyShot;
            return this;
        }

        public Builder provenance(EventProvenance provenance) {
            this.provenance = provenance;
            return this;
        }

        public CanonicalEvent build() {
            if (gameId == null || eventType == null) {
                throw new IllegalStateException("gameId and eventType are required");
            }
            return new CanonicalEvent(this);
        }
    }
}
