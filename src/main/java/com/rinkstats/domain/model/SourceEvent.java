package com.rinkstats.domain.model;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Event as reported by a single source, before reconciliation. Mutable so corrections and
 * identity resolution can be applied in place on the stream they belong to.
 */
public class SourceEvent {

    /** Game the event belongs to. */
    private GameId gameId;

    /** API_EVENTS or HTML_EVENTS. */
    private SourceKind source;

    /** Position of the event within its source stream (API sort order, HTML event number). */
    private int eventIdx;

    private Integer period;

    /** Elapsed seconds in the period; null when the clock could not be read. */
    private Integer periodSeconds;

    private Integer gameSeconds;

    /** Clock text as published. */
    private String rawTime;

    private EventType eventType;

    /** Source type code before mapping (API typeDescKey, HTML event code). */
    private String rawType;

    private String description;

    /** Strength label printed on the HTML report (EV, PP, SH). */
    private String strength;

    /** Team credited with the event, three-letter code. */
    private String eventTeam;

    private Double coordsX;

    private Double coordsY;

    /** Zone relative to the event team: OFF, NEU or DEF. */
    private String zone;

    /** Involved players, at most three, in source order. */
    private List<EventPlayer> players = new ArrayList<>();

    /** Goalie of the defending team on shot events. */
    private PlayerRef opposingGoalie;

    private String shotType;

    private Integer shotDistance;

    private String missReason;

    private String penalty;

    private Integer penaltyMinutes;

    private String stoppageReason;

    /** API situation code: away goalie, away skaters, home skaters, home goalie. */
    private String situationCode;

    /** Side of the rink defended by the home team, "left" or "right". */
    private String homeDefendingSide;

    private boolean penaltyShot;

    /** Distinguishes events sharing type, clock and first player within one stream. */
    private int version;

    private Set<DiagnosticFlag> flags = EnumSet.noneOf(DiagnosticFlag.class);

    public PlayerRef player(int slot) {
        return slot < players.size() ? players.get(slot).player() : null;
    }

    public String role(int slot) {
        return slot < players.size() ? players.get(slot).role() : null;
    }

    public void addPlayer(PlayerRef player, String role) {
        players.add(new EventPlayer(player, role));
    }

    /**
     * Puts a player in a slot (0-based), padding skipped slots with empty entries. A null role keeps
     * the role already recorded for the slot.
     */
    public void setPlayer(int slot, PlayerRef player, String role) {
        while (players.size() <= slot) {
            players.add(new EventPlayer(null, null));
        }
        String effectiveRole = role != null ? role : players.get(slot).role();
        players.set(slot, new EventPlayer(player, effectiveRole));
    }

    public void clearPlayer(int slot) {
        if (slot < players.size()) {
            players.set(slot, new EventPlayer(null, null));
        }
    }

    /** Exchanges the players of two slots; the roles stay with the slots. */
    public void swapPlayers(int first, int second) {
        PlayerRef a = player(first);
        PlayerRef b = player(second);
        setPlayer(first, b, null);
        setPlayer(second, a, null);
    }

    public void addFlag(DiagnosticFlag flag) {
        flags.add(flag);
    }

    public boolean hasFlag(DiagnosticFlag flag) {
        return flags.contains(flag);
    }

    public GameId getGameId() {
        return gameId;
    }

    public void setGameId(GameId gameId) {
        this.gameId = gameId;
    }

    public SourceKind getSource() {
        return source;
    }

    public void setSource(SourceKind source) {
        this.source = source;
    }

    public int getEventIdx() {
        return eventIdx;
    }

    public void setEventIdx(int eventIdx) {
        this.eventIdx = eventIdx;
    }

    public Integer getPeriod() {
        return period;
    }

    public void setPeriod(Integer period) {
        this.period = period;
    }

    public Integer getPeriodSeconds() {
        return periodSeconds;
    }

    public void setPeriodSeconds(Integer periodSeconds) {
        this.periodSeconds = periodSeconds;
    }

    public Integer getGameSeconds() {
        return gameSeconds;
    }

    public void setGameSeconds(Integer gameSeconds) {
        this.gameSeconds = gameSeconds;
    }

    public String getRawTime() {
        return rawTime;
    }

    public void setRawTime(String rawTime) {
        this.rawTime = rawTime;
    }

    public EventType getEventType() {
        return eventType;
    }

    public void setEventType(EventType eventType) {
        this.eventType = eventType;
    }

    public String getRawType() {
        return rawType;
    }

    public void setRawType(String rawType) {
        this.rawType = rawType;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getStrength() {
        return strength;
    }

    public void setStrength(String strength) {
        this.strength = strength;
    }

    public String getEventTeam() {
        return eventTeam;
    }

    public void setEventTeam(String eventTeam) {
        this.eventTeam = eventTeam;
    }

    public Double getCoordsX() {
        return coordsX;
    }

    public void setCoordsX(Double coordsX) {
        this.coordsX = coordsX;
    }

    public Double getCoordsY() {
        return coordsY;
    }

    public void setCoordsY(Double coordsY) {
        this.coordsY = coordsY;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public List<EventPlayer> getPlayers() {
        return players;
    }

    public void setPlayers(List<EventPlayer> players) {
        this.players = players == null ? new ArrayList<>() : new ArrayList<>(players);
    }

    public PlayerRef getOpposingGoalie() {
        return opposingGoalie;
    }

    public void setOpposingGoalie(PlayerRef opposingGoalie) {
        this.opposingGoalie = opposingGoalie;
    }

    public String getShotType() {
        return shotType;
    }

    public void setShotType(String shotType) {
        this.shotType = shotType;
    }

    public Integer getShotDistance() {
        return shotDistance;
    }

    public void setShotDistance(Integer shotDistance) {
        this.shotDistance = shotDistance;
    }

    public String getMissReason() {
        return missReason;
    }

    public void setMissReason(String missReason) {
        this.missReason = missReason;
    }

    public String getPenalty() {
        return penalty;
    }

    public void setPenalty(String penalty) {
        this.penalty = penalty;
    }

    public Integer getPenaltyMinutes() {
        return penaltyMinutes;
    }

    public void setPenaltyMinutes(Integer penaltyMinutes) {
        this.penaltyMinutes = penaltyMinutes;
    }

    public String getStoppageReason() {
        return stoppageReason;
    }

    public void setStoppageReason(String stoppageReason) {
        this.stoppageReason = stoppageReason;
    }

    public String getSituationCode() {
        return situationCode;
    }

    public void setSituationCode(String situationCode) {
        this.situationCode = situationCode;
    }

    public String getHomeDefendingSide() {
        return homeDefendingSide;
    }

    public void setHomeDefendingSide(String homeDefendingSide) {
        this.homeDefendingSide = homeDefendingSide;
    }

    public boolean isPenaltyShot() {
        return penaltyShot;
    }

    public void setPenaltyShot(boolean penaltyShot) {
        this.penaltyShot = penaltyShot;
    }

    public int getVersion() {
        return version;
    }

    public void setVersion(int version) {
        this.version = version;
    }

    public Set<DiagnosticFlag> getFlags() {
        return flags;
    }

    public void setFlags(Set<DiagnosticFlag> flags) {
        this.flags = flags == null || flags.isEmpty() ? EnumSet.noneOf(DiagnosticFlag.class) : EnumSet.copyOf(flags);
    }

    @Override
    public String toString() {
        return source + "#" + eventIdx + " " + eventType + " P" + period + " " + rawTime + " " + eventTeam;
    }
}
