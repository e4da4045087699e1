package com.rinkstats.infrastructure.scraper.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.rinkstats.domain.model.EventPlayer;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.Venue;
import com.rinkstats.domain.ports.SourceNormalizer;
import com.rinkstats.infrastructure.scraper.EventVersions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Events from the plays block of the play-by-play document, mapped onto the report event codes.
 */
public class ApiEventsNormalizer implements SourceNormalizer<SourceEvent> {

    private static final Logger logger = LoggerFactory.getLogger(ApiEventsNormalizer.class);

    private static final Map<String, EventType> EVENT_TYPES = Map.ofEntries(
        Map.entry("period-start", EventType.PSTR),
        Map.entry("period-end", EventType.PEND),
        Map.entry("game-end", EventType.GEND),
        Map.entry("shootout-complete", EventType.SOC),
        Map.entry("faceoff", EventType.FAC),
        Map.entry("stoppage", EventType.STOP),
        Map.entry("hit", EventType.HIT),
        Map.entry("giveaway", EventType.GIVE),
        Map.entry("takeaway", EventType.TAKE),
        Map.entry("shot-on-goal", EventType.SHOT),
        Map.entry("missed-shot", EventType.MISS),
        Map.entry("failed-shot-attempt", EventType.MISS),
        Map.entry("blocked-shot", EventType.BLOCK),
        Map.entry("goal", EventType.GOAL),
        Map.entry("penalty", EventType.PENL),
        Map.entry("delayed-penalty", EventType.DELPEN)
    );

    @Override
    public List<SourceKind> kinds() {
        return List.of(SourceKind.API_EVENTS);
    }

    @Override
    public List<SourceEvent> normalize(RawSource source) throws SourceParseException {
        JsonNode root = ApiJson.readTree(source);
        Map<Integer, Map.Entry<Venue, String>> teams = ApiJson.teamsById(root, source);
        JsonNode plays = root.get("plays");
        if (plays == null || !plays.isArray()) {
            throw new SourceParseException(source.gameId(), source.kind(), "Missing plays array");
        }
        SessionType session = source.gameId().sessionType();

        List<SourceEvent> events = new ArrayList<>();
        int skipped = 0;
        for (JsonNode play : plays) {
            String typeKey = ApiJson.textOrNull(play, "typeDescKey");
            EventType type = typeKey == null ? null : EVENT_TYPES.get(typeKey);
            if (type == null) {
                skipped++;
                continue;
            }

            SourceEvent event = new SourceEvent();
            event.setGameId(source.gameId());
            event.setSource(SourceKind.API_EVENTS);
            Integer sortOrder = ApiJson.intOrNull(play, "sortOrder");
            Integer eventId = ApiJson.intOrNull(play, "eventId");
            event.setEventIdx(sortOrder != null ? sortOrder : eventId != null ? eventId : events.size() + 1);
            event.setEventType(type);
            event.setRawType(typeKey);
            event.setPeriod(period(play));
            event.setRawTime(ApiJson.textOrNull(play, "timeInPeriod"));
            event.setPeriodSeconds(GameClock.parseClock(event.getRawTime()));
            if (event.getPeriod() != null && event.getPeriodSeconds() != null) {
                event.setGameSeconds(GameClock.gameSeconds(session, event.getPeriod(), event.getPeriodSeconds()));
            }
            event.setSituationCode(ApiJson.textOrNull(play, "situationCode"));
            event.setHomeDefendingSide(ApiJson.textOrNull(play, "homeTeamDefendingSide"));
            event.setPenaltyShot("0101".equals(event.getSituationCode()) || "1010".equals(event.getSituationCode()));

            JsonNode details = play.get("details");
            if (details != null && details.isObject()) {
                Integer ownerId = ApiJson.intOrNull(details, "eventOwnerTeamId");
                Map.Entry<Venue, String> owner = ownerId == null ? null : teams.get(ownerId);
                event.setEventTeam(owner == null ? null : owner.getValue());
                event.setCoordsX(ApiJson.doubleOrNull(details, "xCoord"));
                event.setCoordsY(ApiJson.doubleOrNull(details, "yCoord"));
                event.setZone(ApiJson.textOrNull(details, "zoneCode"));
                mapDetails(event, details);
            }
            events.add(event);
        }

        EventVersions.assign(events);
        logger.debug("{} normalized {} API events ({} untracked types skipped)", source.gameId(), events.size(), skipped);
        return events;
    }

    private static Integer period(JsonNode play) {
        JsonNode descriptor = play.get("periodDescriptor");
        if (descriptor != null && descriptor.isObject()) {
            Integer number = ApiJson.intOrNull(descriptor, "number");
            if (number != null) {
                return number;
            }
        }
        return ApiJson.intOrNull(play, "period");
    }

    private static void mapDetails(SourceEvent event, JsonNode details) {
        switch (event.getEventType()) {
            case FAC -> {
                addPlayer(event, details, "winningPlayerId", EventPlayer.WINNER);
                addPlayer(event, details, "losingPlayerId", EventPlayer.LOSER);
            }
            case STOP -> event.setStoppageReason(reason(details, "reason"));
            case HIT -> {
                addPlayer(event, details, "hittingPlayerId", EventPlayer.HITTER);
                addPlayer(event, details, "hitteePlayerId", EventPlayer.HITTEE);
            }
            case GIVE -> addPlayer(event, details, "playerId", EventPlayer.GIVER);
            case TAKE -> addPlayer(event, details, "playerId", EventPlayer.TAKER);
            case SHOT, MISS -> {
                addPlayer(event, details, "shootingPlayerId", EventPlayer.SHOOTER);
                setShotDetails(event, details);
                if (event.getEventType() == EventType.MISS) {
                    event.setMissReason(reason(details, "reason"));
                }
            }
            case BLOCK -> {
                Long blocker = ApiJson.longOrNull(details, "blockingPlayerId");
                if (blocker == null) {
                    event.setEventTeam("OTHER");
                    event.setPlayer(0, PlayerRef.REFEREE, EventPlayer.BLOCKER);
                } else {
                    event.setPlayer(0, PlayerRef.ofApiId(blocker), EventPlayer.BLOCKER);
                }
                addPlayer(event, details, "shootingPlayerId", EventPlayer.SHOOTER);
                event.setShotType(shotType(details));
            }
            case GOAL -> {
                addPlayer(event, details, "scoringPlayerId", EventPlayer.GOAL_SCORER);
                addPlayer(event, details, "assist1PlayerId", EventPlayer.PRIMARY_ASSIST);
                addPlayer(event, details, "assist2PlayerId", EventPlayer.SECONDARY_ASSIST);
                setShotDetails(event, details);
            }
            case PENL -> mapPenalty(event, details);
            default -> {
            }
        }
    }

    private static void mapPenalty(SourceEvent event, JsonNode details) {
        String typeCode = ApiJson.textOrNull(details, "typeCode");
        String descKey = ApiJson.textOrNull(details, "descKey");
        event.setPenalty(descKey == null ? null : descKey.replace("-", " ").toUpperCase());
        event.setPenaltyMinutes(ApiJson.intOrNull(details, "duration"));

        Long committed = ApiJson.longOrNull(details, "committedByPlayerId");
        Long drawn = ApiJson.longOrNull(details, "drawnByPlayerId");
        Long served = ApiJson.longOrNull(details, "servedByPlayerId");
        String reason = descKey == null ? "" : descKey.toUpperCase();
        boolean bench = committed == null
            && ("BEN".equals(typeCode) || reason.contains("HEAD-COACH") || reason.contains("TEAM-STAFF"));

        if (bench) {
            event.setPlayer(0, PlayerRef.BENCH, EventPlayer.COMMITTED_BY);
            if (served != null) {
                event.addPlayer(PlayerRef.ofApiId(served), EventPlayer.SERVED_BY);
            }
            if (drawn != null) {
                event.addPlayer(PlayerRef.ofApiId(drawn), EventPlayer.DRAWN_BY);
            }
            return;
        }
        event.setPlayer(0, committed == null ? null : PlayerRef.ofApiId(committed), EventPlayer.COMMITTED_BY);
        if (drawn != null) {
            event.addPlayer(PlayerRef.ofApiId(drawn), EventPlayer.DRAWN_BY);
        }
        if (served != null) {
            event.addPlayer(PlayerRef.ofApiId(served), EventPlayer.SERVED_BY);
        }
    }

    private static void setShotDetails(SourceEvent event, JsonNode details) {
        event.setShotType(shotType(details));
        Long goalie = ApiJson.longOrNull(details, "goalieInNetId");
        event.setOpposingGoalie(goalie == null ? null : PlayerRef.ofApiId(goalie));
    }

    private static String shotType(JsonNode details) {
        String shotType = ApiJson.textOrNull(details, "shotType");
        return shotType == null ? "WRIST" : shotType.toUpperCase();
    }

    private static String reason(JsonNode details, String field) {
        String reason = ApiJson.textOrNull(details, field);
        return reason == null ? null : reason.replace("-", " ").toUpperCase();
    }

    private static void addPlayer(SourceEvent event, JsonNode details, String field, String role) {
        Long apiId = ApiJson.longOrNull(details, field);
        if (apiId != null) {
            event.addPlayer(PlayerRef.ofApiId(apiId), role);
        }
    }
}
