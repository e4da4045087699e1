package com.rinkstats.application.enrich;

import com.rinkstats.application.reconcile.ChangeTimeline;
import com.rinkstats.application.reconcile.RosterIndex;
import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.DiagnosticFlag;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.GameInfo;
import com.rinkstats.domain.model.OnIcePersonnel;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.RosterEntry;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Attaches on-ice personnel, strength and score state, zone and shot geometry to each canonical
 * event. One enriched event per canonical event, in input order.
 */
public class PlayByPlayAssembler {

    private static final Logger logger = LoggerFactory.getLogger(PlayByPlayAssembler.class);

    public static final String EMPTY_NET = "E";
    public static final String PENALTY_SHOT_STATE = "1v0";
    public static final String ILLEGAL_STATE = "ILLEGAL";

    public List<EnrichedEvent> assemble(GameInfo gameInfo, List<CanonicalEvent> events, ChangeTimeline timeline,
                                        RosterIndex roster) {
        SessionType session = gameInfo.gameId().sessionType();
        String homeTeam = gameInfo.homeTeam().abbrev();
        String awayTeam = gameInfo.awayTeam().abbrev();
        Map<Integer, Boolean> homeAttacksRight = attackingDirections(gameInfo, events);

        List<EnrichedEvent> enriched = new ArrayList<>(events.size());
        int homeScore = 0;
        int awayScore = 0;
        Integer lastSeconds = null;
        int anomalies = 0;
        for (CanonicalEvent event : events) {
            Venue venue = gameInfo.venueOf(event.getEventTeam());
            boolean shootout = GameClock.isShootout(session, event.getPeriod());

            OnIcePersonnel home = OnIcePersonnel.EMPTY;
            OnIcePersonnel away = OnIcePersonnel.EMPTY;
            // both benches need shift data, otherwise the skater counts are not comparable
            boolean tracked = !shootout && event.getPeriodSeconds() != null
                && timeline.hasPeriod(event.getPeriod(), Venue.HOME)
                && timeline.hasPeriod(event.getPeriod(), Venue.AWAY);
            if (tracked) {
                ChangeTimeline.Mode mode = event.getEventType().seesChangesAtSameSecond()
                    ? ChangeTimeline.Mode.AFTER_CHANGES
                    : ChangeTimeline.Mode.BEFORE_CHANGES;
                home = personnel(timeline.onIce(event.getPeriod(), event.getPeriodSeconds(), Venue.HOME, mode),
                    homeTeam, roster);
                away = personnel(timeline.onIce(event.getPeriod(), event.getPeriodSeconds(), Venue.AWAY, mode),
                    awayTeam, roster);
            }

            String homeState = homeStrengthState(event, home, away, tracked, shootout);
            String eventState = homeState == null || venue != Venue.AWAY || isFixedState(homeState)
                ? homeState
                : reverse(homeState);

            int diff = homeScore - awayScore;
            int scoreDiff = venue == Venue.AWAY ? -diff : diff;

            Set<DiagnosticFlag> flags = EnumSet.noneOf(DiagnosticFlag.class);
            flags.addAll(event.getProvenance().flags());
            if (tracked && event.getEventType().isInPlay() && (isIllegal(home) || isIllegal(away))) {
                flags.add(DiagnosticFlag.ON_ICE_ANOMALY);
                anomalies++;
            }

            EnrichedEvent.Builder builder = EnrichedEvent.builder()
                .event(event)
                .homeTeam(homeTeam)
                .awayTeam(awayTeam)
                .eventVenue(venue)
                .homeOnIce(home)
                .awayOnIce(away)
                .homeSkaters(home.skaterCount())
                .awaySkaters(away.skaterCount())
                .homeStrengthState(homeState)
                .strengthState(eventState)
                .homeScore(homeScore)
                .awayScore(awayScore)
                .scoreDiff(scoreDiff)
                .secondsSinceLast(lastSeconds == null || event.getGameSeconds() == null
                    ? null
                    : event.getGameSeconds() - lastSeconds)
                .flags(flags);
            applyGeometry(builder, event, venue, homeAttacksRight.get(event.getPeriod()));
            enriched.add(builder.build());

            if (event.getEventType() == EventType.GOAL && !shootout) {
                if (venue == Venue.HOME) {
                    homeScore++;
                } else if (venue == Venue.AWAY) {
                    awayScore++;
                }
            }
            if (event.getGameSeconds() != null) {
                lastSeconds = event.getGameSeconds();
            }
        }
        if (anomalies > 0) {
            logger.warn("{} {} in-play events with illegal on-ice counts", gameInfo.gameId(), anomalies);
        }
        logger.info("{} assembled {} enriched events", gameInfo.gameId(), enriched.size());
        return enriched;
    }

    private static OnIcePersonnel personnel(Set<String> keys, String team, RosterIndex roster) {
        List<RosterEntry> entries = new ArrayList<>();
        List<PlayerRef> unknown = new ArrayList<>();
        for (String key : keys) {
            RosterEntry entry = roster.byKey(key);
            if (entry != null) {
                entries.add(entry);
            } else {
                unknown.add(new PlayerRef(key, null, null, team, null, null));
            }
        }
        OnIcePersonnel known = OnIcePersonnel.of(entries);
        if (unknown.isEmpty()) {
            return known;
        }
        List<PlayerRef> forwards = new ArrayList<>(known.forwards());
        forwards.addAll(unknown);
        return new OnIcePersonnel(forwards, known.defense(), known.goalies());
    }

    /**
     * Strength state from the home team's side, e.g. "5v4" or "Ev5". Without shift data the API
     * situation code decides.
     */
    static String homeStrengthState(CanonicalEvent event, OnIcePersonnel home, OnIcePersonnel away, boolean tracked,
                                    boolean shootout) {
        if (shootout || event.isPenaltyShot()
            || (event.getDescription() != null && event.getDescription().contains("PENALTY SHOT"))) {
            return PENALTY_SHOT_STATE;
        }
        if (!tracked) {
            return fromSituationCode(event.getSituationCode());
        }
        if ((home.skaterCount() > 5 && home.hasGoalie()) || (away.skaterCount() > 5 && away.hasGoalie())) {
            return ILLEGAL_STATE;
        }
        String homeOn = home.hasGoalie() ? String.valueOf(home.skaterCount()) : EMPTY_NET;
        String awayOn = away.hasGoalie() ? String.valueOf(away.skaterCount()) : EMPTY_NET;
        return homeOn + "v" + awayOn;
    }

    /**
     * Situation code digits: away goalie, away skaters, home skaters, home goalie.
     */
    static String fromSituationCode(String code) {
        if (code == null || !code.matches("\\d{4}")) {
            return null;
        }
        if (code.equals("0101") || code.equals("1010")) {
            return PENALTY_SHOT_STATE;
        }
        String awayOn = code.charAt(0) == '0' ? EMPTY_NET : String.valueOf(code.charAt(1));
        String homeOn = code.charAt(3) == '0' ? EMPTY_NET : String.valueOf(code.charAt(2));
        return homeOn + "v" + awayOn;
    }

    private static boolean isFixedState(String state) {
        return state.equals(PENALTY_SHOT_STATE) || state.equals(ILLEGAL_STATE);
    }

    private static String reverse(String state) {
        int separator = state.indexOf('v');
        return state.substring(separator + 1) + "v" + state.substring(0, separator);
    }

    private static boolean isIllegal(OnIcePersonnel personnel) {
        int skaters = personnel.skaterCount();
        int goalies = personnel.goalies().size();
        return skaters < 3 || skaters > 6 || goalies > 1 || (skaters == 6 && goalies == 1);
    }

    private static void applyGeometry(EnrichedEvent.Builder builder, CanonicalEvent event, Venue venue,
                                      Boolean homeAttacksRight) {
        String zone = zoneCode(event.getZone());
        Double distance = null;
        Double angle = null;
        boolean danger = false;
        boolean highDanger = false;

        if (event.getCoordsX() != null && event.getCoordsY() != null) {
            double x = event.getCoordsX();
            double y = event.getCoordsY();
            if (homeAttacksRight != null && venue != null) {
                boolean attacksRight = venue == Venue.HOME ? homeAttacksRight : !homeAttacksRight;
                if (!attacksRight) {
                    x = -x;
                    y = -y;
                }
            } else {
                // direction unknown: shoot at the nearer net unless the report distance says otherwise
                x = Math.abs(x);
                if (event.getEventType().isUnblockedShotAttempt()
                    && RinkGeometry.isLongDistanceMislabel(event.getShotDistance(), event.getShotType(), zone)) {
                    x = -x;
                }
            }
            if (zone == null && venue != null) {
                zone = RinkGeometry.zone(x);
            }
            if (event.getEventType().isShotAttempt()) {
                distance = RinkGeometry.distance(x, y);
                angle = RinkGeometry.angle(x, y);
            }
            if (event.getEventType().isUnblockedShotAttempt()) {
                if ("DEF".equals(zone) && distance <= 64) {
                    zone = "OFF";
                }
                if ("OFF".equals(zone)) {
                    highDanger = RinkGeometry.isHighDanger(x, y);
                    danger = RinkGeometry.isDanger(x, y);
                }
            }
        } else if (event.getShotDistance() != null && event.getEventType().isShotAttempt()) {
            distance = event.getShotDistance().doubleValue();
        }

        builder.zone(zone)
            .shotDistance(distance)
            .shotAngle(angle)
            .danger(danger)
            .highDanger(highDanger);
    }

    private static String zoneCode(String zone) {
        if (zone == null) {
            return null;
        }
        return switch (zone.toUpperCase()) {
            case "O", "OFF" -> "OFF";
            case "D", "DEF" -> "DEF";
            case "N", "NEU" -> "NEU";
            default -> null;
        };
    }

    /**
     * Whether the home team attacks towards +x in each period: from the API's home defending side
     * when present, otherwise from where the home team's unblocked shots were taken.
     */
    static Map<Integer, Boolean> attackingDirections(GameInfo gameInfo, List<CanonicalEvent> events) {
        Map<Integer, Boolean> directions = new HashMap<>();
        Map<Integer, Double> homeShotX = new HashMap<>();
        for (CanonicalEvent event : events) {
            String side = event.getHomeDefendingSide();
            if (side != null && !directions.containsKey(event.getPeriod())) {
                if (side.equalsIgnoreCase("left")) {
                    directions.put(event.getPeriod(), true);
                } else if (side.equalsIgnoreCase("right")) {
                    directions.put(event.getPeriod(), false);
                }
            }
            if (event.getEventType().isUnblockedShotAttempt() && event.getCoordsX() != null) {
                Venue venue = gameInfo.venueOf(event.getEventTeam());
                if (venue != null) {
                    double x = venue == Venue.HOME ? event.getCoordsX() : -event.getCoordsX();
                    homeShotX.merge(event.getPeriod(), x, Double::sum);
                }
            }
        }
        for (Map.Entry<Integer, Double> period : homeShotX.entrySet()) {
            if (!directions.containsKey(period.getKey()) && period.getValue() != 0) {
                directions.put(period.getKey(), period.getValue() > 0);
            }
        }
        return directions;
    }
}
