package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.DiagnosticFlag;
import com.rinkstats.domain.model.EventPlayer;
import com.rinkstats.domain.model.EventProvenance;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.RosterEntry;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.ports.EventReparser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Merges the API and report event streams of one game into a single ordered list of canonical
 * events: corrections, identity resolution, one-to-one matching, field-by-field merge, ordering.
 * The given source events are modified in place.
 */
public class EventReconciler {

    private static final Logger logger = LoggerFactory.getLogger(EventReconciler.class);

    public static final int DEFAULT_MATCH_WINDOW_SECONDS = 1;
    public static final int DEFAULT_MIN_PLAYER_OVERLAP = 1;

    private static final Pattern DESCRIPTION_NAME = Pattern.compile("#([0-9]{1,2})\\s+([A-Z][A-Z'\\-.]*)");

    private final CorrectionTable corrections;
    private final Map<SourceKind, EventReparser> reparsers = new EnumMap<>(SourceKind.class);
    private final int matchWindowSeconds;
    private final int minPlayerOverlap;

    public EventReconciler(CorrectionTable corrections, List<EventReparser> reparsers) {
        this(corrections, reparsers, DEFAULT_MATCH_WINDOW_SECONDS, DEFAULT_MIN_PLAYER_OVERLAP);
    }

    public EventReconciler(CorrectionTable corrections, List<EventReparser> reparsers, int matchWindowSeconds,
                           int minPlayerOverlap) {
        if (matchWindowSeconds < 0 || minPlayerOverlap < 0) {
            throw new IllegalArgumentException("Match window and player overlap must not be negative");
        }
        this.corrections = corrections;
        reparsers.forEach(reparser -> this.reparsers.put(reparser.source(), reparser));
        this.matchWindowSeconds = matchWindowSeconds;
        this.minPlayerOverlap = minPlayerOverlap;
    }

    public List<CanonicalEvent> reconcile(GameId gameId, RosterIndex roster, List<SourceEvent> apiEvents,
                                          List<SourceEvent> htmlEvents) {
        List<SourceEvent> api = prepare(gameId, SourceKind.API_EVENTS, apiEvents, roster);
        List<SourceEvent> html = prepare(gameId, SourceKind.HTML_EVENTS, htmlEvents, roster);

        List<Merged> merged = new ArrayList<>();
        Map<Integer, Integer> pairs = match(api, html);
        Set<Integer> pairedApi = new HashSet<>(pairs.values());
        for (int h = 0; h < html.size(); h++) {
            Integer a = pairs.get(h);
            merged.add(merge(gameId, a == null ? null : api.get(a), html.get(h)));
        }
        for (int a = 0; a < api.size(); a++) {
            if (!pairedApi.contains(a)) {
                merged.add(merge(gameId, api.get(a), null));
            }
        }

        SessionType session = gameId.sessionType();
        merged.sort(canonicalOrder(session));
        List<CanonicalEvent> events = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            events.add(merged.get(i).event().toBuilder().eventIdx(i + 1).build());
        }

        logger.info("{} reconciled {} events: {} matched, {} API only, {} report only", gameId, events.size(),
            pairs.size(), api.size() - pairs.size(), html.size() - pairs.size());
        return events;
    }

    private List<SourceEvent> prepare(GameId gameId, SourceKind source, List<SourceEvent> events, RosterIndex roster) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        List<SourceEvent> ordered = new ArrayList<>(events);
        ordered.sort(Comparator.comparingInt(SourceEvent::getEventIdx));
        List<SourceEvent> corrected = corrections.apply(gameId, source, ordered, reparsers.get(source));
        for (SourceEvent event : corrected) {
            resolvePlayers(event, roster);
        }
        TimestampAnomalies.flag(corrected, gameId.sessionType());
        return corrected;
    }

    void resolvePlayers(SourceEvent event, RosterIndex roster) {
        for (int slot = 0; slot < event.getPlayers().size(); slot++) {
            PlayerRef ref = event.player(slot);
            if (ref == null || ref.isPlaceholder()) {
                continue;
            }
            RosterEntry entry = roster.resolve(ref);
            if (entry == null && ref.jersey() != null) {
                entry = roster.byLastName(ref.team(), descriptionName(event.getDescription(), ref.jersey()));
            }
            if (entry != null) {
                event.setPlayer(slot, PlayerRef.of(entry), null);
            } else {
                event.setPlayer(slot, ref.unresolved(), null);
                event.addFlag(DiagnosticFlag.IDENTITY_UNRESOLVED);
                logger.warn("{} {} event {} slot {}: unresolved player {}", event.getGameId(), event.getSource(),
                    event.getEventIdx(), slot + 1, describe(ref));
            }
        }
        PlayerRef goalie = event.getOpposingGoalie();
        if (goalie != null && !goalie.isPlaceholder()) {
            RosterEntry entry = roster.resolve(goalie);
            if (entry != null) {
                event.setOpposingGoalie(PlayerRef.of(entry));
            } else {
                event.setOpposingGoalie(goalie.unresolved());
                event.addFlag(DiagnosticFlag.IDENTITY_UNRESOLVED);
                logger.warn("{} {} event {}: unresolved goalie {}", event.getGameId(), event.getSource(),
                    event.getEventIdx(), describe(goalie));
            }
        }
    }

    /**
     * Last name printed after a sweater number in a report description, or null.
     */
    static String descriptionName(String description, int jersey) {
        if (description == null) {
            return null;
        }
        Matcher matcher = DESCRIPTION_NAME.matcher(description);
        while (matcher.find()) {
            if (Integer.parseInt(matcher.group(1)) == jersey) {
                return matcher.group(2);
            }
        }
        return null;
    }

    /**
     * Pairs report events with API events one-to-one. Candidate pairs share type, period and team
     * (when both know it), lie within the time window and share enough resolved players; the
     * closest pairs are taken first.
     *
     * @return API position by report position
     */
    Map<Integer, Integer> match(List<SourceEvent> api, List<SourceEvent> html) {
        List<int[]> candidates = new ArrayList<>();
        for (int h = 0; h < html.size(); h++) {
            SourceEvent report = html.get(h);
            if (report.getGameSeconds() == null) {
                continue;
            }
            Set<String> reportPlayers = resolvedKeys(report);
            for (int a = 0; a < api.size(); a++) {
                SourceEvent structured = api.get(a);
                if (structured.getEventType() != report.getEventType()
                    || structured.getGameSeconds() == null
                    || !structured.getPeriod().equals(report.getPeriod())) {
                    continue;
                }
                int delta = Math.abs(structured.getGameSeconds() - report.getGameSeconds());
                if (delta > matchWindowSeconds) {
                    continue;
                }
                if (structured.getEventTeam() != null && report.getEventTeam() != null
                    && !structured.getEventTeam().equals(report.getEventTeam())) {
                    continue;
                }
                Set<String> apiPlayers = resolvedKeys(structured);
                int overlap = 0;
                if (!apiPlayers.isEmpty() && !reportPlayers.isEmpty()) {
                    for (String key : apiPlayers) {
                        if (reportPlayers.contains(key)) {
                            overlap++;
                        }
                    }
                    if (overlap < minPlayerOverlap) {
                        continue;
                    }
                }
                int versionDistance = Math.abs(structured.getVersion() - report.getVersion());
                candidates.add(new int[] {delta, -overlap, versionDistance, h, a});
            }
        }
        candidates.sort((first, second) -> Arrays.compare(first, second));

        Map<Integer, Integer> pairs = new LinkedHashMap<>();
        Set<Integer> usedApi = new HashSet<>();
        for (int[] candidate : candidates) {
            int h = candidate[3];
            int a = candidate[4];
            if (!pairs.containsKey(h) && !usedApi.contains(a)) {
                pairs.put(h, a);
                usedApi.add(a);
            }
        }
        return pairs;
    }

    private static Set<String> resolvedKeys(SourceEvent event) {
        Set<String> keys = new HashSet<>();
        for (EventPlayer player : event.getPlayers()) {
            PlayerRef ref = player.player();
            if (ref != null && ref.isResolved() && !ref.isPlaceholder()) {
                keys.add(ref.playerKey());
            }
        }
        return keys;
    }

    Merged merge(GameId gameId, SourceEvent api, SourceEvent html) {
        SourceEvent clock = MergeField.CLOCK.choose(usableClock(api), usableClock(html));
        if (clock == null) {
            clock = html != null ? html : api;
        }

        List<EventPlayer> players = mergePlayers(api, html);
        PlayerRef goalie = MergeField.OPPOSING_GOALIE.choose(
            api == null ? null : api.getOpposingGoalie(), html == null ? null : html.getOpposingGoalie());

        Set<SourceKind> sources = EnumSet.noneOf(SourceKind.class);
        Set<DiagnosticFlag> flags = EnumSet.noneOf(DiagnosticFlag.class);
        for (SourceEvent event : new SourceEvent[] {api, html}) {
            if (event != null) {
                sources.add(event.getSource());
                if (event.hasFlag(DiagnosticFlag.CORRECTED)) {
                    flags.add(DiagnosticFlag.CORRECTED);
                }
            }
        }
        if (clock.hasFlag(DiagnosticFlag.UNCORRECTED_ANOMALY)) {
            flags.add(DiagnosticFlag.UNCORRECTED_ANOMALY);
        }
        boolean unresolved = players.stream()
            .map(EventPlayer::player)
            .anyMatch(ref -> ref != null && !ref.isResolved());
        if (unresolved || (goalie != null && !goalie.isResolved())) {
            flags.add(DiagnosticFlag.IDENTITY_UNRESOLVED);
        }

        Double x = MergeField.COORDINATES.choose(value(api, SourceEvent::getCoordsX), value(html, SourceEvent::getCoordsX));
        Double y = MergeField.COORDINATES.choose(value(api, SourceEvent::getCoordsY), value(html, SourceEvent::getCoordsY));
        CanonicalEvent event = CanonicalEvent.builder()
            .gameId(gameId)
            .period(clock.getPeriod())
            .periodSeconds(clock.getPeriodSeconds())
            .gameSeconds(clock.getGameSeconds())
            .periodTime(periodTime(clock.getPeriodSeconds()))
            .eventType(MergeField.EVENT_TYPE.choose(value(api, SourceEvent::getEventType),
                value(html, SourceEvent::getEventType)))
            .description(MergeField.DESCRIPTION.choose(value(api, SourceEvent::getDescription),
                value(html, SourceEvent::getDescription)))
            .eventTeam(MergeField.EVENT_TEAM.choose(value(api, SourceEvent::getEventTeam),
                value(html, SourceEvent::getEventTeam)))
            .strength(MergeField.STRENGTH.choose(value(api, SourceEvent::getStrength),
                value(html, SourceEvent::getStrength)))
            .zone(MergeField.ZONE.choose(value(api, SourceEvent::getZone), value(html, SourceEvent::getZone)))
            .coordsX(x != null && y != null ? x : null)
            .coordsY(x != null && y != null ? y : null)
            .players(players)
            .opposingGoalie(goalie)
            .shotType(MergeField.SHOT_TYPE.choose(value(api, SourceEvent::getShotType),
                value(html, SourceEvent::getShotType)))
            .shotDistance(MergeField.SHOT_DISTANCE.choose(value(api, SourceEvent::getShotDistance),
                value(html, SourceEvent::getShotDistance)))
            .missReason(MergeField.MISS_REASON.choose(value(api, SourceEvent::getMissReason),
                value(html, SourceEvent::getMissReason)))
            .penalty(MergeField.PENALTY.choose(value(api, SourceEvent::getPenalty), value(html, SourceEvent::getPenalty)))
            .penaltyMinutes(MergeField.PENALTY_MINUTES.choose(value(api, SourceEvent::getPenaltyMinutes),
                value(html, SourceEvent::getPenaltyMinutes)))
            .stoppageReason(MergeField.STOPPAGE_REASON.choose(value(api, SourceEvent::getStoppageReason),
                value(html, SourceEvent::getStoppageReason)))
            .situationCode(MergeField.SITUATION_CODE.choose(value(api, SourceEvent::getSituationCode),
                value(html, SourceEvent::getSituationCode)))
            .homeDefendingSide(MergeField.DEFENDING_SIDE.choose(value(api, SourceEvent::getHomeDefendingSide),
                value(html, SourceEvent::getHomeDefendingSide)))
            .penaltyShot((api != null && api.isPenaltyShot()) || (html != null && html.isPenaltyShot()))
            .provenance(new EventProvenance(sources, api == null ? null : api.getEventIdx(),
                html == null ? null : html.getEventIdx(), flags))
            .build();
        int sourceIdx = html != null ? html.getEventIdx() : api.getEventIdx();
        return new Merged(event, sourceIdx);
    }

    /**
     * Per slot: a resolved API player, else a resolved report player, else whatever reference
     * either source has. Roles follow the same precedence.
     */
    private static List<EventPlayer> mergePlayers(SourceEvent api, SourceEvent html) {
        int slots = Math.max(api == null ? 0 : api.getPlayers().size(), html == null ? 0 : html.getPlayers().size());
        List<EventPlayer> players = new ArrayList<>(slots);
        for (int slot = 0; slot < slots; slot++) {
            PlayerRef apiRef = api == null ? null : api.player(slot);
            PlayerRef htmlRef = html == null ? null : html.player(slot);
            PlayerRef chosen;
            if (apiRef != null && apiRef.isResolved()) {
                chosen = apiRef;
            } else if (htmlRef != null && htmlRef.isResolved()) {
                chosen = htmlRef;
            } else {
                chosen = MergeField.PLAYERS.choose(apiRef, htmlRef);
            }
            String role = MergeField.PLAYERS.choose(api == null ? null : api.role(slot),
                html == null ? null : html.role(slot));
            players.add(new EventPlayer(chosen, role));
        }
        while (!players.isEmpty() && players.get(players.size() - 1).player() == null) {
            players.remove(players.size() - 1);
        }
        return players;
    }

    private static SourceEvent usableClock(SourceEvent event) {
        if (event == null || event.getGameSeconds() == null || event.hasFlag(DiagnosticFlag.UNCORRECTED_ANOMALY)) {
            return null;
        }
        return event;
    }

    private static <T> T value(SourceEvent event, Function<SourceEvent, T> getter) {
        return event == null ? null : getter.apply(event);
    }

    static String periodTime(Integer periodSeconds) {
        if (periodSeconds == null) {
            return null;
        }
        return (periodSeconds / 60) + ":" + String.format("%02d", periodSeconds % 60);
    }

    /**
     * (period, game seconds, event-type order, source index); the regular-season shootout keeps
     * source order.
     */
    static Comparator<Merged> canonicalOrder(SessionType session) {
        return (first, second) -> {
            CanonicalEvent a = first.event();
            CanonicalEvent b = second.event();
            int byPeriod = Integer.compare(a.getPeriod(), b.getPeriod());
            if (byPeriod != 0) {
                return byPeriod;
            }
            if (GameClock.isShootout(session, a.getPeriod())) {
                return Integer.compare(first.sourceIdx(), second.sourceIdx());
            }
            int bySeconds = Integer.compare(orZero(a.getGameSeconds()), orZero(b.getGameSeconds()));
            if (bySeconds != 0) {
                return bySeconds;
            }
            int byType = Integer.compare(a.getEventType().getSortOrder(), b.getEventType().getSortOrder());
            if (byType != 0) {
                return byType;
            }
            return Integer.compare(first.sourceIdx(), second.sourceIdx());
        };
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }

    private static String describe(PlayerRef ref) {
        if (ref.apiId() != null) {
            return "api id " + ref.apiId();
        }
        return ref.teamJersey() != null ? ref.teamJersey() : String.valueOf(ref.playerName());
    }

    record Merged(CanonicalEvent event, int sourceIdx) {
    }
}
