package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.ChangeDirection;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.GameInfo;
import com.rinkstats.domain.model.OnIceAnomaly;
import com.rinkstats.domain.model.PlayerShift;
import com.rinkstats.domain.model.Position;
import com.rinkstats.domain.model.RosterEntry;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.ShiftChange;
import com.rinkstats.domain.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Turns both teams' shift reports into one ordered stream of on/off changes and indexes it as a
 * {@link ChangeTimeline}.
 */
public class ChangeReconciler {

    private static final Logger logger = LoggerFactory.getLogger(ChangeReconciler.class);

    public static final Comparator<ShiftChange> CHANGE_ORDER = Comparator
        .comparingInt(ShiftChange::period)
        .thenComparingInt(ShiftChange::periodSeconds)
        .thenComparing(ShiftChange::direction)
        .thenComparing(ShiftChange::venue)
        .thenComparingInt(ShiftChange::jersey);

    public ChangeTimeline reconcile(GameInfo gameInfo, List<PlayerShift> shifts, RosterIndex roster) {
        GameId gameId = gameInfo.gameId();
        SessionType session = gameId.sessionType();
        List<PlayerShift> tracked = shifts.stream()
            .filter(shift -> !GameClock.isShootout(session, shift.period()))
            .toList();
        if (tracked.isEmpty()) {
            return ChangeTimeline.empty(gameId);
        }

        int finalPeriod = tracked.stream().mapToInt(PlayerShift::period).max().orElse(GameClock.REGULATION_PERIODS);
        int lastRecordedSecond = tracked.stream()
            .filter(shift -> shift.period() == finalPeriod)
            .mapToInt(shift -> Math.max(orZero(shift.startSeconds()), orZero(shift.endSeconds())))
            .max()
            .orElse(0);

        List<PlayerShift> repaired = new ArrayList<>();
        for (PlayerShift shift : tracked) {
            PlayerShift fixed = repair(shift, periodEnd(session, shift.period(), finalPeriod, lastRecordedSecond),
                isGoalie(gameInfo, shift, roster));
            if (fixed != null) {
                repaired.add(fixed);
            }
        }
        repaired.addAll(fillGoalieGaps(gameInfo, repaired, roster, finalPeriod, lastRecordedSecond));

        List<ShiftChange> changes = new ArrayList<>();
        for (PlayerShift shift : repaired) {
            String team = gameInfo.team(shift.venue()).abbrev();
            RosterEntry entry = roster.byTeamJersey(team, shift.jersey());
            String playerKey = entry != null
                ? entry.playerKey()
                : NormalizationUtils.playerKey(shift.playerName(), null, gameId.season());
            if (entry == null) {
                logger.warn("{} shift for {}{} ({}) has no roster entry", gameId, team, shift.jersey(), shift.playerName());
            }
            changes.add(change(gameId, session, shift, team, ChangeDirection.ON, shift.startSeconds(), playerKey));
            changes.add(change(gameId, session, shift, team, ChangeDirection.OFF, shift.endSeconds(), playerKey));
        }
        changes.sort(CHANGE_ORDER);

        List<OnIceAnomaly> anomalies = findAnomalies(changes, roster, session, finalPeriod, lastRecordedSecond);
        if (!anomalies.isEmpty()) {
            logger.warn("{} {} on-ice cardinality anomalies in shift data", gameId, anomalies.size());
        }
        logger.info("{} built change timeline: {} shifts, {} changes", gameId, repaired.size(), changes.size());
        return new ChangeTimeline(gameId, changes, anomalies);
    }

    /**
     * Period end in seconds. An overtime that ends the game stops at the last recorded second.
     */
    static int periodEnd(SessionType session, int period, int finalPeriod, int lastRecordedSecond) {
        int length = GameClock.periodLength(session, period);
        if (period == finalPeriod && period > GameClock.REGULATION_PERIODS && lastRecordedSecond > 0) {
            return Math.min(length, lastRecordedSecond);
        }
        return length;
    }

    /**
     * Fills a missing end from the duration, and sends reversed or goalie "0:00" ends to the
     * period end. Returns null for shifts that cannot be placed on the clock.
     */
    static PlayerShift repair(PlayerShift shift, int periodEnd, boolean goalie) {
        Integer start = shift.startSeconds();
        Integer end = shift.endSeconds();
        if (start == null) {
            return null;
        }
        if (end == null && shift.durationSeconds() != null) {
            end = start + shift.durationSeconds();
        }
        if (end == null || start > end || (goalie && end == 0)) {
            end = periodEnd;
        }
        end = Math.min(end, periodEnd);
        if (end <= start) {
            return null;
        }
        if (!end.equals(shift.endSeconds())) {
            return shift.withTimes(shift.period(), start, end);
        }
        return shift;
    }

    private List<PlayerShift> fillGoalieGaps(GameInfo gameInfo, List<PlayerShift> shifts, RosterIndex roster,
                                             int finalPeriod, int lastRecordedSecond) {
        GameId gameId = gameInfo.gameId();
        SessionType session = gameId.sessionType();
        List<PlayerShift> filled = new ArrayList<>();
        for (Venue venue : Venue.values()) {
            Map<Integer, PlayerShift> lastGoalieShift = new HashMap<>();
            Set<Integer> periods = new TreeSet<>();
            for (PlayerShift shift : shifts) {
                if (shift.venue() != venue) {
                    continue;
                }
                periods.add(shift.period());
                if (isGoalie(gameInfo, shift, roster)) {
                    PlayerShift last = lastGoalieShift.get(shift.period());
                    if (last == null || shift.endSeconds() >= last.endSeconds()) {
                        lastGoalieShift.put(shift.period(), shift);
                    }
                }
            }
            for (int period : periods) {
                if (lastGoalieShift.containsKey(period)) {
                    continue;
                }
                PlayerShift template = lastGoalieShift.get(period - 1);
                if (template == null) {
                    template = starterGoalie(gameInfo, venue, roster);
                }
                if (template == null) {
                    logger.warn("{} {} has no goalie shifts in period {} and no goalie to fill them", gameId, venue, period);
                    continue;
                }
                int end = periodEnd(session, period, finalPeriod, lastRecordedSecond);
                PlayerShift full = template.withTimes(period, 0, end);
                logger.info("{} filled {} goalie gap in period {} with {}", gameId, venue, period, full.playerName());
                lastGoalieShift.put(period, full);
                filled.add(full);
            }
        }
        return filled;
    }

    private static PlayerShift starterGoalie(GameInfo gameInfo, Venue venue, RosterIndex roster) {
        RosterEntry fallback = null;
        for (RosterEntry entry : roster.entries()) {
            if (entry.venue() != venue || entry.position() != Position.G || !entry.isActive()) {
                continue;
            }
            if (entry.starter()) {
                fallback = entry;
                break;
            }
            if (fallback == null) {
                fallback = entry;
            }
        }
        if (fallback == null) {
            return null;
        }
        return new PlayerShift(gameInfo.gameId(), fallback.team(), venue, fallback.playerName(), fallback.jersey(),
            0, 1, 0, 0, 0);
    }

    private static boolean isGoalie(GameInfo gameInfo, PlayerShift shift, RosterIndex roster) {
        RosterEntry entry = roster.byTeamJersey(gameInfo.team(shift.venue()).abbrev(), shift.jersey());
        return entry != null && entry.position() == Position.G;
    }

    private static ShiftChange change(GameId gameId, SessionType session, PlayerShift shift, String team,
                                      ChangeDirection direction, int periodSeconds, String playerKey) {
        return new ShiftChange(gameId, shift.period(), periodSeconds,
            GameClock.gameSeconds(session, shift.period(), periodSeconds), team, shift.venue(), direction, playerKey,
            shift.jersey());
    }

    /**
     * Checks skater and goalie counts after every group of changes sharing a clock reading, for
     * readings strictly inside the period.
     */
    private static List<OnIceAnomaly> findAnomalies(List<ShiftChange> changes, RosterIndex roster, SessionType session,
                                                    int finalPeriod, int lastRecordedSecond) {
        Set<String> goalies = new HashSet<>();
        for (RosterEntry entry : roster.entries()) {
            if (entry.position() == Position.G && entry.playerKey() != null) {
                goalies.add(entry.playerKey());
            }
        }
        List<OnIceAnomaly> anomalies = new ArrayList<>();
        Map<Venue, Set<String>> onIce = new HashMap<>();
        int period = -1;
        for (int i = 0; i < changes.size(); i++) {
            ShiftChange change = changes.get(i);
            if (change.period() != period) {
                period = change.period();
                onIce.clear();
            }
            Set<String> players = onIce.computeIfAbsent(change.venue(), venue -> new LinkedHashSet<>());
            if (change.direction() == ChangeDirection.ON) {
                players.add(change.playerKey());
            } else {
                players.remove(change.playerKey());
            }

            boolean groupEnds = i + 1 == changes.size()
                || changes.get(i + 1).period() != change.period()
                || changes.get(i + 1).periodSeconds() != change.periodSeconds();
            int end = periodEnd(session, change.period(), finalPeriod, lastRecordedSecond);
            if (!groupEnds || change.periodSeconds() <= 0 || change.periodSeconds() >= end) {
                continue;
            }
            for (Venue venue : Venue.values()) {
                Set<String> current = onIce.getOrDefault(venue, Set.of());
                int goalieCount = (int) current.stream().filter(goalies::contains).count();
                int skaters = current.size() - goalieCount;
                boolean illegal = skaters < 3 || skaters > 6 || goalieCount > 1 || (skaters == 6 && goalieCount == 1);
                if (illegal) {
                    anomalies.add(new OnIceAnomaly(change.period(), change.periodSeconds(), venue, skaters, goalieCount));
                }
            }
        }
        return anomalies;
    }

    private static int orZero(Integer value) {
        return value == null ? 0 : value;
    }
}
