package com.rinkstats.application.stats;

import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.EventPlayer;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.OnIcePersonnel;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;
import java.util.function.Consumer;

/**
 * Folds enriched play-by-play into per-player, per-team and per-line counting stats. Shootout
 * attempts are not counted; players without a resolved identity only count towards their team.
 * Time on ice is the time from each event to the next one of the same game.
 */
public class StatsAggregator {

    private static final Logger logger = LoggerFactory.getLogger(StatsAggregator.class);

    public StatsTables aggregate(List<EnrichedEvent> events, StatsGrouping grouping) {
        Tally tally = new Tally(grouping);
        for (int i = 0; i < events.size(); i++) {
            EnrichedEvent event = events.get(i);
            CanonicalEvent canonical = event.getEvent();
            if (canonical.getEventType() == null
                || GameClock.isShootout(canonical.getGameId().sessionType(), canonical.getPeriod())) {
                continue;
            }
            tally.add(event, eventLength(event, i + 1 < events.size() ? events.get(i + 1) : null));
        }
        logger.debug("Aggregated {} events into {} player, {} team and {} line rows", events.size(),
            tally.players.size(), tally.teams.size(), tally.lines.size());
        return new StatsTables(new ArrayList<>(tally.players.values()), new ArrayList<>(tally.teams.values()),
            new ArrayList<>(tally.lines.values()));
    }

    /**
     * Seconds until the next event of the same game; zero for the last event or a clock gap.
     */
    static int eventLength(EnrichedEvent event, EnrichedEvent next) {
        if (next == null || !event.getGameId().equals(next.getGameId())) {
            return 0;
        }
        Integer from = event.getEvent().getGameSeconds();
        Integer to = next.getEvent().getGameSeconds();
        if (from == null || to == null) {
            return 0;
        }
        return Math.max(to - from, 0);
    }

    private static final class Tally {

        private final StatsGrouping grouping;
        private final Map<StatKey, StatLine> players = new LinkedHashMap<>();
        private final Map<StatKey, StatLine> teams = new LinkedHashMap<>();
        private final Map<StatKey, StatLine> lines = new LinkedHashMap<>();

        Tally(StatsGrouping grouping) {
            this.grouping = grouping;
        }

        void add(EnrichedEvent event, int length) {
            if (length > 0) {
                timeOnIce(event, length);
            }
            CanonicalEvent canonical = event.getEvent();
            Venue venue = event.getEventVenue();
            EventType type = canonical.getEventType();
            double xg = event.getPredictedGoal() == null ? 0.0 : event.getPredictedGoal();

            switch (type) {
                case GOAL, SHOT, MISS -> {
                    boolean goal = type == EventType.GOAL;
                    boolean onGoal = type != EventType.MISS;
                    PlayerRef shooter = withRole(canonical, type == EventType.GOAL
                        ? EventPlayer.GOAL_SCORER : EventPlayer.SHOOTER);
                    Venue shooting = venueOf(event, shooter, venue);
                    credit(event, shooting, shooter, line -> {
                        line.addAttempt(onGoal, false, xg);
                        if (goal) {
                            line.addGoal();
                        }
                    });
                    if (goal) {
                        creditPlayer(event, shooting, withRole(canonical, EventPlayer.PRIMARY_ASSIST),
                            StatLine::addPrimaryAssist);
                        creditPlayer(event, shooting, withRole(canonical, EventPlayer.SECONDARY_ASSIST),
                            StatLine::addSecondaryAssist);
                    }
                    onIce(event, shooting, goal, onGoal, false, xg);
                }
                case BLOCK -> {
                    PlayerRef shooter = withRole(canonical, EventPlayer.SHOOTER);
                    Venue shooting = venueOf(event, shooter, venue == null ? null : venue.opposite());
                    credit(event, shooting, shooter, line -> line.addAttempt(false, true, 0.0));
                    PlayerRef blocker = withRole(canonical, EventPlayer.BLOCKER);
                    creditPlayer(event, shooting == null ? null : shooting.opposite(), blocker, StatLine::addBlock);
                    onIce(event, shooting, false, false, true, 0.0);
                }
                case HIT -> {
                    credit(event, venue, withRole(canonical, EventPlayer.HITTER), StatLine::addHit);
                    creditOpponent(event, venue, withRole(canonical, EventPlayer.HITTEE), StatLine::addHitTaken);
                }
                case GIVE -> credit(event, venue, withRole(canonical, EventPlayer.GIVER), StatLine::addGiveaway);
                case TAKE -> credit(event, venue, withRole(canonical, EventPlayer.TAKER), StatLine::addTakeaway);
                case FAC -> {
                    credit(event, venue, withRole(canonical, EventPlayer.WINNER), line -> line.addFaceoff(true));
                    creditOpponent(event, venue, withRole(canonical, EventPlayer.LOSER), line -> line.addFaceoff(false));
                }
                case PENL -> {
                    int minutes = canonical.getPenaltyMinutes() == null ? 0 : canonical.getPenaltyMinutes();
                    credit(event, venue, withRole(canonical, EventPlayer.COMMITTED_BY),
                        line -> line.addPenaltyTaken(minutes));
                    creditOpponent(event, venue, withRole(canonical, EventPlayer.DRAWN_BY),
                        StatLine::addPenaltyDrawn);
                }
                default -> {
                }
            }
        }

        /** Credits the team of the given venue and the player, when the player is known. */
        private void credit(EnrichedEvent event, Venue venue, PlayerRef player, Consumer<StatLine> update) {
            Venue team = venueOf(event, player, venue);
            if (team == null) {
                return;
            }
            update.accept(teamLine(event, team));
            creditPlayer(event, team, player, update);
        }

        private void creditOpponent(EnrichedEvent event, Venue venue, PlayerRef player, Consumer<StatLine> update) {
            credit(event, venue == null ? null : venue.opposite(), player, update);
        }

        private void creditPlayer(EnrichedEvent event, Venue venue, PlayerRef player, Consumer<StatLine> update) {
            if (!countable(player)) {
                return;
            }
            Venue team = venueOf(event, player, venue);
            if (team != null) {
                update.accept(playerLine(event, team, player));
            }
        }

        private void onIce(EnrichedEvent event, Venue shooting, boolean goal, boolean onGoal, boolean blocked,
                           double xg) {
            if (shooting == null) {
                return;
            }
            for (Venue side : Venue.values()) {
                boolean forTeam = side == shooting;
                teamLine(event, side).addOnIceAttempt(forTeam, goal, onGoal, blocked, xg);
                StatLine unit = unitLine(event, side);
                if (unit != null) {
                    unit.addOnIceAttempt(forTeam, goal, onGoal, blocked, xg);
                }
                for (PlayerRef player : everyone(event.onIce(side))) {
                    if (countable(player)) {
                        playerLine(event, side, player).addOnIceAttempt(forTeam, goal, onGoal, blocked, xg);
                    }
                }
            }
        }

        private void timeOnIce(EnrichedEvent event, int length) {
            for (Venue side : Venue.values()) {
                teamLine(event, side).addTimeOnIce(length);
                StatLine unit = unitLine(event, side);
                if (unit != null) {
                    unit.addTimeOnIce(length);
                }
                for (PlayerRef player : everyone(event.onIce(side))) {
                    if (countable(player)) {
                        playerLine(event, side, player).addTimeOnIce(length);
                    }
                }
            }
        }

        private StatLine teamLine(EnrichedEvent event, Venue venue) {
            StatKey key = key(event, venue, null, null);
            return teams.computeIfAbsent(key, StatLine::new);
        }

        private StatLine playerLine(EnrichedEvent event, Venue venue, PlayerRef player) {
            StatKey key = key(event, venue, player.playerKey(), null);
            StatLine line = players.computeIfAbsent(key, StatLine::new);
            line.describe(player.playerName(), player.position());
            return line;
        }

        /**
         * The row of the forwards or defence pair on the ice for the venue, or null when none of
         * them is identified.
         */
        private StatLine unitLine(EnrichedEvent event, Venue venue) {
            OnIcePersonnel personnel = event.onIce(venue);
            List<PlayerRef> unit = new ArrayList<>(grouping.lines() == StatsGrouping.LineType.DEFENSE
                ? personnel.defense() : personnel.forwards());
            unit.removeIf(player -> !countable(player));
            if (unit.isEmpty()) {
                return null;
            }
            unit.sort(Comparator.comparing(PlayerRef::playerKey));
            StringJoiner keys = new StringJoiner("-");
            StringJoiner names = new StringJoiner(" - ");
            for (PlayerRef player : unit) {
                keys.add(player.playerKey());
                names.add(player.playerName());
            }
            StatLine line = lines.computeIfAbsent(key(event, venue, null, keys.toString()), StatLine::new);
            line.describe(names.toString(), null);
            return line;
        }

        private StatKey key(EnrichedEvent event, Venue venue, String playerKey, String unit) {
            GameId gameId = event.getGameId();
            StatsGrouping.Level level = grouping.level();
            return new StatKey(
                gameId.season(),
                gameId.sessionType(),
                level == StatsGrouping.Level.SEASON ? null : gameId,
                level == StatsGrouping.Level.PERIOD ? event.getEvent().getPeriod() : null,
                venue == Venue.HOME ? event.getHomeTeam() : event.getAwayTeam(),
                playerKey,
                unit,
                grouping.byStrengthState() ? strengthState(event, venue) : null,
                grouping.byScoreState() ? scoreState(event, venue) : null);
        }
    }

    static String strengthState(EnrichedEvent event, Venue venue) {
        String state = event.getHomeStrengthState();
        if (state == null || venue == Venue.HOME) {
            return state;
        }
        int separator = state.indexOf('v');
        if (separator < 0) {
            return state;
        }
        return state.substring(separator + 1) + "v" + state.substring(0, separator);
    }

    static String scoreState(EnrichedEvent event, Venue venue) {
        return venue == Venue.HOME
            ? event.getHomeScore() + "v" + event.getAwayScore()
            : event.getAwayScore() + "v" + event.getHomeScore();
    }

    private static List<PlayerRef> everyone(OnIcePersonnel personnel) {
        List<PlayerRef> everyone = new ArrayList<>(personnel.skaters());
        everyone.addAll(personnel.goalies());
        return everyone;
    }

    private static PlayerRef withRole(CanonicalEvent event, String role) {
        for (EventPlayer player : event.getPlayers()) {
            if (role.equals(player.role())) {
                return player.player();
            }
        }
        return null;
    }

    /**
     * The player's own team when it is one of the two teams, otherwise the fallback venue.
     */
    private static Venue venueOf(EnrichedEvent event, PlayerRef player, Venue fallback) {
        if (player != null && player.team() != null) {
            if (player.team().equals(event.getHomeTeam())) {
                return Venue.HOME;
            }
            if (player.team().equals(event.getAwayTeam())) {
                return Venue.AWAY;
            }
        }
        return fallback;
    }

    private static boolean countable(PlayerRef player) {
        return player != null && player.isResolved() && !player.isPlaceholder();
    }
}
