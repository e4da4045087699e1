package com.rinkstats.application.stats;

import com.rinkstats.domain.model.CanonicalEvent;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.EventPlayer;
import com.rinkstats.domain.model.EventProvenance;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.Venue;
import com.rinkstats.support.SyntheticGame;
import com.rinkstats.support.SyntheticPlayByPlay;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for StatsAggregator.
 */
class StatsAggregatorTest {

    private StatsAggregator aggregator;
    private List<EnrichedEvent> events;

    @BeforeEach
    void setUp() {
        aggregator = new StatsAggregator();
        events = SyntheticPlayByPlay.build().enriched();
    }

    @Test
    void testIndividualCounts() {
        StatsTables tables = aggregator.aggregate(events, StatsGrouping.DEFAULT);

        StatLine crosby = player(tables, "SIDNEY.CROSBY");
        assertEquals("SIDNEY CROSBY", crosby.getPlayerName());
        assertEquals(1, crosby.getGoals());
        assertEquals(1, crosby.getFaceoffsWon());
        assertEquals(1, crosby.getFaceoffsLost());
        assertEquals(1, crosby.getPenaltiesDrawn());
        assertEquals(1, crosby.getPoints());

        assertEquals(1, player(tables, "JAKE.GUENTZEL").getPrimaryAssists());
        assertEquals(1, player(tables, "KRIS.LETANG").getSecondaryAssists());
        assertEquals(1, player(tables, "KRIS.LETANG").getHits());
        assertEquals(1, player(tables, "BRAD.MARCHAND").getHitsTaken());
        assertEquals(2, player(tables, "BRAD.MARCHAND").getPenaltyMinutes());
        assertEquals(1, player(tables, "JOHN.MARINO").getBlocks());
        assertEquals(1, player(tables, "CHARLIE.MCAVOY").getCorsi());
        assertEquals(0, player(tables, "CHARLIE.MCAVOY").getFenwick());
        assertEquals(1, player(tables, "DAVID.PASTRNAK").getShots());
    }

    @Test
    void testTeamAndOnIceCounts() {
        StatsTables tables = aggregator.aggregate(events, StatsGrouping.DEFAULT);

        StatLine pittsburgh = team(tables, SyntheticGame.HOME);
        assertEquals(1, pittsburgh.getGoals());
        assertEquals(1, pittsburgh.getGoalsFor());
        assertEquals(2, pittsburgh.getCorsiAgainst());
        assertEquals(1, pittsburgh.getFenwickAgainst());

        StatLine boston = team(tables, SyntheticGame.AWAY);
        assertEquals(2, boston.getCorsi());
        assertEquals(1, boston.getFenwick());
        assertEquals(1, boston.getShots());
        assertEquals(1, boston.getGoalsAgainst());

        // on ice for the shot and the goal, off before the faceoff
        StatLine guentzel = player(tables, "JAKE.GUENTZEL");
        assertEquals(1, guentzel.getGoalsFor());
        assertEquals(2, guentzel.getCorsiAgainst());
        StatLine rust = player(tables, "BRYAN.RUST");
        assertEquals(0, rust.getGoalsFor());
        assertEquals(0, rust.getCorsiAgainst());

        assertEquals(1, player(tables, "TUUKKA.RASK").getGoalsAgainst());
    }

    @Test
    void testGroupingKeys() {
        StatsTables byPeriod = aggregator.aggregate(events,
            new StatsGrouping(StatsGrouping.Level.PERIOD, true, true));
        StatKey key = team(byPeriod, SyntheticGame.HOME).getKey();
        assertEquals(1, key.period());
        assertEquals(SyntheticGame.GAME_ID, key.gameId());
        assertEquals("5v5", key.strengthState());
        assertNotNull(key.scoreState());
        // the faceoff after the goal is played at 1v0 for Pittsburgh
        assertTrue(byPeriod.teams().stream().anyMatch(line -> "1v0".equals(line.getKey().scoreState())
            && SyntheticGame.HOME.equals(line.getKey().team())));

        StatsTables bySeason = aggregator.aggregate(events, new StatsGrouping(StatsGrouping.Level.SEASON, false, false));
        StatKey seasonKey = team(bySeason, SyntheticGame.AWAY).getKey();
        assertNull(seasonKey.gameId());
        assertNull(seasonKey.period());
        assertEquals(20232024, seasonKey.season());
        assertEquals(2, bySeason.teams().size());
    }

    @Test
    void testTimeOnIceRunsToTheNextEvent() {
        StatsTables tables = aggregator.aggregate(events, StatsGrouping.DEFAULT);

        assertEquals(1200, team(tables, SyntheticGame.HOME).getTimeOnIce());
        assertEquals(1200, team(tables, SyntheticGame.AWAY).getTimeOnIce());
        assertEquals(1200, player(tables, "SIDNEY.CROSBY").getTimeOnIce());
        assertEquals(1200, player(tables, "TUUKKA.RASK").getTimeOnIce());
        // the change at 3:05 splits the left wing's minutes
        assertEquals(185, player(tables, "JAKE.GUENTZEL").getTimeOnIce());
        assertEquals(1015, player(tables, "BRYAN.RUST").getTimeOnIce());

        assertEquals(70, StatsAggregator.eventLength(events.get(1), events.get(2)));
        assertEquals(0, StatsAggregator.eventLength(events.get(events.size() - 1), null));
    }

    @Test
    void testForwardLines() {
        StatsTables tables = aggregator.aggregate(events, StatsGrouping.DEFAULT);

        StatLine opening = line(tables, "EVGENI.MALKIN-JAKE.GUENTZEL-SIDNEY.CROSBY");
        assertEquals(SyntheticGame.HOME, opening.getKey().team());
        assertNull(opening.getKey().playerKey());
        assertEquals(185, opening.getTimeOnIce());
        assertEquals(1, opening.getGoalsFor());
        assertEquals(2, opening.getCorsiAgainst());

        StatLine second = line(tables, "BRYAN.RUST-EVGENI.MALKIN-SIDNEY.CROSBY");
        assertEquals(1015, second.getTimeOnIce());
        assertEquals(0, second.getGoalsFor());

        StatLine boston = line(tables, "BRAD.MARCHAND-DAVID.PASTRNAK-PATRICE.BERGERON");
        assertEquals(SyntheticGame.AWAY, boston.getKey().team());
        assertEquals(1200, boston.getTimeOnIce());
        assertEquals(1, boston.getGoalsAgainst());
        assertEquals(2, boston.getCorsiFor());
        assertEquals(3, tables.lines().size());
    }

    @Test
    void testDefensePairs() {
        StatsTables tables = aggregator.aggregate(events,
            new StatsGrouping(StatsGrouping.Level.GAME, false, false, StatsGrouping.LineType.DEFENSE));

        StatLine pair = line(tables, "JOHN.MARINO-KRIS.LETANG");
        assertEquals("JOHN MARINO - KRIS LETANG", pair.getPlayerName());
        assertEquals(1200, pair.getTimeOnIce());
        assertEquals(1, pair.getGoalsFor());
        assertEquals(1200, line(tables, "CHARLIE.MCAVOY-MATT.GRZELCYK").getTimeOnIce());
        assertEquals(2, tables.lines().size());
    }

    @Test
    void testShootoutIsNotCounted() {
        EnrichedEvent shootoutGoal = event(EventType.GOAL, 5, new PlayerRef("SIDNEY.CROSBY", "SIDNEY CROSBY",
            SyntheticGame.CROSBY, SyntheticGame.HOME, 87, null), EventPlayer.GOAL_SCORER);

        StatsTables tables = aggregator.aggregate(List.of(shootoutGoal), StatsGrouping.DEFAULT);

        assertTrue(tables.players().isEmpty());
        assertTrue(tables.teams().isEmpty());
    }

    @Test
    void testUnresolvedPlayerCountsForTeamOnly() {
        PlayerRef unknown = PlayerRef.ofJersey(SyntheticGame.AWAY, 99, null);
        EnrichedEvent take = event(EventType.TAKE, 2, unknown, EventPlayer.TAKER);

        StatsTables tables = aggregator.aggregate(List.of(take), StatsGrouping.DEFAULT);

        assertTrue(tables.players().isEmpty());
        assertEquals(1, team(tables, SyntheticGame.AWAY).getTakeaways());
    }

    @Test
    void testPlayerSideStrengthState() {
        EnrichedEvent powerPlay = EnrichedEvent.builder()
            .event(events.get(0).getEvent())
            .homeStrengthState("5v4")
            .homeScore(2)
            .awayScore(1)
            .build();

        assertEquals("5v4", StatsAggregator.strengthState(powerPlay, Venue.HOME));
        assertEquals("4v5", StatsAggregator.strengthState(powerPlay, Venue.AWAY));
        assertEquals("1v2", StatsAggregator.scoreState(powerPlay, Venue.AWAY));
    }

    private static EnrichedEvent event(EventType type, int period, PlayerRef player, String role) {
        CanonicalEvent canonical = CanonicalEvent.builder()
            .gameId(SyntheticGame.GAME_ID)
            .eventType(type)
            .period(period)
            .eventTeam(player.team())
            .players(List.of(new EventPlayer(player, role)))
            .provenance(new EventProvenance(Set.of(SourceKind.API_EVENTS), 1, null, Set.of()))
            .build();
        return EnrichedEvent.builder()
            .event(canonical)
            .homeTeam(SyntheticGame.HOME)
            .awayTeam(SyntheticGame.AWAY)
            .eventVenue(SyntheticGame.HOME.equals(player.team()) ? Venue.HOME : Venue.AWAY)
            .build();
    }

    private static StatLine player(StatsTables tables, String playerKey) {
        return tables.players().stream().filter(line -> playerKey.equals(line.getKey().playerKey()))
            .findFirst().orElseThrow();
    }

    private static StatLine line(StatsTables tables, String line) {
        return tables.lines().stream().filter(row -> line.equals(row.getKey().line()))
            .findFirst().orElseThrow();
    }

    private static StatLine team(StatsTables tables, String team) {
        return tables.teams().stream().filter(line -> team.equals(line.getKey().team()))
            .findFirst().orElseThrow();
    }
}
