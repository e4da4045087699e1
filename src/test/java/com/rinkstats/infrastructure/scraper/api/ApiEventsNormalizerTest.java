package com.rinkstats.infrastructure.scraper.api;

import com.rinkstats.domain.model.EventPlayer;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.support.SyntheticGame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ApiEventsNormalizer.
 */
class ApiEventsNormalizerTest {

    private ApiEventsNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ApiEventsNormalizer();
    }

    @Test
    void testNormalizePlays() throws Exception {
        List<SourceEvent> events = normalizer.normalize(SyntheticGame.raw(SourceKind.API_EVENTS));

        assertEquals(9, events.size());
        assertEquals(List.of(8, 9, 52, 60, 71, 80, 81, 95, 110),
            events.stream().map(SourceEvent::getEventIdx).toList());
        assertEquals(EventType.PSTR, events.get(0).getEventType());
        assertNull(events.get(0).getEventTeam());
        assertEquals(EventType.PEND, events.get(8).getEventType());
        assertEquals(1200, events.get(8).getGameSeconds());
        assertTrue(events.stream().allMatch(event -> event.getSource() == SourceKind.API_EVENTS));
    }

    @Test
    void testGoalDetails() throws Exception {
        SourceEvent goal = byIdx(normalizer.normalize(SyntheticGame.raw(SourceKind.API_EVENTS)),
            SyntheticGame.GOAL_SORT_ORDER);

        assertEquals(EventType.GOAL, goal.getEventType());
        assertEquals("goal", goal.getRawType());
        assertEquals("03:05", goal.getRawTime());
        assertEquals(1, goal.getPeriod());
        assertEquals(185, goal.getPeriodSeconds());
        assertEquals(185, goal.getGameSeconds());
        assertEquals("PIT", goal.getEventTeam());
        assertEquals(80.0, goal.getCoordsX());
        assertEquals(-5.0, goal.getCoordsY());
        assertEquals("O", goal.getZone());
        assertEquals("WRIST", goal.getShotType());
        assertEquals("1551", goal.getSituationCode());
        assertEquals("left", goal.getHomeDefendingSide());
        assertFalse(goal.isPenaltyShot());

        assertEquals(SyntheticGame.CROSBY, goal.player(0).apiId());
        assertEquals(EventPlayer.GOAL_SCORER, goal.role(0));
        assertEquals(SyntheticGame.GUENTZEL, goal.player(1).apiId());
        assertEquals(EventPlayer.PRIMARY_ASSIST, goal.role(1));
        assertEquals(SyntheticGame.LETANG, goal.player(2).apiId());
        assertEquals(EventPlayer.SECONDARY_ASSIST, goal.role(2));
        assertEquals(SyntheticGame.RASK, goal.getOpposingGoalie().apiId());
        // identities are resolved later against the roster
        assertFalse(goal.player(0).isResolved());
    }

    @Test
    void testPenaltyAndBlockRoles() throws Exception {
        List<SourceEvent> events = normalizer.normalize(SyntheticGame.raw(SourceKind.API_EVENTS));

        SourceEvent penalty = byIdx(events, 95);
        assertEquals("TRIPPING", penalty.getPenalty());
        assertEquals(2, penalty.getPenaltyMinutes());
        assertEquals(SyntheticGame.MARCHAND, penalty.player(0).apiId());
        assertEquals(EventPlayer.COMMITTED_BY, penalty.role(0));
        assertEquals(SyntheticGame.CROSBY, penalty.player(1).apiId());
        assertEquals(EventPlayer.DRAWN_BY, penalty.role(1));

        SourceEvent block = byIdx(events, 71);
        assertEquals(SyntheticGame.MARINO, block.player(0).apiId());
        assertEquals(EventPlayer.BLOCKER, block.role(0));
        assertEquals(SyntheticGame.MCAVOY, block.player(1).apiId());
        assertEquals(EventPlayer.SHOOTER, block.role(1));
    }

    @Test
    void testBenchPenaltyAndRefereeBlock() throws Exception {
        String body = "{\"homeTeam\": {\"id\": 5, \"abbrev\": \"PIT\"}, \"awayTeam\": {\"id\": 6, \"abbrev\": \"BOS\"},"
            + " \"plays\": ["
            + "{\"sortOrder\": 1, \"typeDescKey\": \"penalty\", \"periodDescriptor\": {\"number\": 2},"
            + "  \"timeInPeriod\": \"10:00\", \"details\": {\"eventOwnerTeamId\": 6, \"typeCode\": \"BEN\","
            + "  \"descKey\": \"too-many-men-on-the-ice\", \"duration\": 2, \"servedByPlayerId\": 8473419}},"
            + "{\"sortOrder\": 2, \"typeDescKey\": \"blocked-shot\", \"periodDescriptor\": {\"number\": 2},"
            + "  \"timeInPeriod\": \"11:00\", \"details\": {\"eventOwnerTeamId\": 5, \"shootingPlayerId\": 8471675,"
            + "  \"reason\": \"teammate-blocked\"}},"
            + "{\"sortOrder\": 3, \"typeDescKey\": \"shot-on-goal\", \"periodDescriptor\": {\"number\": 2},"
            + "  \"timeInPeriod\": \"12:00\", \"situationCode\": \"0101\", \"details\": {\"eventOwnerTeamId\": 5,"
            + "  \"shootingPlayerId\": 8471675}}"
            + "]}";

        List<SourceEvent> events = normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.API_EVENTS, "inline", body));

        SourceEvent bench = events.get(0);
        assertEquals(PlayerRef.BENCH, bench.player(0));
        assertEquals(SyntheticGame.MARCHAND, bench.player(1).apiId());
        assertEquals(EventPlayer.SERVED_BY, bench.role(1));
        assertEquals(1800, bench.getGameSeconds());

        SourceEvent block = events.get(1);
        assertEquals("OTHER", block.getEventTeam());
        assertEquals(PlayerRef.REFEREE, block.player(0));

        assertTrue(events.get(2).isPenaltyShot());
    }

    @Test
    void testVersionsCountRepeatedEvents() throws Exception {
        String body = "{\"homeTeam\": {\"id\": 5, \"abbrev\": \"PIT\"}, \"awayTeam\": {\"id\": 6, \"abbrev\": \"BOS\"},"
            + " \"plays\": ["
            + "{\"sortOrder\": 1, \"typeDescKey\": \"hit\", \"periodDescriptor\": {\"number\": 1},"
            + "  \"timeInPeriod\": \"04:00\", \"details\": {\"hittingPlayerId\": 8471724}},"
            + "{\"sortOrder\": 2, \"typeDescKey\": \"hit\", \"periodDescriptor\": {\"number\": 1},"
            + "  \"timeInPeriod\": \"04:00\", \"details\": {\"hittingPlayerId\": 8471724}},"
            + "{\"sortOrder\": 3, \"typeDescKey\": \"hit\", \"periodDescriptor\": {\"number\": 1},"
            + "  \"timeInPeriod\": \"04:00\", \"details\": {\"hittingPlayerId\": 8471675}},"
            + "{\"sortOrder\": 4, \"typeDescKey\": \"shootout-something-new\"}"
            + "]}";

        List<SourceEvent> events = normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.API_EVENTS, "inline", body));

        assertEquals(3, events.size());
        assertEquals(List.of(1, 2, 1), events.stream().map(SourceEvent::getVersion).toList());
    }

    @Test
    void testStructuralDefects() {
        assertThrows(SourceParseException.class, () -> normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.API_EVENTS, "inline", SyntheticGame.apiDocument(false))));
        assertThrows(SourceParseException.class, () -> normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.API_EVENTS, "inline", "{not json")));
        assertThrows(SourceParseException.class, () -> normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.API_EVENTS, "inline", "{\"plays\": []}")));
    }

    private static SourceEvent byIdx(List<SourceEvent> events, int idx) {
        return events.stream().filter(event -> event.getEventIdx() == idx).findFirst().orElseThrow();
    }
}
