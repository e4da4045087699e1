package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.CorrectionAction;
import com.rinkstats.domain.model.CorrectionField;
import com.rinkstats.domain.model.CorrectionRule;
import com.rinkstats.domain.model.DiagnosticFlag;
import com.rinkstats.domain.model.EventPlayer;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.ports.EventReparser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CorrectionTable.
 */
class CorrectionTableTest {

    private static final GameId GAME_ID = GameId.of(2010021176L);
    private static final GameId OTHER_GAME = GameId.of(2010021177L);

    private RecordingReparser reparser;

    @BeforeEach
    void setUp() {
        reparser = new RecordingReparser();
    }

    @Test
    void testSetPlayerWithRole() {
        CorrectionTable table = new CorrectionTable(List.of(
            rule(SourceKind.API_EVENTS, 213, CorrectionField.PLAYER_3, CorrectionAction.SET, null, "8467396",
                EventPlayer.DRAWN_BY)));
        SourceEvent penalty = event(SourceKind.API_EVENTS, 213, EventType.PENL);
        penalty.addPlayer(PlayerRef.ofApiId(8470000L), EventPlayer.COMMITTED_BY);

        List<SourceEvent> result = table.apply(GAME_ID, SourceKind.API_EVENTS, List.of(penalty), reparser);

        assertEquals(1, result.size());
        assertEquals(8467396L, penalty.player(2).apiId());
        assertEquals(EventPlayer.DRAWN_BY, penalty.role(2));
        // skipped slot is padded
        assertNull(penalty.player(1));
        assertTrue(penalty.hasFlag(DiagnosticFlag.CORRECTED));
        assertEquals(0, reparser.calls);
    }

    @Test
    void testRulesOnlyTouchTheirGameSourceAndEvent() {
        CorrectionTable table = new CorrectionTable(List.of(
            rule(SourceKind.HTML_EVENTS, 5, CorrectionField.EVENT_TEAM, CorrectionAction.SET, null, "BOS", null)));
        SourceEvent target = event(SourceKind.HTML_EVENTS, 5, EventType.HIT);
        SourceEvent otherIdx = event(SourceKind.HTML_EVENTS, 6, EventType.HIT);

        table.apply(GAME_ID, SourceKind.HTML_EVENTS, List.of(target, otherIdx), reparser);

        assertEquals("BOS", target.getEventTeam());
        assertEquals("PIT", otherIdx.getEventTeam());
        assertFalse(otherIdx.hasFlag(DiagnosticFlag.CORRECTED));
        assertTrue(table.rulesFor(OTHER_GAME, SourceKind.HTML_EVENTS).isEmpty());
        assertTrue(table.rulesFor(GAME_ID, SourceKind.API_EVENTS).isEmpty());
        assertEquals(1, table.size());
    }

    @Test
    void testDropRemovesEvent() {
        CorrectionTable table = new CorrectionTable(List.of(
            rule(SourceKind.HTML_EVENTS, 2, CorrectionField.EVENT, CorrectionAction.DROP, null, null, null)));
        List<SourceEvent> events = List.of(event(SourceKind.HTML_EVENTS, 1, EventType.FAC),
            event(SourceKind.HTML_EVENTS, 2, EventType.GOAL), event(SourceKind.HTML_EVENTS, 3, EventType.FAC));

        List<SourceEvent> result = table.apply(GAME_ID, SourceKind.HTML_EVENTS, events, reparser);

        assertEquals(2, result.size());
        assertEquals(1, result.get(0).getEventIdx());
        assertEquals(3, result.get(1).getEventIdx());
    }

    @Test
    void testTextEditTriggersReparseBeforeStructuredEdits() {
        CorrectionTable table = new CorrectionTable(List.of(
            rule(SourceKind.HTML_EVENTS, 4, CorrectionField.PLAYER_1, CorrectionAction.SET, null, "PIT#87",
                EventPlayer.SHOOTER),
            rule(SourceKind.HTML_EVENTS, 4, CorrectionField.DESCRIPTION, CorrectionAction.REPLACE, "#78", "#87", null)));
        SourceEvent shot = event(SourceKind.HTML_EVENTS, 4, EventType.SHOT);
        shot.setDescription("PIT ONGOAL - #78 CROSBY, WRIST, OFF. ZONE, 12 FT.");
        shot.addPlayer(PlayerRef.ofJersey("PIT", 78, null), EventPlayer.SHOOTER);

        table.apply(GAME_ID, SourceKind.HTML_EVENTS, List.of(shot), reparser);

        assertEquals(1, reparser.calls);
        assertEquals("PIT ONGOAL - #87 CROSBY, WRIST, OFF. ZONE, 12 FT.", shot.getDescription());
        // the reparser cleared the players, the structured rule ran after it
        assertEquals("PIT87", shot.player(0).teamJersey());
        assertEquals(EventPlayer.SHOOTER, shot.role(0));
    }

    @Test
    void testDescriptionPatternSelectsEvents() {
        CorrectionTable table = new CorrectionTable(List.of(
            new CorrectionRule(GAME_ID, SourceKind.HTML_EVENTS, null, "BLOCKED BY\\s+TEAMMATE",
                CorrectionField.EVENT_TYPE, CorrectionAction.SET, null, "MISS", null, "teammate block")));
        SourceEvent block = event(SourceKind.HTML_EVENTS, 7, EventType.BLOCK);
        block.setDescription("PIT #58 LETANG BLOCKED BY  TEAMMATE, WRIST, DEF. ZONE");
        SourceEvent otherBlock = event(SourceKind.HTML_EVENTS, 8, EventType.BLOCK);
        otherBlock.setDescription("BOS #73 MCAVOY BLOCKED BY PIT #6 MARINO, WRIST, DEF. ZONE");

        table.apply(GAME_ID, SourceKind.HTML_EVENTS, List.of(block, otherBlock), reparser);

        assertEquals(EventType.MISS, block.getEventType());
        assertEquals(EventType.BLOCK, otherBlock.getEventType());
    }

    @Test
    void testPeriodAndClockEditsRecomputeGameSeconds() {
        CorrectionTable table = new CorrectionTable(List.of(
            rule(SourceKind.API_EVENTS, 10, CorrectionField.PERIOD, CorrectionAction.SET, null, "2", null),
            rule(SourceKind.API_EVENTS, 11, CorrectionField.PERIOD_SECONDS, CorrectionAction.SET, null, "45", null)));
        SourceEvent wrongPeriod = event(SourceKind.API_EVENTS, 10, EventType.HIT);
        SourceEvent wrongClock = event(SourceKind.API_EVENTS, 11, EventType.HIT);

        table.apply(GAME_ID, SourceKind.API_EVENTS, List.of(wrongPeriod, wrongClock), null);

        assertEquals(2, wrongPeriod.getPeriod());
        assertEquals(1300, wrongPeriod.getGameSeconds());
        assertEquals(45, wrongClock.getPeriodSeconds());
        assertEquals(45, wrongClock.getGameSeconds());
    }

    @Test
    void testSwapPlayers() {
        CorrectionTable table = new CorrectionTable(List.of(
            rule(SourceKind.HTML_EVENTS, 3, CorrectionField.PLAYER_1, CorrectionAction.SWAP_PLAYERS, null, "PLAYER_2",
                null)));
        SourceEvent faceoff = event(SourceKind.HTML_EVENTS, 3, EventType.FAC);
        faceoff.addPlayer(PlayerRef.ofJersey("BOS", 37, null), EventPlayer.WINNER);
        faceoff.addPlayer(PlayerRef.ofJersey("PIT", 87, null), EventPlayer.LOSER);

        table.apply(GAME_ID, SourceKind.HTML_EVENTS, List.of(faceoff), reparser);

        assertEquals("PIT87", faceoff.player(0).teamJersey());
        assertEquals(EventPlayer.WINNER, faceoff.role(0));
        assertEquals("BOS37", faceoff.player(1).teamJersey());
    }

    @Test
    void testPlayerValues() {
        SourceEvent event = event(SourceKind.HTML_EVENTS, 1, EventType.GOAL);
        event.addPlayer(PlayerRef.ofJersey("PIT", 87, null), EventPlayer.GOAL_SCORER);

        assertEquals(8467396L, CorrectionTable.playerValue(event, "8467396").apiId());
        assertEquals("BOS17", CorrectionTable.playerValue(event, "bos#17").teamJersey());
        assertEquals("BOS17", CorrectionTable.playerValue(event, "BOS 17").teamJersey());
        assertSame(PlayerRef.BENCH, CorrectionTable.playerValue(event, "BENCH"));
        assertSame(PlayerRef.TEAMMATE, CorrectionTable.playerValue(event, "teammate"));
        assertEquals("PIT87", CorrectionTable.playerValue(event, "@PLAYER_1").teamJersey());
        assertNull(CorrectionTable.playerValue(event, " "));
        assertThrows(IllegalArgumentException.class, () -> CorrectionTable.playerValue(event, "CROSBY"));
    }

    @Test
    void testRuleValidation() {
        assertThrows(IllegalArgumentException.class, () ->
            rule(SourceKind.HTML_EVENTS, 1, CorrectionField.DESCRIPTION, CorrectionAction.REPLACE, null, "X", null));
        assertThrows(IllegalArgumentException.class, () ->
            rule(SourceKind.HTML_EVENTS, 1, CorrectionField.EVENT_TEAM, CorrectionAction.SWAP_PLAYERS, null, "PLAYER_2",
                null));
    }

    @Test
    void testEmptyTableReturnsInput() {
        List<SourceEvent> events = new ArrayList<>(List.of(event(SourceKind.API_EVENTS, 1, EventType.FAC)));

        assertSame(events, CorrectionTable.empty().apply(GAME_ID, SourceKind.API_EVENTS, events, reparser));
    }

    private static CorrectionRule rule(SourceKind source, Integer eventIdx, CorrectionField field,
                                       CorrectionAction action, String find, String value, String role) {
        return new CorrectionRule(GAME_ID, source, eventIdx, null, field, action, find, value, role, null);
    }

    private static SourceEvent event(SourceKind source, int eventIdx, EventType type) {
        SourceEvent event = new SourceEvent();
        event.setGameId(GAME_ID);
        event.setSource(source);
        event.setEventIdx(eventIdx);
        event.setEventType(type);
        event.setPeriod(1);
        event.setPeriodSeconds(100);
        event.setGameSeconds(100);
        event.setEventTeam("PIT");
        return event;
    }

    /**
     * Stands in for a report parser: clears parsed players, as re-parsing a description does.
     */
    private static class RecordingReparser implements EventReparser {
        int calls;

        @Override
        public SourceKind source() {
            return SourceKind.HTML_EVENTS;
        }

        @Override
        public void reparse(SourceEvent event) {
            calls++;
            event.setPlayers(null);
        }
    }
}
