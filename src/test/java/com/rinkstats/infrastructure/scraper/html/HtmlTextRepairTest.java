package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.SourceEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HtmlTextRepair.
 */
class HtmlTextRepairTest {

    @Test
    void testCleanText() {
        assertEquals("TIM STUTZLE", HtmlTextRepair.cleanText("Tim Stützle"));
        assertEquals("A B", HtmlTextRepair.cleanText("  a   b "));
        assertEquals("", HtmlTextRepair.cleanText(null));
    }

    @Test
    void testFixTeamCodesAndNames() {
        assertEquals("LAK WON OFF. ZONE - LAK #11 VS SJS #19", HtmlTextRepair.fixTeamCodes("L.A WON OFF. ZONE - L.A #11 VS S.J #19"));
        assertEquals("ARI #19 DOAN", HtmlTextRepair.fixTeamCodes("PHX #19 DOAN"));
        assertNull(HtmlTextRepair.fixTeamCodes(null));

        assertEquals("ARIZONA COYOTES", HtmlTextRepair.fixTeamName("Phoenix Coyotes"));
        assertEquals("MONTREAL CANADIENS", HtmlTextRepair.fixTeamName("CANADIENS MONTRÉAL"));
        assertEquals("BOSTON BRUINS", HtmlTextRepair.fixTeamName("Boston Bruins"));
    }

    @Test
    void testNameCells() {
        assertEquals("SIDNEY CROSBY", HtmlTextRepair.stripCaptaincy("SIDNEY CROSBY (C)"));
        assertEquals("KRIS LETANG", HtmlTextRepair.stripCaptaincy("KRIS LETANG  (A)"));
        assertArrayEquals(new String[] {"17", "MILAN LUCIC"}, HtmlTextRepair.splitLeadingJersey("17 MILAN LUCIC"));
        assertNull(HtmlTextRepair.splitLeadingJersey("MILAN LUCIC"));
    }

    @Test
    void testElapsedClock() {
        assertEquals(247, HtmlTextRepair.parseElapsed("4:0715:53"));
        assertEquals(1200, HtmlTextRepair.parseElapsed("20:000:00"));
        assertNull(HtmlTextRepair.parseElapsed("4:7015:53"));
        assertNull(HtmlTextRepair.parseElapsed("-16:0-120:00"));
        assertEquals("4:07", HtmlTextRepair.elapsedText("4:07 15:53"));
        assertNull(HtmlTextRepair.elapsedText(null));
    }

    @Test
    void testPeriodEndRepairOnlyTouchesGarbledClock() {
        SourceEvent periodEnd = event(EventType.PEND, 1, "20:000:00");

        assertFalse(HtmlTextRepair.repairPeriodEndClock(periodEnd, List.of(periodEnd), SessionType.REGULAR));
        assertEquals("20:000:00", periodEnd.getRawTime());

        SourceEvent overtimeEnd = event(EventType.PEND, 4, HtmlTextRepair.GARBLED_CLOCK);
        assertTrue(HtmlTextRepair.repairPeriodEndClock(overtimeEnd, List.of(overtimeEnd), SessionType.REGULAR));
        assertEquals(300, HtmlTextRepair.parseElapsed(overtimeEnd.getRawTime()));
    }

    private static SourceEvent event(EventType type, int period, String rawTime) {
        SourceEvent event = new SourceEvent();
        event.setEventType(type);
        event.setPeriod(period);
        event.setRawTime(rawTime);
        return event;
    }
}
