package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.DiagnosticFlag;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TimestampAnomalies.
 */
class TimestampAnomaliesTest {

    @Test
    void testOrderedStreamIsClean() {
        List<SourceEvent> stream = stream(1, 0, 1, 30, 1, 30, 1, 400, 2, 0, 2, 15);

        assertEquals(0, TimestampAnomalies.flag(stream, SessionType.REGULAR));
        assertTrue(stream.stream().noneMatch(event -> event.hasFlag(DiagnosticFlag.UNCORRECTED_ANOMALY)));
    }

    @Test
    void testSingleOutlierIsFlagged() {
        List<SourceEvent> stream = stream(1, 100, 1, 900, 1, 120, 1, 150, 1, 200);

        assertEquals(1, TimestampAnomalies.flag(stream, SessionType.REGULAR));
        assertTrue(stream.get(1).hasFlag(DiagnosticFlag.UNCORRECTED_ANOMALY));
    }

    @Test
    void testOrderIsCheckedWithinEachPeriod() {
        // resetting to 0:00 in period 2 is not a regression
        List<SourceEvent> stream = stream(1, 1100, 1, 1200, 2, 0, 2, 50);

        assertEquals(0, TimestampAnomalies.flag(stream, SessionType.REGULAR));
    }

    @Test
    void testClockBeyondPeriodLength() {
        // overtime lasts five minutes in the regular season
        List<SourceEvent> stream = stream(4, 100, 4, 310);

        assertEquals(1, TimestampAnomalies.flag(stream, SessionType.REGULAR));
        assertEquals(100, stream.get(1).getPeriodSeconds());
        assertEquals(3700, stream.get(1).getGameSeconds());

        List<SourceEvent> playoff = stream(4, 100, 4, 310);
        assertEquals(0, TimestampAnomalies.flag(playoff, SessionType.PLAYOFF));
    }

    @Test
    void testMissingPeriodAndClockArePlaced() {
        List<SourceEvent> stream = stream(2, 40, 2, 60);
        SourceEvent unreadable = event(null, null);
        stream.add(unreadable);

        assertEquals(1, TimestampAnomalies.flag(stream, SessionType.REGULAR));
        assertEquals(2, unreadable.getPeriod());
        assertEquals(60, unreadable.getPeriodSeconds());
        assertEquals(1260, unreadable.getGameSeconds());
    }

    @Test
    void testCorrectedEventsAreNotFlagged() {
        List<SourceEvent> stream = stream(1, 100, 1, 900, 1, 120);
        stream.get(1).addFlag(DiagnosticFlag.CORRECTED);

        assertEquals(0, TimestampAnomalies.flag(stream, SessionType.REGULAR));
        assertFalse(stream.get(1).hasFlag(DiagnosticFlag.UNCORRECTED_ANOMALY));
    }

    @Test
    void testOutOfOrderKeepsLongestRun() {
        List<SourceEvent> events = stream(1, 10, 1, 50, 1, 20, 1, 30, 1, 40);

        List<SourceEvent> outliers = TimestampAnomalies.outOfOrder(events);

        assertEquals(List.of(events.get(1)), outliers);
        assertTrue(TimestampAnomalies.outOfOrder(List.of()).isEmpty());
    }

    private static List<SourceEvent> stream(int... periodAndSeconds) {
        List<SourceEvent> events = new ArrayList<>();
        for (int i = 0; i < periodAndSeconds.length; i += 2) {
            events.add(event(periodAndSeconds[i], periodAndSeconds[i + 1]));
        }
        return events;
    }

    private static SourceEvent event(Integer period, Integer seconds) {
        SourceEvent event = new SourceEvent();
        event.setSource(SourceKind.HTML_EVENTS);
        event.setEventType(EventType.HIT);
        event.setPeriod(period);
        event.setPeriodSeconds(seconds);
        return event;
    }
}
