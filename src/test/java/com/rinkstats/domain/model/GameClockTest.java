package com.rinkstats.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GameClock.
 */
class GameClockTest {

    @Test
    void testGameSeconds() {
        assertEquals(185, GameClock.gameSeconds(SessionType.REGULAR, 1, 185));
        assertEquals(2585, GameClock.gameSeconds(SessionType.REGULAR, 3, 185));
        assertEquals(3610, GameClock.gameSeconds(SessionType.REGULAR, 4, 10));
    }

    @Test
    void testShootoutIsPinnedAfterOvertime() {
        assertEquals(3900, GameClock.gameSeconds(SessionType.REGULAR, 5, 0));
        assertEquals(3901, GameClock.gameSeconds(SessionType.PRESEASON, 5, 1));
        // playoff games have no shootout, period 5 is a second overtime
        assertEquals(4810, GameClock.gameSeconds(SessionType.PLAYOFF, 5, 10));
        assertFalse(GameClock.isShootout(SessionType.PLAYOFF, 5));
    }

    @Test
    void testPeriodLength() {
        assertEquals(1200, GameClock.periodLength(SessionType.REGULAR, 3));
        assertEquals(300, GameClock.periodLength(SessionType.REGULAR, 4));
        assertEquals(1200, GameClock.periodLength(SessionType.PLAYOFF, 4));
    }

    @Test
    void testParseClock() {
        assertEquals(247, GameClock.parseClock("4:07"));
        assertEquals(247, GameClock.parseClock("04:07"));
        assertEquals(1200, GameClock.parseClock("20:00"));
        assertNull(GameClock.parseClock("4:70"));
        assertNull(GameClock.parseClock("-16:0-120:00"));
        assertNull(GameClock.parseClock(""));
        assertNull(GameClock.parseClock(null));
    }
}
