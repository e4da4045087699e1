package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.domain.model.PlayerShift;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.Venue;
import com.rinkstats.support.SyntheticGame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HtmlShiftsNormalizer.
 */
class HtmlShiftsNormalizerTest {

    private HtmlShiftsNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new HtmlShiftsNormalizer();
    }

    @Test
    void testNormalizeHomeReport() throws Exception {
        List<PlayerShift> shifts = normalizer.normalize(SyntheticGame.raw(SourceKind.HTML_HOME_SHIFTS));

        assertEquals(7, shifts.size());
        assertTrue(shifts.stream().allMatch(shift -> shift.venue() == Venue.HOME));

        PlayerShift crosby = shifts.get(0);
        assertEquals("SIDNEY CROSBY", crosby.playerName());
        assertEquals(87, crosby.jersey());
        assertEquals(1, crosby.shiftNumber());
        assertEquals(1, crosby.period());
        assertEquals(0, crosby.startSeconds());
        assertEquals(1200, crosby.endSeconds());
        assertEquals(1200, crosby.durationSeconds());
        assertNull(crosby.team());

        PlayerShift guentzel = shifts.stream().filter(shift -> shift.jersey() == 59).findFirst().orElseThrow();
        assertEquals(185, guentzel.endSeconds());
        assertEquals(185, guentzel.durationSeconds());
    }

    @Test
    void testAwayReport() throws Exception {
        List<PlayerShift> shifts = normalizer.normalize(SyntheticGame.raw(SourceKind.HTML_AWAY_SHIFTS));

        assertEquals(6, shifts.size());
        assertEquals(Venue.AWAY, shifts.get(0).venue());
        assertEquals("PATRICE BERGERON", shifts.get(0).playerName());
    }

    @Test
    void testOvertimeAndPhantomShifts() throws Exception {
        String body = "<html><body><table><tr><td class=\"teamHeading\">PITTSBURGH PENGUINS</td></tr>"
            + "<tr><td class=\"playerHeading\">58 LETANG, KRIS</td></tr>"
            + row("1", "OT", "1:00 / 4:00", "1:45 / 3:15", "00:45")
            + row("2", "3", "31:23 / 0:00", "0:00 / 0:00", "00:00")
            + "<tr><td class=\"lborder bborder\">TOTAL</td><td class=\"lborder bborder\">0:45</td></tr>"
            + "</table></body></html>";

        List<PlayerShift> shifts = normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.HTML_HOME_SHIFTS, "inline", body));

        assertEquals(1, shifts.size());
        assertEquals(4, shifts.get(0).period());
        assertEquals(60, shifts.get(0).startSeconds());
        assertEquals(105, shifts.get(0).endSeconds());
        assertEquals(45, shifts.get(0).durationSeconds());
    }

    @Test
    void testStructuralDefects() {
        assertThrows(SourceParseException.class, () -> normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.HTML_HOME_SHIFTS, "inline", "<html></html>")));

        String badPeriod = "<html><body><table><tr><td class=\"teamHeading\">PITTSBURGH PENGUINS</td></tr>"
            + "<tr><td class=\"playerHeading\">58 LETANG, KRIS</td></tr>"
            + row("1", "?", "1:00 / 19:00", "1:45 / 18:15", "00:45") + "</table></body></html>";
        assertThrows(SourceParseException.class, () -> normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.HTML_HOME_SHIFTS, "inline", badPeriod)));
    }

    private static String row(String... cells) {
        StringBuilder row = new StringBuilder("<tr>");
        for (String cell : cells) {
            row.append("<td class=\"lborder bborder\">").append(cell).append("</td>");
        }
        return row.append("</tr>").toString();
    }
}
