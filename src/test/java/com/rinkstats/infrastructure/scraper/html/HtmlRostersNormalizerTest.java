package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.domain.model.HtmlRosterPlayer;
import com.rinkstats.domain.model.Position;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.RosterStatus;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.Venue;
import com.rinkstats.support.SyntheticGame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for HtmlRostersNormalizer.
 */
class HtmlRostersNormalizerTest {

    private HtmlRostersNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new HtmlRostersNormalizer();
    }

    @Test
    void testNormalizeReport() throws Exception {
        List<HtmlRosterPlayer> players = normalizer.normalize(SyntheticGame.raw(SourceKind.HTML_ROSTERS));

        assertEquals(SyntheticGame.PLAYERS.size() + 2, players.size());
        // away team is listed first
        assertEquals(Venue.AWAY, players.get(0).venue());
        assertEquals("BOSTON BRUINS", players.get(0).teamName());
        assertNull(players.get(0).team());

        HtmlRosterPlayer crosby = find(players, Venue.HOME, 87);
        assertEquals("SIDNEY CROSBY", crosby.playerName());
        assertEquals("PITTSBURGH PENGUINS", crosby.teamName());
        assertEquals(Position.C, crosby.position());
        assertTrue(crosby.starter());
        assertEquals(RosterStatus.ACTIVE, crosby.status());

        HtmlRosterPlayer rust = find(players, Venue.HOME, 17);
        assertFalse(rust.starter());

        HtmlRosterPlayer heinen = find(players, Venue.HOME, 43);
        assertEquals(RosterStatus.SCRATCH, heinen.status());
        assertEquals("DANTON HEINEN", heinen.playerName());
        assertEquals(RosterStatus.SCRATCH, find(players, Venue.AWAY, 14).status());
    }

    @Test
    void testNumberInNameCell() throws Exception {
        String body = "<html><body><table><tr><td class=\"teamHeading\">PHOENIX COYOTES</td>"
            + "<td class=\"teamHeading\">MONTREAL CANADIENS</td></tr></table>"
            + table("<tr><td></td><td>L</td><td>17 MILAN LUCIC</td></tr>")
            + table("<tr><td>79</td><td>D</td><td>ANDREI MARKOV (A)</td></tr>"
                + "<tr><td></td><td>C</td><td>NOBODY</td></tr>")
            + "</body></html>";

        List<HtmlRosterPlayer> players = normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.HTML_ROSTERS, "inline", body));

        assertEquals(2, players.size());
        assertEquals("ARIZONA COYOTES", players.get(0).teamName());
        assertEquals(17, players.get(0).jersey());
        assertEquals("MILAN LUCIC", players.get(0).playerName());
        assertEquals("ANDREI MARKOV", players.get(1).playerName());
        assertEquals(Venue.HOME, players.get(1).venue());
    }

    @Test
    void testStructuralDefects() {
        assertThrows(SourceParseException.class, () -> normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.HTML_ROSTERS, "inline", "<html></html>")));

        String ragged = "<html><body><table><tr><td class=\"teamHeading\">A</td><td class=\"teamHeading\">B</td>"
            + "</tr></table>" + table("<tr><td>1</td><td>C</td></tr>") + table("") + "</body></html>";
        assertThrows(SourceParseException.class, () -> normalizer.normalize(
            new RawSource(SyntheticGame.GAME_ID, SourceKind.HTML_ROSTERS, "inline", ragged)));
    }

    private static String table(String rows) {
        return "<table xmlns:ext=\"urn:roster\"><tr><td>#</td><td>Pos</td><td>Name</td></tr>" + rows + "</table>";
    }

    private static HtmlRosterPlayer find(List<HtmlRosterPlayer> players, Venue venue, int jersey) {
        return players.stream().filter(player -> player.venue() == venue && player.jersey() == jersey)
            .findFirst().orElseThrow();
    }
}
