package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.application.reconcile.NormalizationUtils;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.PlayerShift;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.Venue;
import com.rinkstats.domain.ports.SourceNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Shifts from one team's HTML time-on-ice report. Each player heading ("87 CROSBY, SIDNEY") is
 * followed by five cells per shift: number, period, start, end, duration. Clock cells read
 * "elapsed / remaining".
 */
public class HtmlShiftsNormalizer implements SourceNormalizer<PlayerShift> {

    private static final Logger logger = LoggerFactory.getLogger(HtmlShiftsNormalizer.class);

    /** Placeholder start time printed for shifts that never happened. */
    private static final String PHANTOM_START = "31:23";

    private static final int SHIFT_CELLS = 5;

    @Override
    public List<SourceKind> kinds() {
        return List.of(SourceKind.HTML_HOME_SHIFTS, SourceKind.HTML_AWAY_SHIFTS);
    }

    @Override
    public List<PlayerShift> normalize(RawSource source) throws SourceParseException {
        Document document = Jsoup.parse(source.body());
        Element heading = document.selectFirst("td.teamHeading");
        if (heading == null) {
            throw new SourceParseException(source.gameId(), source.kind(), "No team heading in shift report");
        }
        Venue venue = source.kind() == SourceKind.HTML_HOME_SHIFTS ? Venue.HOME : Venue.AWAY;

        List<PlayerShift> shifts = new ArrayList<>();
        String playerName = null;
        Integer jersey = null;
        List<String> cells = new ArrayList<>();
        for (Element cell : document.select("td.playerHeading, td.lborder.bborder")) {
            String text = HtmlTextRepair.cleanText(cell.text());
            if (cell.hasClass("playerHeading")) {
                readShifts(source, venue, playerName, jersey, cells, shifts);
                cells.clear();
                playerName = null;
                jersey = null;
                int comma = text.indexOf(',');
                int space = text.indexOf(' ');
                if (comma < 0 || space < 0 || space > comma) {
                    continue;
                }
                try {
                    jersey = Integer.parseInt(text.substring(0, space));
                } catch (NumberFormatException e) {
                    throw new SourceParseException(source.gameId(), source.kind(),
                        "Unreadable player heading '" + text + "'", e);
                }
                String lastName = text.substring(space + 1, comma).trim();
                String firstName = HtmlTextRepair.stripCaptaincy(text.substring(comma + 1));
                playerName = NormalizationUtils.normalizeName(firstName + " " + lastName);
            } else if (playerName != null) {
                cells.add(text);
            }
        }
        readShifts(source, venue, playerName, jersey, cells, shifts);

        logger.debug("{} normalized {} {} shifts", source.gameId(), shifts.size(), venue);
        return shifts;
    }

    private static void readShifts(RawSource source, Venue venue, String playerName, Integer jersey,
                                   List<String> cells, List<PlayerShift> shifts) throws SourceParseException {
        if (playerName == null || playerName.isBlank()) {
            return;
        }
        // trailing summary rows do not come in groups of five
        int usable = cells.size() - cells.size() % SHIFT_CELLS;
        for (int i = 0; i < usable; i += SHIFT_CELLS) {
            Integer shiftNumber = parseInt(cells.get(i));
            if (shiftNumber == null) {
                continue;
            }
            String periodCell = cells.get(i + 1).replace("OT", "4").replace("SO", "5");
            Integer period = parseInt(periodCell);
            if (period == null) {
                throw new SourceParseException(source.gameId(), source.kind(),
                    "Unreadable period '" + cells.get(i + 1) + "' for " + playerName);
            }
            String start = elapsed(cells.get(i + 2));
            if (PHANTOM_START.equals(start)) {
                continue;
            }
            shifts.add(new PlayerShift(source.gameId(), null, venue, playerName, jersey, shiftNumber, period,
                GameClock.parseClock(start), GameClock.parseClock(elapsed(cells.get(i + 3))),
                GameClock.parseClock(cells.get(i + 4))));
        }
    }

    private static String elapsed(String cell) {
        int slash = cell.indexOf('/');
        return (slash < 0 ? cell : cell.substring(0, slash)).trim();
    }

    private static Integer parseInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
