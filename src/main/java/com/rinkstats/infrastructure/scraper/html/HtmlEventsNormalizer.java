package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.ports.SourceNormalizer;
import com.rinkstats.infrastructure.scraper.EventVersions;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Events from the HTML play-by-play report. The report is a flat grid of eight cells per event:
 * number, period, strength, time, event code, description, away on-ice, home on-ice.
 */
public class HtmlEventsNormalizer implements SourceNormalizer<SourceEvent> {

    private static final Logger logger = LoggerFactory.getLogger(HtmlEventsNormalizer.class);

    private static final int COLUMNS = 8;

    private static final Map<EventType, String> NON_DESCRIPTS = Map.of(
        EventType.PGSTR, "PRE-GAME START",
        EventType.PGEND, "PRE-GAME END",
        EventType.ANTHEM, "NATIONAL ANTHEM",
        EventType.EISTR, "EARLY INTERMISSION START",
        EventType.EIEND, "EARLY INTERMISSION END"
    );

    @Override
    public List<SourceKind> kinds() {
        return List.of(SourceKind.HTML_EVENTS);
    }

    @Override
    public List<SourceEvent> normalize(RawSource source) throws SourceParseException {
        Document document = Jsoup.parse(source.body());
        Elements cells = document.select("td[class*=bborder]");
        if (cells.isEmpty()) {
            throw new SourceParseException(source.gameId(), source.kind(), "No event cells in report");
        }
        if (cells.size() % COLUMNS != 0) {
            throw new SourceParseException(source.gameId(), source.kind(),
                "Event grid has " + cells.size() + " cells, not a multiple of " + COLUMNS);
        }

        List<SourceEvent> events = new ArrayList<>();
        int unknownTypes = 0;
        for (int row = 0; row < cells.size(); row += COLUMNS) {
            String[] values = new String[COLUMNS];
            boolean header = false;
            for (int column = 0; column < COLUMNS; column++) {
                Element cell = cells.get(row + column);
                values[column] = HtmlTextRepair.cleanText(cell.text());
                header |= values[column].equals("#");
            }
            if (header) {
                continue;
            }
            EventType type = EventType.fromCode(values[4]);
            if (type == null) {
                unknownTypes++;
                continue;
            }
            Integer eventIdx = parseInt(values[0]);
            if (eventIdx == null) {
                throw new SourceParseException(source.gameId(), source.kind(),
                    "Unreadable event number '" + values[0] + "'");
            }

            SourceEvent event = new SourceEvent();
            event.setGameId(source.gameId());
            event.setSource(SourceKind.HTML_EVENTS);
            event.setEventIdx(eventIdx);
            event.setPeriod(parseInt(values[1]));
            event.setStrength(values[2].isEmpty() ? null : values[2]);
            event.setRawTime(values[3].replace(" ", ""));
            event.setEventType(type);
            event.setRawType(values[4]);
            String description = NON_DESCRIPTS.getOrDefault(type, values[5]);
            event.setDescription(HtmlTextRepair.fixTeamCodes(description));
            events.add(event);
        }

        SessionType session = source.gameId().sessionType();
        for (SourceEvent event : events) {
            if (event.getEventType() == EventType.PEND && event.getPeriod() != null
                && HtmlTextRepair.repairPeriodEndClock(event, events, session)) {
                logger.info("{} repaired garbled period-end clock in period {}", source.gameId(), event.getPeriod());
            }
            applyClock(event, session);
            HtmlDescriptionParser.parse(event);
        }

        EventVersions.assign(events);
        logger.debug("{} normalized {} HTML events ({} unknown codes skipped)", source.gameId(), events.size(),
            unknownTypes);
        return events;
    }

    /**
     * Sets period and game seconds from the raw clock. An unreadable clock leaves both null.
     */
    public static void applyClock(SourceEvent event, SessionType session) {
        Integer elapsed = HtmlTextRepair.parseElapsed(event.getRawTime());
        event.setPeriodSeconds(elapsed);
        if (elapsed == null || event.getPeriod() == null) {
            event.setGameSeconds(null);
            return;
        }
        event.setGameSeconds(GameClock.gameSeconds(session, event.getPeriod(), elapsed));
    }

    private static Integer parseInt(String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
