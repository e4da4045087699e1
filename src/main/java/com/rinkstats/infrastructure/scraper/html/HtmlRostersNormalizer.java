package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.application.reconcile.NormalizationUtils;
import com.rinkstats.domain.model.HtmlRosterPlayer;
import com.rinkstats.domain.model.Position;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.RosterStatus;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.Venue;
import com.rinkstats.domain.ports.SourceNormalizer;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Dressed and scratched players from the HTML roster report. The report lists the away team
 * first. Team codes are not printed in the report; the roster reconciler assigns them by venue.
 */
public class HtmlRostersNormalizer implements SourceNormalizer<HtmlRosterPlayer> {

    private static final Logger logger = LoggerFactory.getLogger(HtmlRostersNormalizer.class);

    private static final Venue[] VENUES = {Venue.AWAY, Venue.HOME};

    @Override
    public List<SourceKind> kinds() {
        return List.of(SourceKind.HTML_ROSTERS);
    }

    @Override
    public List<HtmlRosterPlayer> normalize(RawSource source) throws SourceParseException {
        Document document = Jsoup.parse(source.body());
        Elements headings = document.select("td.teamHeading");
        List<Element> tables = new ArrayList<>();
        for (Element table : document.getElementsByTag("table")) {
            if (table.hasAttr("xmlns:ext")) {
                tables.add(table);
            }
        }
        if (headings.size() < 2 || tables.size() < 2) {
            throw new SourceParseException(source.gameId(), source.kind(),
                "Expected two team headings and two roster tables, found " + headings.size() + " and " + tables.size());
        }

        List<HtmlRosterPlayer> players = new ArrayList<>();
        for (int idx = 0; idx < VENUES.length; idx++) {
            String teamName = HtmlTextRepair.fixTeamName(headings.get(idx).text());
            players.addAll(readTable(tables.get(idx), teamName, VENUES[idx], RosterStatus.ACTIVE, source));
            if (tables.size() > idx + 2) {
                players.addAll(readTable(tables.get(idx + 2), teamName, VENUES[idx], RosterStatus.SCRATCH, source));
            }
        }
        logger.debug("{} normalized {} HTML roster rows", source.gameId(), players.size());
        return players;
    }

    private List<HtmlRosterPlayer> readTable(Element table, String teamName, Venue venue, RosterStatus status,
                                             RawSource source) throws SourceParseException {
        Elements cells = table.getElementsByTag("td");
        if (cells.size() % 3 != 0) {
            throw new SourceParseException(source.gameId(), source.kind(),
                venue + " " + status + " table has " + cells.size() + " cells");
        }
        Set<String> starters = new HashSet<>();
        if (status == RosterStatus.ACTIVE) {
            Elements bold = table.select("td.bold");
            for (int i = 2; i < bold.size(); i += 3) {
                starters.add(HtmlTextRepair.cleanText(bold.get(i).text()));
            }
        }

        List<HtmlRosterPlayer> players = new ArrayList<>();
        // first triple is the "#, Pos, Name" header
        for (int i = 3; i + 2 < cells.size(); i += 3) {
            String jerseyCell = HtmlTextRepair.cleanText(cells.get(i).text());
            String positionCell = HtmlTextRepair.cleanText(cells.get(i + 1).text());
            String nameCell = HtmlTextRepair.cleanText(cells.get(i + 2).text());
            boolean starter = starters.contains(nameCell);

            String name = HtmlTextRepair.stripCaptaincy(nameCell);
            Integer jersey = parseJersey(jerseyCell);
            if (jersey == null) {
                String[] split = HtmlTextRepair.splitLeadingJersey(name);
                if (split == null) {
                    logger.warn("{} {} roster row without a sweater number: '{}'", source.gameId(), venue, nameCell);
                    continue;
                }
                jersey = Integer.parseInt(split[0]);
                name = split[1];
            }
            if (name.isEmpty()) {
                continue;
            }
            players.add(new HtmlRosterPlayer(null, teamName, venue, NormalizationUtils.normalizeName(name), jersey,
                Position.fromCode(positionCell), starter, status));
        }
        return players;
    }

    private static Integer parseJersey(String cell) {
        if (cell == null || cell.isEmpty()) {
            return null;
        }
        try {
            return Integer.parseInt(cell);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
