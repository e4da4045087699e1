package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.ApiRosterPlayer;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.GameInfo;
import com.rinkstats.domain.model.HtmlRosterPlayer;
import com.rinkstats.domain.model.Position;
import com.rinkstats.domain.model.RosterEntry;
import com.rinkstats.domain.model.RosterStatus;
import com.rinkstats.domain.model.Venue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins the API and HTML rosters on (team, sweater number) into one entry per player.
 * When both sources list a player the API decides position and roster status and the HTML report
 * supplies the starter flag; a player listed by one source only keeps what that source has.
 */
public class RosterReconciler {

    private static final Logger logger = LoggerFactory.getLogger(RosterReconciler.class);

    public List<RosterEntry> reconcile(GameInfo gameInfo, List<ApiRosterPlayer> apiPlayers,
                                       List<HtmlRosterPlayer> htmlPlayers) {
        GameId gameId = gameInfo.gameId();
        int season = gameId.season();
        Map<String, ApiRosterPlayer> api = new LinkedHashMap<>();
        for (ApiRosterPlayer player : apiPlayers) {
            ApiRosterPlayer previous = api.put(player.team() + player.jersey(), player);
            if (previous != null) {
                logger.warn("{} API roster lists {}{} twice ({} and {})", gameId, player.team(), player.jersey(),
                    previous.playerName(), player.playerName());
            }
        }
        Map<String, HtmlRosterPlayer> html = new LinkedHashMap<>();
        for (HtmlRosterPlayer player : htmlPlayers) {
            String team = gameInfo.team(player.venue()).abbrev();
            HtmlRosterPlayer previous = html.putIfAbsent(team + player.jersey(), player);
            // a dressed player can also appear among the scratches in older reports
            if (previous != null && previous.status() == RosterStatus.SCRATCH && player.status() == RosterStatus.ACTIVE) {
                html.put(team + player.jersey(), player);
            }
        }

        List<RosterEntry> entries = new ArrayList<>();
        for (Map.Entry<String, HtmlRosterPlayer> row : html.entrySet()) {
            HtmlRosterPlayer htmlPlayer = row.getValue();
            ApiRosterPlayer apiPlayer = api.remove(row.getKey());
            String team = gameInfo.team(htmlPlayer.venue()).abbrev();
            if (apiPlayer != null) {
                Position position = apiPlayer.position() != null ? apiPlayer.position() : htmlPlayer.position();
                String name = htmlPlayer.playerName();
                entries.add(new RosterEntry(gameId, team, htmlPlayer.venue(), htmlPlayer.jersey(), name,
                    NormalizationUtils.playerKey(name, position, season), apiPlayer.apiId(), position,
                    RosterStatus.ACTIVE, htmlPlayer.starter(), true, true));
            } else {
                entries.add(new RosterEntry(gameId, team, htmlPlayer.venue(), htmlPlayer.jersey(),
                    htmlPlayer.playerName(),
                    NormalizationUtils.playerKey(htmlPlayer.playerName(), htmlPlayer.position(), season),
                    null, htmlPlayer.position(), htmlPlayer.status(), htmlPlayer.starter(), false, true));
            }
        }
        for (ApiRosterPlayer apiPlayer : api.values()) {
            Venue venue = apiPlayer.venue() != null ? apiPlayer.venue() : gameInfo.venueOf(apiPlayer.team());
            entries.add(new RosterEntry(gameId, apiPlayer.team(), venue, apiPlayer.jersey(), apiPlayer.playerName(),
                NormalizationUtils.playerKey(apiPlayer.playerName(), apiPlayer.position(), season),
                apiPlayer.apiId(), apiPlayer.position(), RosterStatus.ACTIVE, false, true, false));
        }

        entries.sort(Comparator.comparing((RosterEntry entry) -> entry.venue() == Venue.HOME ? 0 : 1)
            .thenComparing(RosterEntry::jersey));
        long apiOnly = entries.stream().filter(entry -> !entry.inHtml()).count();
        long htmlOnly = entries.stream().filter(entry -> !entry.inApi()).count();
        logger.info("{} reconciled roster: {} players ({} API only, {} HTML only)", gameId, entries.size(), apiOnly,
            htmlOnly);
        return entries;
    }
}
