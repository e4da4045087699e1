package com.rinkstats.infrastructure.scraper.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.rinkstats.application.reconcile.NormalizationUtils;
import com.rinkstats.domain.model.ApiRosterPlayer;
import com.rinkstats.domain.model.Position;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.Venue;
import com.rinkstats.domain.ports.SourceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Dressed players from the rosterSpots block of the play-by-play document.
 */
public class ApiRostersNormalizer implements SourceNormalizer<ApiRosterPlayer> {

    private static final Logger logger = LoggerFactory.getLogger(ApiRostersNormalizer.class);

    @Override
    public List<SourceKind> kinds() {
        return List.of(SourceKind.API_ROSTERS);
    }

    @Override
    public List<ApiRosterPlayer> normalize(RawSource source) throws SourceParseException {
        JsonNode root = ApiJson.readTree(source);
        Map<Integer, Map.Entry<Venue, String>> teams = ApiJson.teamsById(root, source);
        JsonNode spots = root.get("rosterSpots");
        if (spots == null || !spots.isArray()) {
            throw new SourceParseException(source.gameId(), source.kind(), "Missing rosterSpots array");
        }

        List<ApiRosterPlayer> players = new ArrayList<>();
        for (JsonNode spot : spots) {
            Integer teamId = ApiJson.intOrNull(spot, "teamId");
            Long playerId = ApiJson.longOrNull(spot, "playerId");
            Integer jersey = ApiJson.intOrNull(spot, "sweaterNumber");
            Map.Entry<Venue, String> team = teamId == null ? null : teams.get(teamId);
            if (team == null || playerId == null || jersey == null) {
                logger.warn("{} skipping incomplete roster spot {}", source.gameId(), spot);
                continue;
            }
            String firstName = NormalizationUtils.normalizeName(ApiJson.localized(spot, "firstName"));
            String lastName = NormalizationUtils.normalizeName(ApiJson.localized(spot, "lastName"));
            String playerName = NormalizationUtils.normalizeName(
                (firstName == null ? "" : firstName) + " " + (lastName == null ? "" : lastName));

            players.add(new ApiRosterPlayer(team.getValue(), team.getKey(), playerId, firstName, lastName,
                playerName, jersey, Position.fromCode(ApiJson.textOrNull(spot, "positionCode")),
                ApiJson.textOrNull(spot, "headshot")));
        }
        return players;
    }
}
