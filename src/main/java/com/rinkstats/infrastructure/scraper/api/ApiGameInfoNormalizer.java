package com.rinkstats.infrastructure.scraper.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.rinkstats.domain.model.GameInfo;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.TeamInfo;
import com.rinkstats.domain.ports.SourceNormalizer;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Reads the game header. Accepts the landing document and, as a fallback, the play-by-play
 * document, which carries the same header fields.
 */
public class ApiGameInfoNormalizer implements SourceNormalizer<GameInfo> {

    @Override
    public List<SourceKind> kinds() {
        return List.of(SourceKind.API_GAME_INFO, SourceKind.API_EVENTS);
    }

    @Override
    public List<GameInfo> normalize(RawSource source) throws SourceParseException {
        JsonNode root = ApiJson.readTree(source);
        TeamInfo home = ApiJson.team(ApiJson.require(root, "homeTeam", source));
        TeamInfo away = ApiJson.team(ApiJson.require(root, "awayTeam", source));
        if (home.abbrev() == null || away.abbrev() == null) {
            throw new SourceParseException(source.gameId(), source.kind(), "Team abbreviations missing");
        }

        LocalDate gameDate = null;
        Instant startTime = null;
        try {
            String date = ApiJson.textOrNull(root, "gameDate");
            gameDate = date == null ? null : LocalDate.parse(date);
            String start = ApiJson.textOrNull(root, "startTimeUTC");
            startTime = start == null ? null : Instant.parse(start);
        } catch (DateTimeParseException e) {
            throw new SourceParseException(source.gameId(), source.kind(), "Unreadable schedule: " + e.getMessage(), e);
        }

        GameInfo info = new GameInfo(source.gameId(), home, away, ApiJson.localized(root, "venue"),
            gameDate, startTime, ApiJson.textOrNull(root, "gameState"));
        return List.of(info);
    }
}
