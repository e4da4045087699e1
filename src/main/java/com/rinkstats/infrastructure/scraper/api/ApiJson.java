package com.rinkstats.infrastructure.scraper.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rinkstats.domain.model.RawSource;
import com.rinkstats.domain.model.SourceParseException;
import com.rinkstats.domain.model.TeamInfo;
import com.rinkstats.domain.model.Venue;

import java.util.HashMap;
import java.util.Map;

/**
 * Reading helpers for the gamecenter documents.
 */
final class ApiJson {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private ApiJson() {
    }

    static JsonNode readTree(RawSource source) throws SourceParseException {
        try {
            JsonNode root = objectMapper.readTree(source.body());
            if (root == null || !root.isObject()) {
                throw new SourceParseException(source.gameId(), source.kind(), "Document is not a JSON object");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new SourceParseException(source.gameId(), source.kind(), "Invalid JSON: " + e.getOriginalMessage(), e);
        }
    }

    static JsonNode require(JsonNode node, String field, RawSource source) throws SourceParseException {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new SourceParseException(source.gameId(), source.kind(), "Missing field '" + field + "'");
        }
        return value;
    }

    /**
     * Text of a localized field such as {"default": "Penguins"}, or of a plain text field.
     */
    static String localized(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isObject()) {
            JsonNode text = value.get("default");
            return text == null || text.isNull() ? null : text.asText();
        }
        return value.asText();
    }

    static Long longOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.canConvertToLong() ? null : value.asLong();
    }

    static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.canConvertToInt() ? null : value.asInt();
    }

    static Double doubleOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || !value.isNumber() ? null : value.asDouble();
    }

    static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static TeamInfo team(JsonNode teamNode) {
        String name = localized(teamNode, "name");
        if (name == null) {
            String place = localized(teamNode, "placeName");
            String common = localized(teamNode, "commonName");
            name = place != null && common != null ? place + " " + common : common;
        }
        return new TeamInfo(intOrNull(teamNode, "id"), textOrNull(teamNode, "abbrev"),
            name == null ? null : name.toUpperCase());
    }

    /**
     * Team id to (venue, abbreviation) for the two teams of the document.
     */
    static Map<Integer, Map.Entry<Venue, String>> teamsById(JsonNode root, RawSource source) throws SourceParseException {
        TeamInfo home = team(require(root, "homeTeam", source));
        TeamInfo away = team(require(root, "awayTeam", source));
        if (home.id() == null || away.id() == null || home.abbrev() == null || away.abbrev() == null) {
            throw new SourceParseException(source.gameId(), source.kind(), "Team header is incomplete");
        }
        Map<Integer, Map.Entry<Venue, String>> teams = new HashMap<>();
        teams.put(home.id(), Map.entry(Venue.HOME, home.abbrev()));
        teams.put(away.id(), Map.entry(Venue.AWAY, away.abbrev()));
        return teams;
    }
}
