package com.rinkstats.infrastructure.corrections;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rinkstats.application.reconcile.CorrectionTable;
import com.rinkstats.domain.model.CorrectionAction;
import com.rinkstats.domain.model.CorrectionField;
import com.rinkstats.domain.model.CorrectionRule;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.SourceKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads the versioned correction table from a JSON array on the classpath.
 */
public class CorrectionRuleLoader {

    private static final Logger logger = LoggerFactory.getLogger(CorrectionRuleLoader.class);

    public static final String DEFAULT_RESOURCE = "corrections/correction-rules.json";

    private final ObjectMapper objectMapper;

    public CorrectionRuleLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public CorrectionTable load(String resource) {
        try (InputStream input = CorrectionRuleLoader.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException("Correction table not found on classpath: " + resource);
            }
            CorrectionTable table = new CorrectionTable(parse(objectMapper.readTree(input), resource));
            logger.info("Loaded {} correction rules from {}", table.size(), resource);
            return table;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read correction table " + resource, e);
        }
    }

    List<CorrectionRule> parse(JsonNode root, String resource) {
        if (!root.isArray()) {
            throw new IllegalStateException("Correction table " + resource + " must be a JSON array");
        }
        List<CorrectionRule> rules = new ArrayList<>();
        int position = 0;
        for (JsonNode node : root) {
            position++;
            try {
                rules.add(new CorrectionRule(
                    GameId.of(node.path("gameId").asText()),
                    SourceKind.valueOf(node.path("source").asText()),
                    node.hasNonNull("eventIdx") ? node.get("eventIdx").asInt() : null,
                    text(node, "descriptionPattern"),
                    CorrectionField.valueOf(node.path("field").asText()),
                    CorrectionAction.valueOf(node.path("action").asText()),
                    text(node, "find"),
                    text(node, "value"),
                    text(node, "role"),
                    text(node, "note")
                ));
            } catch (IllegalArgumentException e) {
                throw new IllegalStateException("Invalid rule #" + position + " in " + resource + ": " + e.getMessage(), e);
            }
        }
        return rules;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
