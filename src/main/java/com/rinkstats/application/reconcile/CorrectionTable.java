package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.CorrectionAction;
import com.rinkstats.domain.model.CorrectionField;
import com.rinkstats.domain.model.CorrectionRule;
import com.rinkstats.domain.model.DiagnosticFlag;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.ports.EventReparser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only table of per-game corrections, applied to each source stream before matching.
 * Rules apply in table order. Edits to raw text (clock, period, description) run first and the
 * event is re-parsed before structured edits (players, team, type) are applied, so a structured
 * edit is never overwritten by re-parsing.
 */
public class CorrectionTable {

    private static final Logger logger = LoggerFactory.getLogger(CorrectionTable.class);

    private static final Set<CorrectionField> TEXT_FIELDS =
        EnumSet.of(CorrectionField.TIME, CorrectionField.DESCRIPTION);

    private static final Pattern TEAM_JERSEY = Pattern.compile("^([A-Z]{3})\\s*#?([0-9]{1,2})$");
    private static final Pattern API_ID = Pattern.compile("^[0-9]{5,}$");

    private final Map<GameId, Map<SourceKind, List<CorrectionRule>>> rules = new HashMap<>();
    private final int size;

    public CorrectionTable(List<CorrectionRule> rules) {
        for (CorrectionRule rule : rules) {
            this.rules.computeIfAbsent(rule.gameId(), id -> new HashMap<>())
                .computeIfAbsent(rule.source(), source -> new ArrayList<>())
                .add(rule);
        }
        this.size = rules.size();
    }

    public static CorrectionTable empty() {
        return new CorrectionTable(List.of());
    }

    public int size() {
        return size;
    }

    public List<CorrectionRule> rulesFor(GameId gameId, SourceKind source) {
        return rules.getOrDefault(gameId, Collections.emptyMap()).getOrDefault(source, List.of());
    }

    /**
     * Applies the rules for one game's source stream. Corrected events are flagged
     * {@link DiagnosticFlag#CORRECTED}; dropped events are left out of the returned list.
     *
     * @param reparser re-derives parsed fields after a raw-text edit; may be null
     */
    public List<SourceEvent> apply(GameId gameId, SourceKind source, List<SourceEvent> events,
                                   EventReparser reparser) {
        List<CorrectionRule> applicable = rulesFor(gameId, source);
        if (applicable.isEmpty()) {
            return events;
        }

        List<SourceEvent> kept = new ArrayList<>();
        int applied = 0;
        for (SourceEvent event : events) {
            List<CorrectionRule> matching = applicable.stream().filter(rule -> rule.matches(event)).toList();
            if (matching.isEmpty()) {
                kept.add(event);
                continue;
            }
            if (matching.stream().anyMatch(rule -> rule.action() == CorrectionAction.DROP)) {
                logger.info("{} dropped {} event {} by correction", gameId, source, event.getEventIdx());
                applied++;
                continue;
            }

            boolean textChanged = false;
            for (CorrectionRule rule : matching) {
                if (isTextRule(rule) && applyText(event, rule)) {
                    textChanged = true;
                    applied++;
                }
            }
            if (textChanged && reparser != null) {
                reparser.reparse(event);
            }
            boolean structured = false;
            for (CorrectionRule rule : matching) {
                if (!isTextRule(rule)) {
                    applyStructured(event, rule);
                    structured = true;
                    applied++;
                }
            }
            if (textChanged || structured) {
                event.addFlag(DiagnosticFlag.CORRECTED);
            }
            kept.add(event);
        }
        if (applied > 0) {
            logger.info("{} applied {} corrections to {}", gameId, applied, source);
        }
        return kept;
    }

    private static boolean isTextRule(CorrectionRule rule) {
        return TEXT_FIELDS.contains(rule.field()) || rule.field() == CorrectionField.PERIOD;
    }

    /**
     * @return true when the event text changed
     */
    private static boolean applyText(SourceEvent event, CorrectionRule rule) {
        switch (rule.field()) {
            case TIME -> {
                String updated = edit(event.getRawTime(), rule);
                if (Objects.equals(updated, event.getRawTime())) {
                    return false;
                }
                event.setRawTime(updated);
                return true;
            }
            case DESCRIPTION -> {
                String updated = edit(event.getDescription(), rule);
                if (Objects.equals(updated, event.getDescription())) {
                    return false;
                }
                event.setDescription(updated);
                return true;
            }
            case PERIOD -> {
                Integer period = parseInt(rule);
                event.setPeriod(period);
                recomputeGameSeconds(event);
                return true;
            }
            default -> throw new IllegalStateException("Not a text field: " + rule.field());
        }
    }

    private static void applyStructured(SourceEvent event, CorrectionRule rule) {
        CorrectionField field = rule.field();
        switch (field) {
            case PERIOD_SECONDS -> {
                event.setPeriodSeconds(parseInt(rule));
                recomputeGameSeconds(event);
            }
            case EVENT_TEAM -> event.setEventTeam(edit(event.getEventTeam(), rule));
            case EVENT_TYPE -> {
                EventType type = EventType.fromCode(rule.value());
                if (type == null) {
                    throw new IllegalStateException("Unknown event type in correction for " + rule.gameId() + ": "
                        + rule.value());
                }
                event.setEventType(type);
            }
            case OPPOSING_GOALIE -> event.setOpposingGoalie(playerValue(event, rule.value()));
            case PLAYER_1, PLAYER_2, PLAYER_3 -> applyPlayer(event, rule);
            default -> throw new IllegalStateException("Cannot apply " + rule.action() + " to " + field);
        }
    }

    private static void applyPlayer(SourceEvent event, CorrectionRule rule) {
        int slot = rule.field().playerSlot();
        if (rule.action() == CorrectionAction.SWAP_PLAYERS) {
            event.swapPlayers(slot, CorrectionField.valueOf(rule.value()).playerSlot());
            return;
        }
        PlayerRef player = playerValue(event, rule.value());
        if (player == null && rule.role() == null) {
            event.clearPlayer(slot);
            return;
        }
        event.setPlayer(slot, player, rule.role());
    }

    /**
     * Reads a player value: an API id, a team and sweater number ("BOS#17"), a placeholder
     * (BENCH, REFEREE, TEAMMATE), or "@PLAYER_n" to copy another slot. Blank clears.
     */
    static PlayerRef playerValue(SourceEvent event, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim().toUpperCase();
        if (trimmed.startsWith("@")) {
            return event.player(CorrectionField.valueOf(trimmed.substring(1)).playerSlot());
        }
        switch (trimmed) {
            case "BENCH" -> {
                return PlayerRef.BENCH;
            }
            case "REFEREE" -> {
                return PlayerRef.REFEREE;
            }
            case "TEAMMATE" -> {
                return PlayerRef.TEAMMATE;
            }
            default -> {
            }
        }
        if (API_ID.matcher(trimmed).matches()) {
            return PlayerRef.ofApiId(Long.parseLong(trimmed));
        }
        Matcher teamJersey = TEAM_JERSEY.matcher(trimmed);
        if (teamJersey.matches()) {
            return PlayerRef.ofJersey(teamJersey.group(1), Integer.parseInt(teamJersey.group(2)), null);
        }
        throw new IllegalArgumentException("Unreadable player value '" + value + "'");
    }

    private static String edit(String current, CorrectionRule rule) {
        if (rule.action() == CorrectionAction.REPLACE) {
            return current == null ? null : current.replace(rule.find(), rule.value() == null ? "" : rule.value());
        }
        if (rule.action() != CorrectionAction.SET) {
            throw new IllegalStateException("Cannot apply " + rule.action() + " to " + rule.field());
        }
        return rule.value() == null || rule.value().isEmpty() ? null : rule.value();
    }

    private static Integer parseInt(CorrectionRule rule) {
        if (rule.value() == null || rule.value().isBlank()) {
            return null;
        }
        return Integer.parseInt(rule.value().trim());
    }

    private static void recomputeGameSeconds(SourceEvent event) {
        if (event.getPeriod() == null || event.getPeriodSeconds() == null) {
            event.setGameSeconds(null);
            return;
        }
        event.setGameSeconds(GameClock.gameSeconds(event.getGameId().sessionType(), event.getPeriod(),
            event.getPeriodSeconds()));
    }
}
