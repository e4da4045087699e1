package com.rinkstats.domain.model;

import java.util.regex.Pattern;

/**
 * Manually curated edit for a known defect in one game's source records. Rules are keyed by game
 * and source, then either by event index, by a description pattern, or neither (all events).
 *
 * @param role player role to record alongside a player SET, e.g. "DRAWN BY"
 */
public record CorrectionRule(
    GameId gameId,
    SourceKind source,
    Integer eventIdx,
    String descriptionPattern,
    CorrectionField field,
    CorrectionAction action,
    String find,
    String value,
    String role,
    String note
) {

    public CorrectionRule {
        if (gameId == null || source == null || field == null || action == null) {
            throw new IllegalArgumentException("gameId, source, field and action are required");
        }
        if (action == CorrectionAction.REPLACE && (find == null || find.isEmpty())) {
            throw new IllegalArgumentException("REPLACE rule for " + gameId + " needs a find text");
        }
        if (action == CorrectionAction.SWAP_PLAYERS && field.playerSlot() < 0) {
            throw new IllegalArgumentException("SWAP_PLAYERS rule for " + gameId + " must target a player field");
        }
    }

    /**
     * Whether this rule targets the given event of its game and source.
     */
    public boolean matches(SourceEvent event) {
        if (!gameId.equals(event.getGameId()) || source != event.getSource()) {
            return false;
        }
        if (eventIdx != null && eventIdx != event.getEventIdx()) {
            return false;
        }
        if (descriptionPattern != null) {
            String description = event.getDescription();
            return description != null && Pattern.compile(descriptionPattern).matcher(description).find();
        }
        return true;
    }
}
