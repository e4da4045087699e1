package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.Position;

import java.text.Normalizer;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiPredicate;

/**
 * Name normalization shared by both sources, and the player identity key built from it.
 */
public final class NormalizationUtils {

    private static final Map<String, String> NAME_ALIASES = new LinkedHashMap<>();
    private static final Map<String, BiPredicate<Position, Integer>> DUPLICATE_KEYS = new LinkedHashMap<>();

    static {
        NAME_ALIASES.put("ALEXANDRE", "ALEX");
        NAME_ALIASES.put("ALEXANDER", "ALEX");
        NAME_ALIASES.put("CHRISTOPHER", "CHRIS");

        // Two different players share these keys; the second one gets a "2" suffix.
        DUPLICATE_KEYS.put("SEBASTIAN.AHO", (position, season) -> position == Position.D);
        DUPLICATE_KEYS.put("COLIN.WHITE", (position, season) -> season >= 20162017);
        DUPLICATE_KEYS.put("SEAN.COLLINS", (position, season) -> position != Position.D);
        DUPLICATE_KEYS.put("ALEX.PICARD", (position, season) -> position != Position.D);
        DUPLICATE_KEYS.put("ERIK.GUSTAFSSON", (position, season) -> season >= 20152016);
        DUPLICATE_KEYS.put("MIKKO.LEHTONEN", (position, season) -> season >= 20202021);
        DUPLICATE_KEYS.put("NATHAN.SMITH", (position, season) -> season >= 20212022);
        DUPLICATE_KEYS.put("DANIIL.TARASOV", (position, season) -> position == Position.G);
    }

    private NormalizationUtils() {
    }

    /**
     * Removes accents and non-breaking spaces, e.g. "Stützle" becomes "Stutzle".
     */
    public static String stripAccents(String text) {
        if (text == null) {
            return null;
        }
        String normalized = Normalizer.normalize(text.replace('\u00A0', ' '), Normalizer.Form.NFD);
        return normalized.replaceAll("\\p{M}", "");
    }

    /**
     * Upper-cased, accent-free player name with collapsed whitespace and the historical first-name
     * aliases applied.
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = stripAccents(name).toUpperCase().replaceAll("\\s+", " ").trim();
        for (Map.Entry<String, String> alias : NAME_ALIASES.entrySet()) {
            normalized = normalized.replace(alias.getKey(), alias.getValue());
        }
        return normalized;
    }

    /**
     * Identity key of a player: FIRST.LAST, with documented collisions disambiguated.
     *
     * @param name normalized player name, first name first
     * @param position roster position, may be null
     * @param season season such as 20232024
     */
    public static String playerKey(String name, Position position, int season) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String[] parts = name.trim().split(" ", 2);
        String key = parts.length == 1 ? parts[0] + "." : parts[0] + "." + parts[1];
        key = key.replace("..", ".");

        if (key.equals("COLIN.")) {
            return "COLIN.WHITE2";
        }
        BiPredicate<Position, Integer> duplicate = DUPLICATE_KEYS.get(key);
        if (duplicate != null && duplicate.test(position, season)) {
            return key + "2";
        }
        return key;
    }
}
