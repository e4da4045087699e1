package com.rinkstats.application.reconcile;

import java.util.Collection;

/**
 * Fuzzy player-name matching with Jaro-Winkler similarity. Names are compared after
 * {@link NormalizationUtils#normalizeName(String)}, so accents and aliases do not count as
 * differences.
 */
public class PlayerNameMatcher {

    public static final double DEFAULT_THRESHOLD = 0.88;

    private static final double SCALING_FACTOR = 0.1;
    private static final int MAX_PREFIX_LENGTH = 4;

    private final double threshold;

    public PlayerNameMatcher() {
        this(DEFAULT_THRESHOLD);
    }

    public PlayerNameMatcher(double threshold) {
        if (threshold <= 0 || threshold > 1) {
            throw new IllegalArgumentException("Threshold must be in (0, 1]");
        }
        this.threshold = threshold;
    }

    /**
     * Returns the candidate most similar to {@code name}, or null when none reaches the threshold
     * or two candidates tie for the best score.
     */
    public String bestMatch(String name, Collection<String> candidates) {
        String target = NormalizationUtils.normalizeName(name);
        if (target == null || target.isEmpty()) {
            return null;
        }
        String best = null;
        double bestScore = -1;
        boolean tied = false;
        for (String candidate : candidates) {
            double score = similarity(target, NormalizationUtils.normalizeName(candidate));
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
                tied = false;
            } else if (score == bestScore) {
                tied = true;
            }
        }
        if (best == null || bestScore < threshold || tied) {
            return null;
        }
        return best;
    }

    public boolean matches(String first, String second) {
        return similarity(NormalizationUtils.normalizeName(first), NormalizationUtils.normalizeName(second)) >= threshold;
    }

    /**
     * Jaro-Winkler similarity in [0, 1].
     */
    public static double similarity(String s1, String s2) {
        if (s1 == null || s2 == null) {
            return 0.0;
        }
        if (s1.equals(s2)) {
            return 1.0;
        }
        if (s1.isEmpty() || s2.isEmpty()) {
            return 0.0;
        }
        double jaro = jaro(s1, s2);
        int prefix = 0;
        int maxPrefix = Math.min(MAX_PREFIX_LENGTH, Math.min(s1.length(), s2.length()));
        while (prefix < maxPrefix && s1.charAt(prefix) == s2.charAt(prefix)) {
            prefix++;
        }
        return jaro + prefix * SCALING_FACTOR * (1.0 - jaro);
    }

    private static double jaro(String s1, String s2) {
        int window = Math.max(0, Math.max(s1.length(), s2.length()) / 2 - 1);
        boolean[] matched1 = new boolean[s1.length()];
        boolean[] matched2 = new boolean[s2.length()];

        int matches = 0;
        for (int i = 0; i < s1.length(); i++) {
            int end = Math.min(i + window + 1, s2.length());
            for (int j = Math.max(0, i - window); j < end; j++) {
                if (!matched2[j] && s1.charAt(i) == s2.charAt(j)) {
                    matched1[i] = true;
                    matched2[j] = true;
                    matches++;
                    break;
                }
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < s1.length(); i++) {
            if (!matched1[i]) {
                continue;
            }
            while (!matched2[k]) {
                k++;
            }
            if (s1.charAt(i) != s2.charAt(k)) {
                transpositions++;
            }
            k++;
        }
        double m = matches;
        return (m / s1.length() + m / s2.length() + (m - transpositions / 2.0) / m) / 3.0;
    }
}
