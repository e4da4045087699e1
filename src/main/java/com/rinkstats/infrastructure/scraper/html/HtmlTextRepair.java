package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.application.reconcile.NormalizationUtils;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.SourceEvent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Text-level workarounds for known defects in the legacy HTML reports. Applied before the
 * structured parse.
 */
public final class HtmlTextRepair {

    /** Period-end clock as printed by some 2013-2018 reports. */
    public static final String GARBLED_CLOCK = "-16:0-120:00";

    private static final Map<String, String> LEGACY_TEAM_CODES = new LinkedHashMap<>();
    private static final Map<String, String> TEAM_NAME_FIXES = Map.of(
        "PHOENIX COYOTES", "ARIZONA COYOTES"
    );
    private static final Pattern ELAPSED_CLOCK = Pattern.compile("^(\\d{1,2}):(\\d{2})");
    private static final Pattern CAPTAINCY = Pattern.compile("\\(\\s?(.*)\\)");
    private static final Pattern LEADING_JERSEY = Pattern.compile("^(\\d{1,2})\\s+(.+)$");

    static {
        LEGACY_TEAM_CODES.put("L.A", "LAK");
        LEGACY_TEAM_CODES.put("N.J", "NJD");
        LEGACY_TEAM_CODES.put("S.J", "SJS");
        LEGACY_TEAM_CODES.put("T.B", "TBL");
        LEGACY_TEAM_CODES.put("PHX", "ARI");
    }

    private HtmlTextRepair() {
    }

    /**
     * Accent-free, upper-cased cell text with non-breaking spaces and line breaks flattened.
     */
    public static String cleanText(String text) {
        if (text == null) {
            return "";
        }
        String cleaned = NormalizationUtils.stripAccents(text)
            .replace("\n ", ", ")
            .replace("\n", "")
            .replaceAll("[ \\t]+", " ");
        return cleaned.trim().toUpperCase();
    }

    /**
     * Replaces the dotted and retired team codes with the codes the API uses.
     */
    public static String fixTeamCodes(String description) {
        if (description == null) {
            return null;
        }
        String fixed = description;
        for (Map.Entry<String, String> code : LEGACY_TEAM_CODES.entrySet()) {
            fixed = fixed.replace(code.getKey(), code.getValue());
        }
        return fixed;
    }

    public static String fixTeamName(String teamName) {
        String cleaned = cleanText(teamName);
        if (cleaned.contains("CANADIENS")) {
            return "MONTREAL CANADIENS";
        }
        return TEAM_NAME_FIXES.getOrDefault(cleaned, cleaned);
    }

    /**
     * Removes captaincy and similar markers, e.g. "SIDNEY CROSBY (C)".
     */
    public static String stripCaptaincy(String name) {
        if (name == null) {
            return null;
        }
        return CAPTAINCY.matcher(name).replaceAll("").trim();
    }

    /**
     * Splits a name cell that carries the sweater number, e.g. "17 MILAN LUCIC", for rows whose
     * number cell is blank. Returns null when the name has no leading number.
     */
    public static String[] splitLeadingJersey(String nameCell) {
        if (nameCell == null) {
            return null;
        }
        Matcher matcher = LEADING_JERSEY.matcher(nameCell.trim());
        if (!matcher.matches()) {
            return null;
        }
        return new String[] {matcher.group(1), matcher.group(2)};
    }

    /**
     * Elapsed seconds from a clock cell that holds elapsed and remaining time run together,
     * e.g. "4:0715:53"; null when the elapsed part cannot be read.
     */
    public static Integer parseElapsed(String rawTime) {
        if (rawTime == null) {
            return null;
        }
        Matcher matcher = ELAPSED_CLOCK.matcher(rawTime.replace(" ", ""));
        if (!matcher.find()) {
            return null;
        }
        int seconds = Integer.parseInt(matcher.group(2));
        if (seconds > 59) {
            return null;
        }
        return Integer.parseInt(matcher.group(1)) * 60 + seconds;
    }

    /**
     * Elapsed part of a clock cell formatted as "m:ss", or null when unreadable.
     */
    public static String elapsedText(String rawTime) {
        Integer seconds = parseElapsed(rawTime);
        if (seconds == null) {
            return null;
        }
        return (seconds / 60) + ":" + String.format("%02d", seconds % 60);
    }

    /**
     * Replaces the garbled period-end clock with the time of the period's last goal, or with the
     * period length when the period had no goal.
     *
     * @return true when the clock was replaced
     */
    public static boolean repairPeriodEndClock(SourceEvent periodEnd, List<SourceEvent> stream, SessionType session) {
        if (periodEnd.getEventType() != EventType.PEND || !GARBLED_CLOCK.equals(periodEnd.getRawTime())) {
            return false;
        }
        String replacement = null;
        for (SourceEvent event : stream) {
            if (event.getEventType() == EventType.GOAL && periodEnd.getPeriod().equals(event.getPeriod())
                && parseElapsed(event.getRawTime()) != null) {
                replacement = event.getRawTime();
            }
        }
        if (replacement == null) {
            int length = GameClock.periodLength(session, periodEnd.getPeriod());
            replacement = (length / 60) + ":000:00";
        }
        periodEnd.setRawTime(replacement);
        return true;
    }
}
