package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.domain.model.EventPlayer;
import com.rinkstats.domain.model.EventType;
import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.SourceEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts structured fields from an HTML event description. Re-runnable: every derived field is
 * reset first, so a corrected description can simply be parsed again.
 */
public final class HtmlDescriptionParser {

    private static final Pattern EVENT_TEAM = Pattern.compile("^([A-Z]{3}|[A-Z]\\.[A-Z])");
    private static final Pattern NUMBERS = Pattern.compile("#([0-9]{1,2})");
    private static final Pattern EVENT_PLAYERS = Pattern.compile("([A-Z]{3})\\s+#([0-9]{1,2})");
    private static final Pattern FACEOFF_TEAM = Pattern.compile("([A-Z]{3}) WON");
    private static final Pattern BLOCK_TEAM = Pattern.compile("BLOCKED BY\\s+([A-Z]{3})");
    private static final Pattern ZONE = Pattern.compile("([A-Za-z]{3})\\. ZONE");
    private static final Pattern PENALTY = Pattern.compile("([A-Za-z]*|[A-Za-z]*-[A-Za-z]*|[A-Za-z]*\\s+\\(.*\\))\\s*\\(");
    private static final Pattern PENALTY_MINUTES = Pattern.compile("(\\d+) MIN");
    private static final Pattern SHOT_TYPE = Pattern.compile(",\\s+([A-Za-z]*|[A-Za-z]*-[A-Za-z]*)\\s+,");
    private static final Pattern DISTANCE = Pattern.compile("(\\d+) FT");
    private static final Pattern SERVED_BY = Pattern.compile("SERVED BY: #([0-9]+)");
    private static final Pattern DRAWN_BY = Pattern.compile("DRAWN BY: ([A-Z]{3}) #([0-9]+)");

    private static final String[][] PENALTY_NAMES = {
        {"GOALKEEPER INTERFERENCE", "INTERFERENCE", "GOALKEEPER"},
        {"CROSS-CHECKING", "CROSS", "CHECKING"},
        {"DELAY OF GAME - PUCK OVER GLASS", "DELAY", "GAME", "PUCK OVER"},
        {"DELAY OF GAME - FACEOFF VIOLATION", "DELAY", "GAME", "FO VIOL"},
        {"DELAY OF GAME - EQUIPMENT", "DELAY", "GAME", "EQUIPMENT"},
        {"DELAY OF GAME - UNSUCCESSFUL CHALLENGE", "DELAY", "GAME", "UNSUCC"},
        {"DELAY OF GAME - SMOTHERING THE PUCK", "DELAY", "GAME", "SMOTHERING"},
        {"ILLEGAL CHECK TO HEAD", "ILLEGAL", "CHECK", "HEAD"},
        {"HIGH-STICKING - DOUBLE MINOR", "HIGH-STICKING", "- DOUBLE"},
        {"GAME MISCONDUCT", "GAME MISCONDUCT"},
        {"MATCH PENALTY", "MATCH PENALTY"},
        {"DISPLACED NET", "NET", "DISPLACED"},
        {"THROWING OBJECT AT PUCK", "THROW", "OBJECT", "AT PUCK"},
        {"INSTIGATOR - FACE SHIELD", "INSTIGATOR", "FACE SHIELD"},
        {"LEAVING THE CREASE", "GOALIE LEAVE CREASE"},
        {"REMOVING OPPONENT HELMET", "REMOVING", "HELMET"},
        {"HOLDING BROKEN STICK", "BROKEN", "STICK"},
        {"HOOKING - BREAKAWAY", "HOOKING", "BREAKAWAY"},
        {"HOLDING - BREAKAWAY", "HOLDING", "BREAKAWAY"},
        {"TRIPPING - BREAKAWAY", "TRIPPING", "BREAKAWAY"},
        {"SLASHING - BREAKAWAY", "SLASH", "BREAKAWAY"},
        {"TOO MANY MEN ON THE ICE", "TEAM TOO MANY"},
        {"HOLDING THE STICK", "HOLDING", "STICK"},
        {"THROWING STICK", "THROWING", "STICK"},
        {"CLOSING HAND ON PUCK", "CLOSING", "HAND"},
        {"ABUSE OF OFFICIALS", "ABUSE", "OFFICIALS"},
        {"UNSPORTSMANLIKE CONDUCT", "UNSPORTSMANLIKE CONDUCT"},
        {"PUCK THROWN FORWARD - GOALKEEPER", "PUCK", "THROWN", "FWD"},
        {"DELAY OF GAME", "DELAY", "GAME"},
    };

    private HtmlDescriptionParser() {
    }

    public static void parse(SourceEvent event) {
        event.setEventTeam(null);
        event.setPlayers(null);
        event.setZone(null);
        event.setShotType(null);
        event.setShotDistance(null);
        event.setPenalty(null);
        event.setPenaltyMinutes(null);

        EventType type = event.getEventType();
        String description = event.getDescription() == null ? "" : event.getDescription();
        event.setPenaltyShot(description.contains("PENALTY SHOT"));
        if (type == null) {
            return;
        }

        parseZone(event, description);
        parseShotDetails(event, description);

        if (!type.isTeamEvent()) {
            return;
        }

        Matcher teamMatcher = EVENT_TEAM.matcher(description);
        if (!teamMatcher.find()) {
            return;
        }
        String team = teamMatcher.group(1);
        if (team.equals("LEA")) {
            team = null;
        }
        if (type == EventType.FAC) {
            Matcher faceoff = FACEOFF_TEAM.matcher(description);
            team = faceoff.find() ? faceoff.group(1) : team;
        }
        if (type == EventType.BLOCK && description.contains("BLOCKED BY")) {
            Matcher block = BLOCK_TEAM.matcher(description);
            team = block.find() ? block.group(1) : team;
        }
        event.setEventTeam(team);

        if (type == EventType.PENL) {
            parsePenalty(event, description, team);
            return;
        }

        List<PlayerRef> refs = new ArrayList<>();
        if (type == EventType.GOAL || type == EventType.SHOT || type == EventType.TAKE || type == EventType.GIVE) {
            Matcher numbers = NUMBERS.matcher(description);
            while (numbers.find() && team != null) {
                refs.add(PlayerRef.ofJersey(team, Integer.parseInt(numbers.group(1)), null));
            }
        } else {
            Matcher players = EVENT_PLAYERS.matcher(description);
            while (players.find()) {
                refs.add(PlayerRef.ofJersey(players.group(1), Integer.parseInt(players.group(2)), null));
            }
        }

        if (type == EventType.FAC && refs.size() > 1 && !refs.get(0).team().equals(team)) {
            swap(refs);
        }
        if (type == EventType.BLOCK) {
            if (description.contains("TEAMMATE")) {
                event.setEventTeam(description.length() >= 3 ? description.substring(0, 3) : team);
                refs.add(0, PlayerRef.TEAMMATE);
            } else if (description.contains("BLOCKED BY OTHER")) {
                event.setEventTeam("OTHER");
                refs.add(0, PlayerRef.REFEREE);
            } else if (refs.size() > 1 && !refs.get(0).team().equals(team)) {
                swap(refs);
            }
        }

        String[] roles = rolesFor(type);
        for (int slot = 0; slot < refs.size() && slot < 3; slot++) {
            event.setPlayer(slot, refs.get(slot), slot < roles.length ? roles[slot] : null);
        }
    }

    private static void parseZone(SourceEvent event, String description) {
        Matcher zone = ZONE.matcher(description);
        if (zone.find()) {
            String code = zone.group(1).toUpperCase();
            if (event.getEventType() == EventType.BLOCK && code.equals("DEF")) {
                code = "OFF";
            }
            event.setZone(code);
        }
    }

    private static void parseShotDetails(SourceEvent event, String description) {
        EventType type = event.getEventType();
        if (type.isShotAttempt()) {
            Matcher shot = SHOT_TYPE.matcher(description);
            event.setShotType(shot.find() && !shot.group(1).isEmpty() ? shot.group(1).toUpperCase() : "WRIST");
            if (description.contains("BETWEEN LEGS")) {
                event.setShotType("BETWEEN LEGS");
            }
        }
        Matcher distance = DISTANCE.matcher(description);
        if (distance.find()) {
            event.setShotDistance(Integer.parseInt(distance.group(1)));
        } else if (type.isUnblockedShotAttempt()) {
            event.setShotDistance(0);
        }
    }

    private static void parsePenalty(SourceEvent event, String description, String team) {
        boolean bench = (description.contains("TEAM") && description.contains("SERVED BY"))
            || description.contains("HEAD COACH");

        PlayerRef committed = PlayerRef.BENCH;
        if (!bench) {
            Matcher players = EVENT_PLAYERS.matcher(description);
            if (players.find() && players.group(1).equals(team)) {
                committed = PlayerRef.ofJersey(team, Integer.parseInt(players.group(2)), null);
            }
        }

        PlayerRef served = null;
        Matcher servedBy = SERVED_BY.matcher(description);
        if (servedBy.find() && team != null) {
            served = PlayerRef.ofJersey(team, Integer.parseInt(servedBy.group(1)), null);
        }
        PlayerRef drawn = null;
        Matcher drawnBy = DRAWN_BY.matcher(description);
        if (drawnBy.find()) {
            drawn = PlayerRef.ofJersey(drawnBy.group(1), Integer.parseInt(drawnBy.group(2)), null);
        }

        event.setPlayer(0, committed, EventPlayer.COMMITTED_BY);
        if (bench) {
            if (served != null) {
                event.addPlayer(served, EventPlayer.SERVED_BY);
            }
            if (drawn != null) {
                event.addPlayer(drawn, EventPlayer.DRAWN_BY);
            }
        } else {
            if (drawn != null) {
                event.addPlayer(drawn, EventPlayer.DRAWN_BY);
            }
            if (served != null) {
                event.addPlayer(served, EventPlayer.SERVED_BY);
            }
        }

        Matcher minutes = PENALTY_MINUTES.matcher(description);
        if (minutes.find()) {
            event.setPenaltyMinutes(Integer.parseInt(minutes.group(1)));
        }
        event.setPenalty(penaltyName(description));
    }

    static String penaltyName(String description) {
        for (String[] entry : PENALTY_NAMES) {
            boolean all = true;
            for (int i = 1; i < entry.length && all; i++) {
                all = description.contains(entry[i]);
            }
            if (all) {
                return entry[0];
            }
        }
        Matcher penalty = PENALTY.matcher(description);
        while (penalty.find()) {
            String name = penalty.group(1).trim();
            if (!name.isEmpty()) {
                return name.equals("MISCONDUCT") ? "GAME MISCONDUCT" : name;
            }
        }
        return null;
    }

    private static String[] rolesFor(EventType type) {
        return switch (type) {
            case FAC -> new String[] {EventPlayer.WINNER, EventPlayer.LOSER};
            case HIT -> new String[] {EventPlayer.HITTER, EventPlayer.HITTEE};
            case GIVE -> new String[] {EventPlayer.GIVER};
            case TAKE -> new String[] {EventPlayer.TAKER};
            case SHOT, MISS -> new String[] {EventPlayer.SHOOTER};
            case BLOCK -> new String[] {EventPlayer.BLOCKER, EventPlayer.SHOOTER};
            case GOAL -> new String[] {EventPlayer.GOAL_SCORER, EventPlayer.PRIMARY_ASSIST, EventPlayer.SECONDARY_ASSIST};
            default -> new String[0];
        };
    }

    private static void swap(List<PlayerRef> refs) {
        PlayerRef first = refs.get(0);
        refs.set(0, refs.get(1));
        refs.set(1, first);
    }
}
