package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.RosterEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lookup view over a reconciled roster: by API id, by team and sweater number, by identity key
 * and by fuzzy name within a team.
 */
public class RosterIndex {

    private final List<RosterEntry> entries;
    private final Map<Long, RosterEntry> byApiId = new HashMap<>();
    private final Map<String, RosterEntry> byTeamJersey = new HashMap<>();
    private final Map<String, RosterEntry> byKey = new HashMap<>();
    private final Map<String, Map<String, RosterEntry>> namesByTeam = new HashMap<>();
    private final PlayerNameMatcher nameMatcher;

    public RosterIndex(List<RosterEntry> entries, PlayerNameMatcher nameMatcher) {
        this.entries = List.copyOf(entries);
        this.nameMatcher = nameMatcher;
        for (RosterEntry entry : entries) {
            if (entry.apiId() != null) {
                byApiId.put(entry.apiId(), entry);
            }
            byTeamJersey.put(entry.teamJersey(), entry);
            if (entry.playerKey() != null) {
                byKey.putIfAbsent(entry.playerKey(), entry);
            }
            namesByTeam.computeIfAbsent(entry.team(), team -> new LinkedHashMap<>()).put(entry.playerName(), entry);
        }
    }

    public List<RosterEntry> entries() {
        return entries;
    }

    public RosterEntry byApiId(Long apiId) {
        return apiId == null ? null : byApiId.get(apiId);
    }

    public RosterEntry byTeamJersey(String team, Integer jersey) {
        if (team == null || jersey == null) {
            return null;
        }
        return byTeamJersey.get(team + jersey);
    }

    public RosterEntry byKey(String playerKey) {
        return playerKey == null ? null : byKey.get(playerKey);
    }

    /**
     * Closest name on one team's roster, or null when no name is close enough.
     */
    public RosterEntry byName(String team, String name) {
        if (name == null) {
            return null;
        }
        List<Map<String, RosterEntry>> pools = new ArrayList<>();
        if (team != null) {
            pools.add(namesByTeam.getOrDefault(team, Collections.emptyMap()));
        } else {
            pools.addAll(namesByTeam.values());
        }
        Map<String, RosterEntry> candidates = new LinkedHashMap<>();
        pools.forEach(candidates::putAll);
        String match = nameMatcher.bestMatch(name, candidates.keySet());
        return match == null ? null : candidates.get(match);
    }

    /**
     * Closest last name on one team's roster, for report descriptions that print "#17 LUCIC".
     */
    public RosterEntry byLastName(String team, String lastName) {
        if (team == null || lastName == null) {
            return null;
        }
        Map<String, RosterEntry> candidates = new LinkedHashMap<>();
        for (RosterEntry entry : namesByTeam.getOrDefault(team, Collections.emptyMap()).values()) {
            String name = entry.playerName();
            int space = name == null ? -1 : name.indexOf(' ');
            if (space > 0) {
                candidates.putIfAbsent(name.substring(space + 1), entry);
            }
        }
        String match = nameMatcher.bestMatch(lastName, candidates.keySet());
        return match == null ? null : candidates.get(match);
    }

    /**
     * Resolves an event reference to a roster entry. Placeholders and unknown references
     * resolve to null.
     */
    public RosterEntry resolve(PlayerRef ref) {
        if (ref == null || ref.isPlaceholder()) {
            return null;
        }
        RosterEntry entry = byApiId(ref.apiId());
        if (entry == null) {
            entry = byTeamJersey(ref.team(), ref.jersey());
        }
        if (entry == null) {
            entry = byKey(ref.playerKey());
        }
        if (entry == null && ref.playerName() != null) {
            entry = byName(ref.team(), ref.playerName());
        }
        return entry;
    }
}
