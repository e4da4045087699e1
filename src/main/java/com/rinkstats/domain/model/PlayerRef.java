package com.rinkstats.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Reference to a player from an event. Before roster resolution only the source-specific hints
 * (API id, or team and sweater number, possibly a name) are set; resolution fills the key.
 */
public record PlayerRef(
    String playerKey,
    String playerName,
    Long apiId,
    String team,
    Integer jersey,
    Position position
) {

    public static final PlayerRef BENCH = placeholder("BENCH");
    public static final PlayerRef REFEREE = placeholder("REFEREE");
    public static final PlayerRef TEAMMATE = placeholder("TEAMMATE");

    private static PlayerRef placeholder(String key) {
        return new PlayerRef(key, key, null, null, null, null);
    }

    public static PlayerRef ofApiId(long apiId) {
        return new PlayerRef(null, null, apiId, null, null, null);
    }

    public static PlayerRef ofJersey(String team, int jersey, String nameHint) {
        return new PlayerRef(null, nameHint, null, team, jersey, null);
    }

    public static PlayerRef of(RosterEntry entry) {
        return new PlayerRef(entry.playerKey(), entry.playerName(), entry.apiId(), entry.team(),
            entry.jersey(), entry.position());
    }

    @JsonIgnore
    public boolean isPlaceholder() {
        return this.equals(BENCH) || this.equals(REFEREE) || this.equals(TEAMMATE);
    }

    @JsonIgnore
    public boolean isResolved() {
        return playerKey != null;
    }

    public String teamJersey() {
        return team == null || jersey == null ? null : team + jersey;
    }

    public PlayerRef unresolved() {
        return new PlayerRef(null, playerName, apiId, team, jersey, position);
    }
}
