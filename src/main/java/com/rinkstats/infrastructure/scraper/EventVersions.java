package com.rinkstats.infrastructure.scraper;

import com.rinkstats.domain.model.PlayerRef;
import com.rinkstats.domain.model.SourceEvent;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Numbers events of one stream that share type, period, clock and first player: 1, 2, 3...
 * in stream order. Events without a first player are always version 1.
 */
public final class EventVersions {

    private EventVersions() {
    }

    public static void assign(List<SourceEvent> stream) {
        Map<String, Integer> seen = new HashMap<>();
        for (SourceEvent event : stream) {
            String identity = identity(event.player(0));
            if (identity == null) {
                event.setVersion(1);
                continue;
            }
            String key = event.getEventType() + "|" + event.getPeriod() + "|" + event.getGameSeconds() + "|" + identity;
            int version = seen.merge(key, 1, Integer::sum);
            event.setVersion(version);
        }
    }

    private static String identity(PlayerRef player) {
        if (player == null) {
            return null;
        }
        if (player.apiId() != null) {
            return "api:" + player.apiId();
        }
        if (player.isPlaceholder()) {
            return player.playerKey();
        }
        return Objects.toString(player.teamJersey(), null);
    }
}
