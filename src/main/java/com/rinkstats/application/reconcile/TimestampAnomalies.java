package com.rinkstats.application.reconcile;

import com.rinkstats.domain.model.DiagnosticFlag;
import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.SessionType;
import com.rinkstats.domain.model.SourceEvent;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Finds events of one source stream whose clock cannot be consistent: missing, outside the
 * period, or out of order within the period. Out-of-order events are the ones left outside the
 * longest non-decreasing run of clock readings. Events without a readable clock are placed at
 * the preceding event's time so they keep their position.
 */
final class TimestampAnomalies {

    private TimestampAnomalies() {
    }

    /**
     * @param stream events in source order
     * @return number of events flagged
     */
    static int flag(List<SourceEvent> stream, SessionType session) {
        Set<SourceEvent> anomalies = new HashSet<>();
        Integer previousPeriod = null;
        Integer previousSeconds = null;
        for (SourceEvent event : stream) {
            boolean unreadable = false;
            if (event.getPeriod() == null) {
                event.setPeriod(previousPeriod == null ? 1 : previousPeriod);
                unreadable = true;
            }
            Integer seconds = event.getPeriodSeconds();
            int length = GameClock.periodLength(session, event.getPeriod());
            if (unreadable || seconds == null || seconds < 0 || seconds > length) {
                int placed = previousSeconds != null && event.getPeriod().equals(previousPeriod) ? previousSeconds : 0;
                event.setPeriodSeconds(placed);
                event.setGameSeconds(GameClock.gameSeconds(session, event.getPeriod(), placed));
                anomalies.add(event);
            } else if (event.getGameSeconds() == null) {
                event.setGameSeconds(GameClock.gameSeconds(session, event.getPeriod(), seconds));
            }
            previousPeriod = event.getPeriod();
            previousSeconds = event.getPeriodSeconds();
        }

        Map<Integer, List<SourceEvent>> byPeriod = new LinkedHashMap<>();
        for (SourceEvent event : stream) {
            if (!anomalies.contains(event)) {
                byPeriod.computeIfAbsent(event.getPeriod(), period -> new ArrayList<>()).add(event);
            }
        }
        for (List<SourceEvent> period : byPeriod.values()) {
            anomalies.addAll(outOfOrder(period));
        }

        int flagged = 0;
        for (SourceEvent event : anomalies) {
            if (!event.hasFlag(DiagnosticFlag.CORRECTED)) {
                event.addFlag(DiagnosticFlag.UNCORRECTED_ANOMALY);
                flagged++;
            }
        }
        return flagged;
    }

    /**
     * Events outside one longest non-decreasing subsequence of period seconds.
     */
    static List<SourceEvent> outOfOrder(List<SourceEvent> events) {
        int n = events.size();
        int[] tails = new int[n];
        int[] parent = new int[n];
        int length = 0;
        for (int i = 0; i < n; i++) {
            int seconds = events.get(i).getPeriodSeconds();
            int low = 0;
            int high = length;
            while (low < high) {
                int mid = (low + high) >>> 1;
                if (events.get(tails[mid]).getPeriodSeconds() <= seconds) {
                    low = mid + 1;
                } else {
                    high = mid;
                }
            }
            parent[i] = low > 0 ? tails[low - 1] : -1;
            tails[low] = i;
            if (low == length) {
                length++;
            }
        }
        boolean[] kept = new boolean[n];
        for (int i = length == 0 ? -1 : tails[length - 1]; i >= 0; i = parent[i]) {
            kept[i] = true;
        }
        List<SourceEvent> outliers = new ArrayList<>();
        for (int i = 0; i < n; i++) {
            if (!kept[i]) {
                outliers.add(events.get(i));
            }
        }
        return outliers;
    }
}
