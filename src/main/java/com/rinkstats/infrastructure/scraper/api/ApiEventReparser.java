package com.rinkstats.infrastructure.scraper.api;

import com.rinkstats.domain.model.GameClock;
import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.ports.EventReparser;

/**
 * API events carry structured fields, so only the clock is derived from raw text.
 */
public class ApiEventReparser implements EventReparser {

    @Override
    public SourceKind source() {
        return SourceKind.API_EVENTS;
    }

    @Override
    public void reparse(SourceEvent event) {
        Integer periodSeconds = GameClock.parseClock(event.getRawTime());
        event.setPeriodSeconds(periodSeconds);
        if (periodSeconds == null || event.getPeriod() == null) {
            event.setGameSeconds(null);
            return;
        }
        event.setGameSeconds(GameClock.gameSeconds(event.getGameId().sessionType(), event.getPeriod(), periodSeconds));
    }
}
