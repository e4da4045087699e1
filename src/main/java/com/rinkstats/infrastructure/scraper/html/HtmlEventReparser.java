package com.rinkstats.infrastructure.scraper.html;

import com.rinkstats.domain.model.SourceEvent;
import com.rinkstats.domain.model.SourceKind;
import com.rinkstats.domain.ports.EventReparser;

public class HtmlEventReparser implements EventReparser {

    @Override
    public SourceKind source() {
        return SourceKind.HTML_EVENTS;
    }

    @Override
    public void reparse(SourceEvent event) {
        HtmlEventsNormalizer.applyClock(event, event.getGameId().sessionType());
        HtmlDescriptionParser.parse(event);
    }
}
