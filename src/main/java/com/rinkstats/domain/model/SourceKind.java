package com.rinkstats.domain.model;

/**
 * Logical sources fetched for a single game. The HTML shift report is published as a home/away pair.
 */
public enum SourceKind {
    API_EVENTS(false),
    API_ROSTERS(false),
    API_GAME_INFO(false),
    HTML_EVENTS(true),
    HTML_ROSTERS(true),
    HTML_HOME_SHIFTS(true),
    HTML_AWAY_SHIFTS(true);

    private final boolean html;

    SourceKind(boolean html) {
        this.html = html;
    }

    public boolean isHtml() {
        return html;
    }

    public boolean isShiftReport() {
        return this == HTML_HOME_SHIFTS || this == HTML_AWAY_SHIFTS;
    }
}
