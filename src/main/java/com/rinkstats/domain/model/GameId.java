package com.rinkstats.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 10-digit game identifier, e.g. 2023020001: season start year, session type and sequence number.
 */
public record GameId(long value) implements Comparable<GameId> {

    public GameId {
        String text = Long.toString(value);
        if (text.length() != 10) {
            throw new IllegalArgumentException(value + " is not a valid game id");
        }
        SessionType.fromIdCode(text.substring(4, 6));
    }

    @JsonCreator
    public static GameId of(String text) {
        if (text == null || !text.trim().matches("\\d{10}")) {
            throw new IllegalArgumentException(text + " is not a valid game id");
        }
        return new GameId(Long.parseLong(text.trim()));
    }

    public static GameId of(long value) {
        return new GameId(value);
    }

    public int seasonStartYear() {
        return (int) (value / 1_000_000);
    }

    /** Season as reported by the sources, e.g. 20232024. */
    public int season() {
        int year = seasonStartYear();
        return year * 10_000 + year + 1;
    }

    public SessionType sessionType() {
        return SessionType.fromIdCode(Long.toString(value).substring(4, 6));
    }

    public int sequence() {
        return (int) (value % 10_000);
    }

    /** The six trailing digits used by the HTML report file names. */
    public String htmlId() {
        return Long.toString(value).substring(4);
    }

    @JsonValue
    @Override
    public String toString() {
        return Long.toString(value);
    }

    @Override
    public int compareTo(GameId other) {
        return Long.compare(value, other.value);
    }
}
