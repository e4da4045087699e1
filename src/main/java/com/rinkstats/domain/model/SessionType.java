package com.rinkstats.domain.model;

/**
 * Game session encoded in digits 5-6 of a game id.
 */
public enum SessionType {
    PRESEASON("01", "PR"),
    REGULAR("02", "R"),
    PLAYOFF("03", "P"),
    ALL_STAR("04", "AS");

    private final String idCode;
    private final String shortCode;

    SessionType(String idCode, String shortCode) {
        this.idCode = idCode;
        this.shortCode = shortCode;
    }

    public String getIdCode() {
        return idCode;
    }

    public String getShortCode() {
        return shortCode;
    }

    public static SessionType fromIdCode(String code) {
        for (SessionType type : values()) {
            if (type.idCode.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown session code: " + code);
    }

    @Override
    public String toString() {
        return shortCode;
    }
}
