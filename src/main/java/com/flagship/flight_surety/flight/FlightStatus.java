package com.flagship.flight_surety.flight;

import java.util.Arrays;

/**
 * Flight status as reported by oracles and airlines.
 *
 * Codes are the values oracle nodes submit.
 */
public enum FlightStatus {
    UNKNOWN(0),
    ON_TIME(10),
    LATE_AIRLINE(20),
    LATE_WEATHER(30),
    LATE_TECHNICAL(40),
    LATE_OTHER(50);

    private final int code;

    FlightStatus(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    /**
     * Late statuses trigger insurance payouts.
     */
    public boolean isLate() {
        return this == LATE_AIRLINE || this == LATE_WEATHER
            || this == LATE_TECHNICAL || this == LATE_OTHER;
    }

    public static FlightStatus fromCode(int code) {
        return Arrays.stream(values())
            .filter(status -> status.code == code)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown flight status code: " + code));
    }
}
