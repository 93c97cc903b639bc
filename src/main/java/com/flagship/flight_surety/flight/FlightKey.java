package com.flagship.flight_surety.flight;

import com.flagship.flight_surety.common.AccountId;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifies a flight: the operating airline, the flight code and the scheduled
 * departure timestamp (epoch seconds). The code is stored trimmed, so every entry
 * point that names the same flight yields the same key.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class FlightKey {
    AccountId airline;
    String code;
    long timestamp;

    public static FlightKey of(@NonNull AccountId airline, @NonNull String code, long timestamp) {
        return new FlightKey(airline, code.trim(), timestamp);
    }

    @Override
    public String toString() {
        return airline + "/" + code + "/" + timestamp;
    }
}
