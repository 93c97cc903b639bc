package com.flagship.flight_surety.insurance;

import com.flagship.flight_surety.flight.FlightKey;
import lombok.Value;

import java.util.List;

/**
 * Result of resolving a delayed flight's claims.
 *
 * Claims already paid before this resolution appear in neither list.
 */
@Value
public class PayoutReport {
    FlightKey flight;
    List<ClaimKey> paid;
    List<ClaimKey> underfunded;
    long totalCredited;

    public static PayoutReport empty(FlightKey flight) {
        return new PayoutReport(flight, List.of(), List.of(), 0L);
    }

    public boolean isComplete() {
        return underfunded.isEmpty();
    }
}
