package com.flagship.flight_surety.oracle;

import com.flagship.flight_surety.flight.FlightKey;
import lombok.NonNull;
import lombok.Value;

/**
 * Identifies a status request: the index oracles must hold to answer, and the flight.
 */
@Value(staticConstructor = "of")
public class ResponseKey {
    int index;
    @NonNull
    FlightKey flight;
}
