package com.flagship.flight_surety.insurance;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import lombok.NonNull;
import lombok.Value;

/**
 * One claim per passenger per flight.
 */
@Value(staticConstructor = "of")
public class ClaimKey {
    @NonNull
    AccountId passenger;
    @NonNull
    FlightKey flight;
}
