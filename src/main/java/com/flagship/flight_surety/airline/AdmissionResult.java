package com.flagship.flight_surety.airline;

import lombok.Value;

/**
 * Outcome of a registerAirline call: whether the target is now registered and the
 * number of distinct votes it had when the call completed (0 in the bootstrap phase).
 */
@Value
public class AdmissionResult {
    boolean admitted;
    int votes;
}
