package com.flagship.flight_surety.flight;

import com.flagship.flight_surety.common.SuretyError;
import com.flagship.flight_surety.common.SuretyException;
import lombok.Value;

import java.time.Instant;

/**
 * Flight domain object.
 *
 * Key principles:
 * - The key is immutable; only the status changes
 * - State changes are immutable (create new Flight with new status)
 * - Once oracle consensus has resolved the status, airlines can no longer change it
 */
@Value
public class Flight {
    FlightKey key;
    FlightStatus status;
    boolean oracleResolved;
    Instant registeredAt;
    Instant updatedAt;

    /**
     * Creates a new Flight in UNKNOWN status.
     */
    public static Flight register(FlightKey key) {
        Instant now = Instant.now();
        return new Flight(key, FlightStatus.UNKNOWN, false, now, now);
    }

    /**
     * Direct status update by the owning airline.
     *
     * @throws SuretyException STATUS_FROZEN if oracle consensus already resolved the flight
     */
    public Flight updateByAirline(FlightStatus newStatus) {
        if (oracleResolved) {
            throw new SuretyException(SuretyError.STATUS_FROZEN,
                String.format("Flight %s was resolved as %s by oracle consensus", key, status));
        }
        return new Flight(key, newStatus, false, registeredAt, Instant.now());
    }

    /**
     * Status resolved by oracle consensus. Always wins over earlier values.
     */
    public Flight resolve(FlightStatus resolvedStatus) {
        return new Flight(key, resolvedStatus, true, registeredAt, Instant.now());
    }

    /**
     * Insurance can only be bought before anyone has set the flight's status.
     */
    public boolean isInsurable() {
        return status == FlightStatus.UNKNOWN && !oracleResolved;
    }
}
