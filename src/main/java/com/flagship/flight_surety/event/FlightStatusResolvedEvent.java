package com.flagship.flight_surety.event;

import com.flagship.flight_surety.flight.FlightKey;
import com.flagship.flight_surety.flight.FlightStatus;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when oracle reports reach quorum for a flight status.
 */
@Value
public class FlightStatusResolvedEvent implements SuretyEvent {
    UUID eventId;
    int index;
    FlightKey flight;
    FlightStatus status;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FlightStatusResolved";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return FLIGHT;
    }

    @Override
    public String getAggregateId() {
        return flight.toString();
    }

    public static FlightStatusResolvedEvent of(int index, FlightKey flight, FlightStatus status) {
        return new FlightStatusResolvedEvent(UUID.randomUUID(), index, flight, status, Instant.now());
    }
}
