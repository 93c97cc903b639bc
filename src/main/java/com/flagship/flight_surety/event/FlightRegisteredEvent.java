package com.flagship.flight_surety.event;

import com.flagship.flight_surety.flight.FlightKey;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an airline registers a flight.
 */
@Value
public class FlightRegisteredEvent implements SuretyEvent {
    UUID eventId;
    FlightKey flight;
    Instant occurredAt;

    public static final String EVENT_TYPE = "FlightRegistered";

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

    public static FlightRegisteredEvent of(FlightKey flight) {
        return new FlightRegisteredEvent(UUID.randomUUID(), flight, Instant.now());
    }
}
