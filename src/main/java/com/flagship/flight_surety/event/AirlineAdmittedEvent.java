package com.flagship.flight_surety.event;

import com.flagship.flight_surety.common.AccountId;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when an airline becomes Registered. Emitted exactly once per airline.
 */
@Value
public class AirlineAdmittedEvent implements SuretyEvent {
    UUID eventId;
    AccountId airline;
    int votes;
    int registeredCount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AirlineAdmitted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return AIRLINE;
    }

    @Override
    public String getAggregateId() {
        return airline.getValue();
    }

    public static AirlineAdmittedEvent of(AccountId airline, int votes, int registeredCount) {
        return new AirlineAdmittedEvent(UUID.randomUUID(), airline, votes, registeredCount, Instant.now());
    }
}
