package com.flagship.flight_surety.event;

import com.flagship.flight_surety.common.AccountId;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a registered airline has paid its membership fund.
 */
@Value
public class AirlineFundedEvent implements SuretyEvent {
    UUID eventId;
    AccountId airline;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "AirlineFunded";

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

    public static AirlineFundedEvent of(AccountId airline, long amount) {
        return new AirlineFundedEvent(UUID.randomUUID(), airline, amount, Instant.now());
    }
}
