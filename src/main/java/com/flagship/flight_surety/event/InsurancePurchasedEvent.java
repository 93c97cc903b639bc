package com.flagship.flight_surety.event;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a passenger buys insurance for a flight.
 */
@Value
public class InsurancePurchasedEvent implements SuretyEvent {
    UUID eventId;
    AccountId passenger;
    FlightKey flight;
    long premium;
    Instant occurredAt;

    public static final String EVENT_TYPE = "InsurancePurchased";

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

    public static InsurancePurchasedEvent of(AccountId passenger, FlightKey flight, long premium) {
        return new InsurancePurchasedEvent(UUID.randomUUID(), passenger, flight, premium, Instant.now());
    }
}
