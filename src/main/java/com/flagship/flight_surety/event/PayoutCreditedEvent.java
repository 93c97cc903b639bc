package com.flagship.flight_surety.event;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a delayed flight's claim is credited to the passenger.
 */
@Value
public class PayoutCreditedEvent implements SuretyEvent {
    UUID eventId;
    AccountId passenger;
    FlightKey flight;
    long premium;
    long payout;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PayoutCredited";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return ACCOUNT;
    }

    @Override
    public String getAggregateId() {
        return passenger.getValue();
    }

    public static PayoutCreditedEvent of(AccountId passenger, FlightKey flight, long premium, long payout) {
        return new PayoutCreditedEvent(UUID.randomUUID(), passenger, flight, premium, payout, Instant.now());
    }
}
