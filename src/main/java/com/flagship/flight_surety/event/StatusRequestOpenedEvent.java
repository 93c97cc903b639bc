package com.flagship.flight_surety.event;

import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.flight.FlightKey;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a flight status request is opened. Only oracles holding {@code index} may answer.
 */
@Value
public class StatusRequestOpenedEvent implements SuretyEvent {
    UUID eventId;
    int index;
    FlightKey flight;
    AccountId requester;
    Instant occurredAt;

    public static final String EVENT_TYPE = "StatusRequestOpened";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    public String getAggregateType() {
        return ORACLE_REQUEST;
    }

    @Override
    public String getAggregateId() {
        return flight.toString();
    }

    public static StatusRequestOpenedEvent of(int index, FlightKey flight, AccountId requester) {
        return new StatusRequestOpenedEvent(UUID.randomUUID(), index, flight, requester, Instant.now());
    }
}
