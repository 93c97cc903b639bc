package com.flagship.flight_surety.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Base interface for registry notifications.
 *
 * All events share these common properties:
 * - Event ID for deduplication
 * - Aggregate type and ID (the airline, flight or account the event is about)
 * - Timestamp of when the event occurred
 */
public interface SuretyEvent {

    String AIRLINE = "Airline";
    String FLIGHT = "Flight";
    String ORACLE_REQUEST = "OracleRequest";
    String ACCOUNT = "Account";

    UUID getEventId();

    String getAggregateType();

    /**
     * Kafka partition key; events of one aggregate keep their order.
     */
    String getAggregateId();

    Instant getOccurredAt();

    String getEventType();
}
