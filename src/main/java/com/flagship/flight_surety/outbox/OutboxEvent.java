package com.flagship.flight_surety.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain model for an outbox event.
 *
 * An outbox event is a notification waiting to be published to Kafka. It is written
 * in the same serialized call as the state change it reports, then published
 * asynchronously by {@link OutboxPublisher}.
 *
 * Key properties:
 * - Immutable value object
 * - Contains all information needed for publishing
 * - Tracks publishing status and retry information
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // e.g., "Flight"
    String aggregateId;        // e.g., flight key
    String eventType;          // e.g., "FlightStatusResolved"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null if not yet published
    int retryCount;
    String lastError;
    long sequenceNumber;

    public static OutboxEvent create(UUID id, String aggregateType, String aggregateId,
                                     String eventType, String payload, long sequenceNumber) {
        return new OutboxEvent(
            id,
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            sequenceNumber
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public OutboxEvent markPublished() {
        return new OutboxEvent(
            this.id,
            this.aggregateType,
            this.aggregateId,
            this.eventType,
            this.payload,
            this.createdAt,
            Instant.now(),
            this.retryCount,
            null,  // clear error on success
            this.sequenceNumber
        );
    }

    /**
     * Creates a new event with incremented retry count and error message.
     */
    public OutboxEvent markRetry(String errorMessage) {
        return new OutboxEvent(
            this.id,
            this.aggregateType,
            this.aggregateId,
            this.eventType,
            this.payload,
            this.createdAt,
            this.publishedAt,
            this.retryCount + 1,
            errorMessage,
            this.sequenceNumber
        );
    }
}
