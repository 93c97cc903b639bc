package com.flagship.flight_surety.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.flight_surety.common.AccountId;
import com.flagship.flight_surety.config.JacksonConfig;
import com.flagship.flight_surety.event.AirlineFundedEvent;
import com.flagship.flight_surety.event.FlightRegisteredEvent;
import com.flagship.flight_surety.event.SuretyEvent;
import com.flagship.flight_surety.flight.FlightKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the notification outbox.
 *
 * These tests verify that:
 * - Events are stored with JSON payloads in sequence order
 * - Published events leave the backlog
 * - Failed publishes increment the retry count
 */
class OutboxServiceTest {

    private static final AccountId AIRLINE = AccountId.of("0xairline");

    private ObjectMapper objectMapper;
    private OutboxService outboxService;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        outboxService = new OutboxService(objectMapper);
    }

    @Test
    @DisplayName("Saved event carries its aggregate and a JSON payload")
    void saveEvent() throws Exception {
        FlightKey flight = FlightKey.of(AIRLINE, "ND1309", 1_700_000_000L);

        OutboxEvent saved = outboxService.saveEvent(FlightRegisteredEvent.of(flight));

        assertEquals(SuretyEvent.FLIGHT, saved.getAggregateType());
        assertEquals(flight.toString(), saved.getAggregateId());
        assertEquals(FlightRegisteredEvent.EVENT_TYPE, saved.getEventType());
        assertFalse(saved.isPublished());

        JsonNode payload = objectMapper.readTree(saved.getPayload());
        assertEquals("ND1309", payload.get("flight").get("code").asText());
        assertEquals("0xairline", payload.get("flight").get("airline").asText());
        assertTrue(payload.get("occurredAt").isTextual());
    }

    @Test
    @DisplayName("Unpublished events are returned in sequence order up to the limit")
    void findUnpublishedInOrder() {
        OutboxEvent first = outboxService.saveEvent(AirlineFundedEvent.of(AIRLINE, 10L));
        OutboxEvent second = outboxService.saveEvent(AirlineFundedEvent.of(AccountId.of("0xother"), 10L));
        outboxService.saveEvent(AirlineFundedEvent.of(AccountId.of("0xthird"), 10L));

        List<OutboxEvent> batch = outboxService.findUnpublishedEvents(2);

        assertEquals(List.of(first.getId(), second.getId()), batch.stream().map(OutboxEvent::getId).toList());
        assertTrue(first.getSequenceNumber() < second.getSequenceNumber());
    }

    @Test
    @DisplayName("Published events leave the backlog")
    void markPublished() {
        OutboxEvent event = outboxService.saveEvent(AirlineFundedEvent.of(AIRLINE, 10L));
        assertEquals(1, outboxService.countUnpublished());
        assertTrue(outboxService.findOldestUnpublishedCreatedAt().isPresent());

        outboxService.markPublished(event.getId());

        assertEquals(0, outboxService.countUnpublished());
        assertTrue(outboxService.findOldestUnpublishedCreatedAt().isEmpty());
        assertTrue(outboxService.getEventsForAggregate(SuretyEvent.AIRLINE, AIRLINE.getValue()).get(0).isPublished());
    }

    @Test
    @DisplayName("Failed publishes are counted towards the retry limit")
    void markFailed() {
        OutboxEvent event = outboxService.saveEvent(AirlineFundedEvent.of(AIRLINE, 10L));

        outboxService.markFailed(event.getId(), "broker down");
        outboxService.markFailed(event.getId(), "broker down");

        OutboxEvent stored = outboxService.getEventsForAggregate(SuretyEvent.AIRLINE, AIRLINE.getValue()).get(0);
        assertEquals(2, stored.getRetryCount());
        assertEquals("broker down", stored.getLastError());
        assertEquals(1, outboxService.countExceedingRetries(2));
        assertEquals(0, outboxService.countExceedingRetries(3));
    }

    @Test
    @DisplayName("Published event leaves the polling set and only the audit window keeps it")
    void publishedEventsAreReleased() {
        OutboxService bounded = new OutboxService(objectMapper, 1);
        OutboxEvent first = bounded.saveEvent(AirlineFundedEvent.of(AIRLINE, 10L));
        OutboxEvent second = bounded.saveEvent(AirlineFundedEvent.of(AccountId.of("0xother"), 10L));

        bounded.markPublished(first.getId());

        assertEquals(List.of(second.getId()),
            bounded.findUnpublishedEvents(10).stream().map(OutboxEvent::getId).toList());
        assertEquals(2, bounded.getEventsOfType(AirlineFundedEvent.EVENT_TYPE).size());

        bounded.markPublished(second.getId());

        assertEquals(0, bounded.countUnpublished());
        List<OutboxEvent> retained = bounded.getEventsOfType(AirlineFundedEvent.EVENT_TYPE);
        assertEquals(List.of(second.getId()), retained.stream().map(OutboxEvent::getId).toList());
        assertTrue(bounded.getEventsForAggregate(SuretyEvent.AIRLINE, AIRLINE.getValue()).isEmpty());
    }

    @Test
    @DisplayName("Publishable events exclude those at the retry limit")
    void publishableEventsSkipDeadLetters() {
        OutboxEvent dead = outboxService.saveEvent(AirlineFundedEvent.of(AIRLINE, 10L));
        OutboxEvent live = outboxService.saveEvent(AirlineFundedEvent.of(AccountId.of("0xother"), 10L));
        outboxService.markFailed(dead.getId(), "broker down");

        List<OutboxEvent> batch = outboxService.findPublishableEvents(10, 1);

        assertEquals(List.of(live.getId()), batch.stream().map(OutboxEvent::getId).toList());
        assertEquals(2, outboxService.countUnpublished());
        assertEquals(dead.getCreatedAt(), outboxService.findOldestUnpublishedCreatedAt().orElseThrow());
    }
}
