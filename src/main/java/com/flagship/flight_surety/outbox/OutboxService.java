package com.flagship.flight_surety.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.flight_surety.event.SuretyEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Outbox of registry notifications.
 *
 * Core components call {@link #saveEvent} after their state change succeeded and
 * before their call returns. Events are NOT published to Kafka here; that is done
 * by the {@link OutboxPublisher}, which polls this outbox in sequence order.
 *
 * Unpublished events (dead letters included) stay in the pending set until published.
 * Published events leave it and are kept only in a bounded audit window of the most
 * recent {@code publishedRetention} events.
 */
@Service
@Slf4j
public class OutboxService {

    static final int DEFAULT_PUBLISHED_RETENTION = 1000;

    private final ObjectMapper objectMapper;
    private final int publishedRetention;

    private final Map<UUID, OutboxEvent> pending = new LinkedHashMap<>();
    private final Deque<OutboxEvent> published = new ArrayDeque<>();
    private long nextSequenceNumber = 1;

    @Autowired
    public OutboxService(ObjectMapper objectMapper,
                         @Value("${outbox.published-retention:1000}") int publishedRetention) {
        if (publishedRetention < 0) {
            throw new IllegalArgumentException("Published retention must not be negative");
        }
        this.objectMapper = objectMapper;
        this.publishedRetention = publishedRetention;
    }

    public OutboxService(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_PUBLISHED_RETENTION);
    }

    /**
     * Saves an event to the outbox.
     *
     * @param event Event payload (serialized to JSON)
     * @return The saved outbox event
     */
    public synchronized OutboxEvent saveEvent(SuretyEvent event) {
        String jsonPayload = serializePayload(event);

        OutboxEvent saved = OutboxEvent.create(event.getEventId(), event.getAggregateType(),
            event.getAggregateId(), event.getEventType(), jsonPayload, nextSequenceNumber++);
        pending.put(saved.getId(), saved);

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                event.getEventType(), event.getAggregateType(), event.getAggregateId());
        return saved;
    }

    /**
     * Finds unpublished events still below the retry limit, in sequence order.
     * Dead letters are skipped so they never block newer events.
     *
     * @param limit Maximum number of events to fetch
     * @param maxRetries Retry count at which an event counts as dead-lettered
     */
    public synchronized List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return pending.values().stream()
                .filter(event -> event.getRetryCount() < maxRetries)
                .limit(limit)
                .toList();
    }

    /**
     * Finds unpublished events in sequence order, dead letters included.
     */
    public synchronized List<OutboxEvent> findUnpublishedEvents(int limit) {
        return pending.values().stream().limit(limit).toList();
    }

    public synchronized void markPublished(UUID eventId) {
        OutboxEvent event = pending.remove(eventId);
        if (event == null) {
            return;
        }
        published.addLast(event.markPublished());
        while (published.size() > publishedRetention) {
            published.removeFirst();
        }
        log.debug("Marked event {} as published", eventId);
    }

    /**
     * Records a failed publish attempt.
     *
     * @return the event with its incremented retry count, empty if it is no longer pending
     */
    public synchronized Optional<OutboxEvent> markFailed(UUID eventId, String errorMessage) {
        OutboxEvent retried = pending.computeIfPresent(eventId, (id, event) -> event.markRetry(errorMessage));
        if (retried != null) {
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, retried.getRetryCount(), errorMessage);
        }
        return Optional.ofNullable(retried);
    }

    /**
     * Gets events for a specific aggregate (for debugging/auditing). Published events
     * are only found while they are inside the audit window.
     */
    public synchronized List<OutboxEvent> getEventsForAggregate(String aggregateType, String aggregateId) {
        return retainedEvents()
                .filter(event -> event.getAggregateType().equals(aggregateType)
                        && event.getAggregateId().equals(aggregateId))
                .toList();
    }

    public synchronized List<OutboxEvent> getEventsOfType(String eventType) {
        return retainedEvents()
                .filter(event -> event.getEventType().equals(eventType))
                .toList();
    }

    public synchronized long countUnpublished() {
        return pending.size();
    }

    public synchronized long countExceedingRetries(int maxRetries) {
        return pending.values().stream()
                .filter(event -> event.getRetryCount() >= maxRetries)
                .count();
    }

    public synchronized Optional<Instant> findOldestUnpublishedCreatedAt() {
        if (pending.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(pending.values().iterator().next().getCreatedAt());
    }

    private Stream<OutboxEvent> retainedEvents() {
        return Stream.concat(published.stream(), pending.values().stream())
                .sorted((a, b) -> Long.compare(a.getSequenceNumber(), b.getSequenceNumber()));
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
