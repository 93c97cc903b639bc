package com.flagship.flight_surety.observability;

import com.flagship.flight_surety.outbox.OutboxService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the notification outbox.
 *
 * - Backlog size: how many events are waiting to be published
 * - Oldest event age: how long the oldest event has been waiting
 * - Dead letters: events that exceeded the publisher's retry limit
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxMetrics {

    private final OutboxService outboxService;
    private final MeterRegistry meterRegistry;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    // Cached values updated by refreshMetrics
    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetterCount = new AtomicLong(0);

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished events in the outbox")
                .tag("status", "pending")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.failed", deadLetterCount, AtomicLong::get)
                .description("Number of events that exceeded max retry attempts")
                .tag("status", "failed")
                .register(meterRegistry);

        log.info("Outbox metrics registered with Micrometer");
    }

    /**
     * Refreshes the cached gauge values so scrapes never walk the outbox.
     */
    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshMetrics() {
        backlogSize.set(outboxService.countUnpublished());
        oldestEventAgeSeconds.set(outboxService.findOldestUnpublishedCreatedAt()
                .map(oldest -> Duration.between(oldest, Instant.now()).getSeconds())
                .orElse(0L));
        deadLetterCount.set(outboxService.countExceedingRetries(maxRetries));
    }

    public long getBacklogSize() {
        return backlogSize.get();
    }

    public void recordEventPublished(String eventType) {
        Counter.builder("outbox.event.published")
                .tag("event_type", eventType)
                .register(meterRegistry)
                .increment();
    }

    public void recordEventPublishFailed(String eventType) {
        Counter.builder("outbox.event.publish.failure")
                .tag("event_type", eventType)
                .register(meterRegistry)
                .increment();
    }

    public void recordEventDeadLettered(String eventType) {
        Counter.builder("outbox.event.dead_lettered")
                .tag("event_type", eventType)
                .register(meterRegistry)
                .increment();
    }
}
