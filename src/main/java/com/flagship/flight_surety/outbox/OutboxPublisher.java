package com.flagship.flight_surety.outbox;

import com.flagship.flight_surety.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Background publisher that reads events from the outbox and publishes to Kafka.
 *
 * This component:
 * 1. Polls the outbox for unpublished events below the retry limit
 * 2. Publishes each event to Kafka, keyed by aggregate id
 * 3. Marks events as published on success
 * 4. Counts retries on failure; an event reaching max retries is dead-lettered
 *    and no longer polled
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.surety:flight-surety}")
    private String suretyTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize, maxRetries);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            for (OutboxEvent event : events) {
                publishEvent(event);
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    private void publishEvent(OutboxEvent event) {
        try {
            // Wait for the ack so events of one aggregate stay in order
            CompletableFuture<SendResult<String, String>> future =
                    kafkaTemplate.send(suretyTopic, event.getAggregateId(), event.getPayload());
            SendResult<String, String> result = future.get();

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().topic(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "interrupted");
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            recordFailure(event, e.getMessage());
        }
    }

    private void recordFailure(OutboxEvent event, String errorMessage) {
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        outboxService.markFailed(event.getId(), errorMessage)
                .filter(failed -> failed.getRetryCount() >= maxRetries)
                .ifPresent(failed -> {
                    log.warn("Event {} reached max retries ({}), dead-lettered. eventType={}, aggregateId={}",
                            failed.getId(), maxRetries, failed.getEventType(), failed.getAggregateId());
                    outboxMetrics.recordEventDeadLettered(failed.getEventType());
                });
    }

    /**
     * Manually triggers publishing (useful for testing).
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
