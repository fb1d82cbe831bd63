package com.flagship.vault_ledger.outbox;

import com.flagship.vault_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Background publisher that drains the outbox into the vault events topic.
 *
 * - Sends synchronously, one event at a time, to keep per-key ordering
 * - Uses the aggregate key (user address or parameter name) as Kafka key
 * - A failed send increments the event's retry count; events at the retry
 *   limit are no longer picked up and need manual attention
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;
    private final String vaultEventsTopic;
    private final int batchSize;
    private final int maxRetries;
    private final long sendTimeoutMs;

    public OutboxPublisher(OutboxService outboxService,
                           KafkaTemplate<String, String> kafkaTemplate,
                           OutboxMetrics outboxMetrics,
                           @Value("${kafka.topic.vault-events:vault-events}") String vaultEventsTopic,
                           @Value("${outbox.publisher.batch-size:100}") int batchSize,
                           @Value("${outbox.publisher.max-retries:5}") int maxRetries,
                           @Value("${outbox.publisher.send-timeout-ms:10000}") long sendTimeoutMs) {
        this.outboxService = outboxService;
        this.kafkaTemplate = kafkaTemplate;
        this.outboxMetrics = outboxMetrics;
        this.vaultEventsTopic = vaultEventsTopic;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.sendTimeoutMs = sendTimeoutMs;
    }

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

    void publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                    .send(vaultEventsTopic, event.getAggregateKey(), event.getPayload())
                    .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, partition={}, offset={}, eventType={}",
                    event.getId(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset(),
                    event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outboxService.markFailed(event.getId(), "interrupted");
            outboxMetrics.recordEventPublishFailed(event.getEventType());
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                    event.getId(), event.getEventType(), e.getMessage());
            outboxService.markFailed(event.getId(), e.getMessage());
            outboxMetrics.recordEventPublishFailed(event.getEventType());

            if (event.getRetryCount() + 1 >= maxRetries) {
                outboxMetrics.recordEventDeadLettered(event.getEventType());
            }
        }
    }
}
