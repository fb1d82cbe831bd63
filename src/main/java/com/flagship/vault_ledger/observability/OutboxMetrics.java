package com.flagship.vault_ledger.observability;

import com.flagship.vault_ledger.outbox.OutboxEventRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for the vault event outbox.
 *
 * Gauges read cached values refreshed by {@link MetricsScheduler}, so a
 * metrics scrape never hits the database.
 */
@Component
@Slf4j
public class OutboxMetrics {

    private final OutboxEventRepository outboxRepository;
    private final MeterRegistry meterRegistry;
    private final int maxRetries;

    private final AtomicLong backlogSize = new AtomicLong(0);
    private final AtomicLong oldestEventAgeSeconds = new AtomicLong(0);
    private final AtomicLong deadLetteredCount = new AtomicLong(0);

    public OutboxMetrics(OutboxEventRepository outboxRepository,
                         MeterRegistry meterRegistry,
                         @Value("${outbox.publisher.max-retries:5}") int maxRetries) {
        this.outboxRepository = outboxRepository;
        this.meterRegistry = meterRegistry;
        this.maxRetries = maxRetries;
    }

    @PostConstruct
    public void init() {
        Gauge.builder("outbox.backlog.size", backlogSize, AtomicLong::get)
                .description("Number of unpublished vault events in the outbox")
                .register(meterRegistry);

        Gauge.builder("outbox.backlog.age.seconds", oldestEventAgeSeconds, AtomicLong::get)
                .description("Age of the oldest unpublished vault event in seconds")
                .register(meterRegistry);

        Gauge.builder("outbox.events.dead_lettered", deadLetteredCount, AtomicLong::get)
                .description("Unpublished events that reached the retry limit")
                .register(meterRegistry);
    }

    @Transactional(readOnly = true)
    public void refreshMetrics() {
        try {
            backlogSize.set(outboxRepository.countUnpublished());

            oldestEventAgeSeconds.set(outboxRepository.findOldestUnpublishedCreatedAt()
                    .map(oldest -> Math.max(0, Duration.between(oldest, Instant.now()).getSeconds()))
                    .orElse(0L));

            deadLetteredCount.set(outboxRepository.countByPublishedAtIsNullAndRetryCountGreaterThanEqual(maxRetries));

            log.debug("Outbox metrics refreshed: backlog={}, oldestAge={}s, deadLettered={}",
                    backlogSize.get(), oldestEventAgeSeconds.get(), deadLetteredCount.get());

        } catch (Exception e) {
            log.warn("Failed to refresh outbox metrics: {}", e.getMessage());
        }
    }

    public void recordEventPublished(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "success"
        ).increment();
    }

    public void recordEventPublishFailed(String eventType) {
        meterRegistry.counter("outbox.events.published",
                "event_type", eventType,
                "status", "failure"
        ).increment();
    }

    public void recordEventDeadLettered(String eventType) {
        meterRegistry.counter("outbox.events.dead_lettered.total",
                "event_type", eventType
        ).increment();
    }
}
