package com.flagship.vault_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.vault_ledger.event.VaultEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes vault events to the outbox.
 *
 * Called inside the business transaction: if the operation commits, its
 * event is guaranteed to be stored; if it rolls back, so does the event.
 * Publishing to Kafka is done separately by {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String AGGREGATE_TYPE = "Vault";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Saves an event within the caller's transaction (MANDATORY propagation).
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(VaultEvent event) {
        String jsonPayload = serializePayload(event);

        OutboxEvent outboxEvent = OutboxEvent.create(
            AGGREGATE_TYPE, event.getAggregateKey(), event.getEventType(), jsonPayload);
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, aggregateKey={}", event.getEventType(), event.getAggregateKey());

        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> findPublishableEvents(int limit, int maxRetries) {
        return repository.findPublishable(maxRetries, PageRequest.of(0, limit))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateKey) {
        return repository.findByAggregateTypeAndAggregateKeyOrderByCreatedAtAsc(AGGREGATE_TYPE, aggregateKey)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsOfType(String eventType) {
        return repository.findByEventTypeOrderByCreatedAtAsc(eventType)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
