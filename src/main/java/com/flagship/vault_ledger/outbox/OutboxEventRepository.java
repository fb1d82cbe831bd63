package com.flagship.vault_ledger.outbox;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OutboxEventRepository extends JpaRepository<OutboxEventEntity, UUID> {

    /**
     * Oldest unpublished events still below the retry threshold, for the publisher.
     */
    @Query("""
        SELECT e FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount < :maxRetries
        ORDER BY e.createdAt ASC
        """)
    List<OutboxEventEntity> findPublishable(@Param("maxRetries") int maxRetries, Pageable page);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateKeyOrderByCreatedAtAsc(
        String aggregateType, String aggregateKey);

    List<OutboxEventEntity> findByEventTypeOrderByCreatedAtAsc(String eventType);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    long countByPublishedAtIsNullAndRetryCountGreaterThanEqual(int retryCount);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
