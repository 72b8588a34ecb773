package com.flagship.fund_quarantine.outbox;

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
     * Next batch for the publisher, oldest first. Dead-lettered rows are skipped
     * so they cannot starve newer events; rows locked by another publisher are skipped too.
     */
    @Query(value = """
        SELECT * FROM outbox_events
        WHERE published_at IS NULL
          AND retry_count < :maxRetries
        ORDER BY sequence_number ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<OutboxEventEntity> findPublishableForUpdate(@Param("limit") int limit,
                                                     @Param("maxRetries") int maxRetries);

    List<OutboxEventEntity> findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
        String aggregateType, UUID aggregateId);

    @Query("SELECT COUNT(e) FROM OutboxEventEntity e WHERE e.publishedAt IS NULL")
    long countUnpublished();

    /**
     * Dead-lettered events, for manual inspection.
     */
    @Query("""
        SELECT e FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL AND e.retryCount >= :maxRetries
        ORDER BY e.createdAt ASC
        """)
    List<OutboxEventEntity> findDeadLetterEvents(@Param("maxRetries") int maxRetries);

    long countByRetryCountGreaterThanEqual(int retryCount);

    @Query("""
        SELECT MIN(e.createdAt) FROM OutboxEventEntity e
        WHERE e.publishedAt IS NULL
        """)
    Optional<Instant> findOldestUnpublishedCreatedAt();
}
