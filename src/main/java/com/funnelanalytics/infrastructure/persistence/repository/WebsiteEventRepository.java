package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.WebsiteEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Reads hits for one website and time window.
 */
@Repository
public interface WebsiteEventRepository extends JpaRepository<WebsiteEventEntity, UUID> {

    /**
     * Hits grouped by session, chronological within each session.
     *
     * The table records no insertion sequence, so hits sharing a timestamp are ordered by event id.
     * Repeated reads of the same window therefore assign the same sequence numbers.
     */
    @Query("SELECT e FROM WebsiteEventEntity e WHERE " +
           "e.websiteId = :websiteId AND " +
           "e.createdAt BETWEEN :startTime AND :endTime AND " +
           "e.eventType IN :eventTypes " +
           "ORDER BY e.sessionId ASC, e.createdAt ASC, e.eventId ASC")
    List<WebsiteEventEntity> findHits(
            @Param("websiteId") UUID websiteId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime,
            @Param("eventTypes") Collection<Integer> eventTypes
    );

    /**
     * Rows {@link #findHits} would return. Used for the scan limit and the dry run.
     */
    @Query("SELECT COUNT(e) FROM WebsiteEventEntity e WHERE " +
           "e.websiteId = :websiteId AND " +
           "e.createdAt BETWEEN :startTime AND :endTime AND " +
           "e.eventType IN :eventTypes")
    long countHits(
            @Param("websiteId") UUID websiteId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime,
            @Param("eventTypes") Collection<Integer> eventTypes
    );
}
