package com.funnelanalytics.infrastructure.persistence.repository;

import com.funnelanalytics.infrastructure.persistence.entity.EventDataEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Event parameters for one website and time window. The {@code ForKeys} variants read only the given keys.
 */
@Repository
public interface EventDataRepository extends JpaRepository<EventDataEntity, UUID> {

    @Query("SELECT d FROM EventDataEntity d WHERE " +
           "d.websiteId = :websiteId AND " +
           "d.createdAt BETWEEN :startTime AND :endTime")
    List<EventDataEntity> findInWindow(
            @Param("websiteId") UUID websiteId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime
    );

    @Query("SELECT COUNT(d) FROM EventDataEntity d WHERE " +
           "d.websiteId = :websiteId AND " +
           "d.createdAt BETWEEN :startTime AND :endTime")
    long countInWindow(
            @Param("websiteId") UUID websiteId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime
    );

    @Query("SELECT d FROM EventDataEntity d WHERE " +
           "d.websiteId = :websiteId AND " +
           "d.createdAt BETWEEN :startTime AND :endTime AND " +
           "d.dataKey IN :keys")
    List<EventDataEntity> findInWindowForKeys(
            @Param("websiteId") UUID websiteId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime,
            @Param("keys") Collection<String> keys
    );

    @Query("SELECT COUNT(d) FROM EventDataEntity d WHERE " +
           "d.websiteId = :websiteId AND " +
           "d.createdAt BETWEEN :startTime AND :endTime AND " +
           "d.dataKey IN :keys")
    long countInWindowForKeys(
            @Param("websiteId") UUID websiteId,
            @Param("startTime") Instant startTime,
            @Param("endTime") Instant endTime,
            @Param("keys") Collection<String> keys
    );
}
