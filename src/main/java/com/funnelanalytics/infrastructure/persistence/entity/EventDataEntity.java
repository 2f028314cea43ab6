package com.funnelanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One key/value parameter attached to a custom event.
 */
@Entity
@Table(name = "event_data", indexes = {
    @Index(name = "idx_event_data_website_created", columnList = "websiteId,createdAt"),
    @Index(name = "idx_event_data_event", columnList = "websiteEventId")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EventDataEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID eventDataId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID websiteEventId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID websiteId;

    @Column(nullable = false, length = 500)
    private String dataKey;

    @Column(columnDefinition = "TEXT")
    private String stringValue;

    @Column(nullable = false)
    private Instant createdAt;
}
