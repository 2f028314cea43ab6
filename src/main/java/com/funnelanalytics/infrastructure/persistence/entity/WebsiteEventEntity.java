package com.funnelanalytics.infrastructure.persistence.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Pageview or custom event recorded by the tracker.
 *
 * Every analysis reads one website and time window at a time, ordered by session,
 * so (websiteId, createdAt) and (sessionId, createdAt) carry the indexes.
 */
@Entity
@Table(name = "website_event", indexes = {
    @Index(name = "idx_website_created", columnList = "websiteId,createdAt"),
    @Index(name = "idx_session_created", columnList = "sessionId,createdAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebsiteEventEntity {

    @Id
    @Column(columnDefinition = "UUID")
    private UUID eventId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID websiteId;

    @Column(nullable = false, columnDefinition = "UUID")
    private UUID sessionId;

    /** 1 = pageview, 2 = custom event */
    @Column(nullable = false)
    private int eventType;

    @Column(length = 500)
    private String urlPath;

    @Column(length = 50)
    private String eventName;

    @Column(nullable = false)
    private Instant createdAt;
}
