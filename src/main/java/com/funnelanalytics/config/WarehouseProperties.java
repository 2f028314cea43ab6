package com.funnelanalytics.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Where hits live and how much an analysis may read.
 *
 * Passed into the renderers, the hit stream provider and the cost estimator at construction time.
 */
@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.warehouse")
public class WarehouseProperties {

    /**
     * Fully qualified table of pageviews and custom events.
     */
    @NotBlank
    private String eventTable = "umami.public_website_event";

    /**
     * Fully qualified table of custom event parameters.
     */
    @NotBlank
    private String eventDataTable = "umami_views.event_data";

    @NotBlank
    private String location = "europe-north1";

    /**
     * Upper bound on hits read for a single analysis. Exceeding it fails the analysis.
     */
    @Min(1)
    private long maxRowsScanned = 20_000_000L;

    /**
     * Average stored size of one hit row, used by the dry-run estimate.
     */
    @Positive
    private long averageRowBytes = 320L;

    /**
     * On-demand price per TiB scanned.
     */
    @Positive
    private double costPerTibUsd = 6.25;
}
