package com.funnelanalytics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Funnel and journey analytics over website hit events.
 *
 * Computes sequential funnel counts, time between funnel steps and page flow graphs
 * for a website and a time window, with dry-run cost estimates and a query audit trail.
 */
@SpringBootApplication
@EnableScheduling
public class FunnelAnalyticsApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunnelAnalyticsApplication.class, args);
    }
}
