package com.funnelanalytics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.analysis")
public class AnalysisProperties {

    /**
     * Sessions matched per task when funnel timing fans out.
     */
    @Min(1)
    private int timingChunkSize = 2_000;

    /**
     * Largest journey horizon a request may ask for.
     */
    @Min(1)
    private int maxJourneySteps = 15;

    @Valid
    private EventJourney eventJourney = new EventJourney();

    /**
     * How custom events are labelled and ranked in event journeys.
     */
    @Data
    public static class EventJourney {

        /**
         * Distinct paths returned, most frequent first.
         */
        @Min(1)
        private int maxPaths = 100;

        /**
         * Parameter keys left out of event labels, compared case-insensitively.
         * These vary per hit and would split otherwise identical paths.
         */
        private List<String> ignoredKeys = new ArrayList<>(List.of(
                "scrollpos", "screen", "screenwidth", "screenheight", "viewport", "timestamp", "time", "scrolldepth"));

        /**
         * Parameter keys printed before the others in an event label.
         */
        private List<String> leadingKeys = new ArrayList<>(List.of("lenketekst", "tittel"));

        /**
         * Parameter key of events that leave the page. Among events sharing a timestamp they sort last.
         */
        @NotBlank
        private String navigationKey = "destinasjon";
    }
}
