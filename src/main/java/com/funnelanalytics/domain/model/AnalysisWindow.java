package com.funnelanalytics.domain.model;

import com.funnelanalytics.domain.exception.InvalidAnalysisRequestException;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.UUID;

/**
 * Website and inclusive time range an analysis reads hits from.
 */
@Value
public class AnalysisWindow {

    UUID websiteId;
    Instant startDate;
    Instant endDate;

    public static AnalysisWindow of(UUID websiteId, Instant startDate, Instant endDate) {
        if (websiteId == null) {
            throw new InvalidAnalysisRequestException("websiteId is required");
        }
        if (startDate == null || endDate == null) {
            throw new InvalidAnalysisRequestException("startDate and endDate are required");
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidAnalysisRequestException(
                    "startDate " + startDate + " is after endDate " + endDate);
        }
        return new AnalysisWindow(websiteId, startDate, endDate);
    }

    /**
     * Parses ISO-8601 bounds. Accepts instants, offset date-times and plain dates;
     * a plain end date covers the whole day.
     */
    public static AnalysisWindow parse(UUID websiteId, String startDate, String endDate) {
        return of(websiteId, parseBound(startDate, false), parseBound(endDate, true));
    }

    private static Instant parseBound(String value, boolean endOfDay) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Instant.parse(trimmed);
        } catch (DateTimeParseException ignored) {
            // fall through to the less specific formats
        }
        try {
            return OffsetDateTime.parse(trimmed).toInstant();
        } catch (DateTimeParseException ignored) {
            // plain date below
        }
        try {
            LocalDate date = LocalDate.parse(trimmed);
            return endOfDay
                    ? date.plusDays(1).atStartOfDay(ZoneOffset.UTC).toInstant().minusMillis(1)
                    : date.atStartOfDay(ZoneOffset.UTC).toInstant();
        } catch (DateTimeParseException e) {
            throw new InvalidAnalysisRequestException("Not an ISO-8601 date: " + value);
        }
    }
}
