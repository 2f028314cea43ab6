package com.funnelanalytics.domain.query;

import com.funnelanalytics.config.WarehouseProperties;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.infrastructure.warehouse.HitStreamRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders the bulk hit read that timing and journey analyses run before matching in application code.
 * Event parameters are joined in when the request attaches them.
 */
@Component
@RequiredArgsConstructor
public class HitStreamSqlRenderer {

    private final WarehouseProperties properties;

    public RenderedQuery render(HitStreamRequest request) {
        String eventTypes = request.getKinds().stream()
                .map(HitKind::getCode)
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));

        StringBuilder sql = new StringBuilder("SELECT\n")
                .append("    e.event_id,\n")
                .append("    e.session_id,\n")
                .append("    e.event_type,\n")
                .append("    ").append(SqlFragments.normalizedUrl("e.url_path")).append(" AS url_path,\n")
                .append("    e.event_name,\n")
                .append("    e.created_at");
        if (request.isIncludeParameters()) {
            sql.append(",\n    d.data_key,\n    d.string_value");
        }
        sql.append("\nFROM ").append(SqlFragments.table(properties.getEventTable())).append(" e\n");
        if (request.isIncludeParameters()) {
            sql.append("LEFT JOIN ").append(SqlFragments.table(properties.getEventDataTable())).append(" d\n")
                    .append("    ON d.website_event_id = e.event_id\n")
                    .append("    AND d.website_id = e.website_id\n");
            if (request.restrictsParameterKeys()) {
                sql.append("    AND d.data_key IN UNNEST(@parameterKeys)\n");
            }
        }
        sql.append("WHERE e.website_id = @websiteId\n")
                .append("  AND e.created_at BETWEEN @startDate AND @endDate\n")
                .append("  AND e.event_type IN (").append(eventTypes).append(")\n")
                .append("ORDER BY e.session_id, e.created_at, e.event_id");

        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("websiteId", request.getWindow().getWebsiteId().toString());
        parameters.put("startDate", request.getWindow().getStartDate());
        parameters.put("endDate", request.getWindow().getEndDate());
        if (request.restrictsParameterKeys()) {
            parameters.put("parameterKeys", request.getParameterKeys().stream().sorted().collect(Collectors.toList()));
        }
        return new RenderedQuery(sql.toString(), parameters);
    }
}
