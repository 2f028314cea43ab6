package com.funnelanalytics.domain.funnel;

import com.funnelanalytics.config.WarehouseProperties;
import com.funnelanalytics.domain.model.HitKind;
import com.funnelanalytics.domain.model.ParamOperator;
import com.funnelanalytics.domain.query.RenderedQuery;
import com.funnelanalytics.domain.query.SqlFragments;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders a {@link FunnelQueryPlan} as one warehouse query: a base CTE of hits with
 * their predecessor, then one CTE per stage joined to the stage before it.
 *
 * Rendering is separate from compilation; the evaluator never reads this text.
 */
@Component
@RequiredArgsConstructor
public class FunnelSqlRenderer {

    private final WarehouseProperties properties;

    public RenderedQuery render(FunnelQueryPlan plan) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("websiteId", plan.getWindow().getWebsiteId().toString());
        parameters.put("startDate", plan.getWindow().getStartDate());
        parameters.put("endDate", plan.getWindow().getEndDate());

        StringBuilder sql = new StringBuilder();
        sql.append(baseCtes(plan));

        List<String> stageCtes = new ArrayList<>();
        for (FilterStage stage : plan.getStages()) {
            stageCtes.add(stageCte(stage, parameters));
        }
        sql.append(String.join(",\n", stageCtes)).append('\n');

        List<String> countRows = new ArrayList<>();
        for (FilterStage stage : plan.getStages()) {
            countRows.add("SELECT " + stage.getIndex() + " AS step, @" + FunnelPlanCompiler.valueParameter(stage.getIndex())
                    + " AS value, (SELECT COUNT(DISTINCT session_id) FROM " + stage.getName() + ") AS count");
        }
        sql.append(String.join("\nUNION ALL ", countRows)).append("\nORDER BY step");

        return new RenderedQuery(sql.toString(), parameters);
    }

    private String baseCtes(FunnelQueryPlan plan) {
        String eventTypes = plan.getPattern().requiredHitKinds().stream()
                .map(HitKind::getCode)
                .sorted()
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
        String normalizedUrl = SqlFragments.normalizedUrl("url_path");

        return "WITH events_raw AS (\n"
                + "    SELECT\n"
                + "        session_id,\n"
                + "        event_id,\n"
                + "        website_id,\n"
                + "        event_type,\n"
                + "        CASE\n"
                + "            WHEN event_type = " + HitKind.PAGEVIEW.getCode() + " THEN " + normalizedUrl + "\n"
                + "            WHEN event_type = " + HitKind.EVENT.getCode() + " THEN event_name\n"
                + "            ELSE NULL\n"
                + "        END AS step_value,\n"
                + "        " + normalizedUrl + " AS url_path_normalized,\n"
                + "        created_at\n"
                + "    FROM " + SqlFragments.table(properties.getEventTable()) + "\n"
                + "    WHERE website_id = @websiteId\n"
                + "      AND created_at BETWEEN @startDate AND @endDate\n"
                + "      AND event_type IN (" + eventTypes + ")\n"
                + "),\n"
                + "events AS (\n"
                + "    SELECT\n"
                + "        *,\n"
                + "        LAG(step_value) OVER (PARTITION BY session_id ORDER BY created_at) AS prev_step_value,\n"
                + "        LAG(event_type) OVER (PARTITION BY session_id ORDER BY created_at) AS prev_event_type\n"
                + "    FROM events_raw\n"
                + "),\n";
    }

    private String stageCte(FilterStage stage, Map<String, Object> parameters) {
        int position = stage.getIndex() + 1;
        List<String> conditions = new ArrayList<>();
        String join = "";

        for (StagePredicate predicate : stage.getPredicates()) {
            if (predicate instanceof HitKindPredicate kind) {
                conditions.add("e.event_type = " + kind.getKind().getCode());
            } else if (predicate instanceof StepValuePredicate value) {
                parameters.put(value.getParameterName(), value.getPattern().sqlLiteral());
                conditions.add("e.step_value " + value.getPattern().sqlOperator() + " @" + value.getParameterName());
            } else if (predicate instanceof AfterPreviousStagePredicate after) {
                join = "    JOIN " + after.getPreviousStage() + " prev ON e.session_id = prev.session_id\n";
                conditions.add("e.created_at > prev.time" + stage.getIndex());
            } else if (predicate instanceof PrecededByPredicate preceded) {
                conditions.add("e.prev_event_type = " + preceded.getPreviousKind().getCode());
                conditions.add("e.prev_step_value " + preceded.getPreviousPattern().sqlOperator()
                        + " @" + preceded.getPreviousParameterName());
            } else if (predicate instanceof SamePagePredicate) {
                conditions.add("e.url_path_normalized = prev.url_path" + stage.getIndex());
            } else if (predicate instanceof ParameterPredicate parameter) {
                conditions.add(parameterCondition(stage.getIndex(), parameter, parameters));
            } else {
                throw new IllegalStateException("No SQL form for predicate " + predicate);
            }
        }

        return stage.getName() + " AS (\n"
                + "    SELECT\n"
                + "        e.session_id,\n"
                + "        MIN(e.created_at) AS time" + position + ",\n"
                + "        ARRAY_AGG(e.url_path_normalized ORDER BY e.created_at LIMIT 1)[OFFSET(0)] AS url_path" + position + "\n"
                + "    FROM events e\n"
                + join
                + "    WHERE " + String.join("\n      AND ", conditions) + "\n"
                + "    GROUP BY e.session_id\n"
                + ")";
    }

    private String parameterCondition(int stageIndex, ParameterPredicate predicate, Map<String, Object> parameters) {
        String alias = "d_" + stageIndex + "_" + predicate.getKeyParameterName().replaceAll("\\D+", "");
        String operator = predicate.getFilter().getOperator() == ParamOperator.CONTAINS ? "LIKE" : "=";
        String value = predicate.getFilter().getOperator() == ParamOperator.CONTAINS
                ? "%" + predicate.getFilter().getValue() + "%"
                : predicate.getFilter().getValue();

        parameters.put(predicate.getKeyParameterName(), predicate.getFilter().getKey());
        parameters.put(predicate.getValueParameterName(), value);

        return "EXISTS (\n"
                + "        SELECT 1\n"
                + "        FROM " + SqlFragments.table(properties.getEventDataTable()) + " " + alias + "\n"
                + "        CROSS JOIN UNNEST(" + alias + ".event_parameters) p_" + alias + "\n"
                + "        WHERE " + alias + ".website_event_id = e.event_id\n"
                + "          AND " + alias + ".website_id = e.website_id\n"
                + "          AND p_" + alias + ".data_key = @" + predicate.getKeyParameterName() + "\n"
                + "          AND p_" + alias + ".string_value " + operator + " @" + predicate.getValueParameterName() + "\n"
                + "      )";
    }
}
