package com.funnelanalytics.domain.query;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Query text with {@code @name} placeholders and the values bound to them.
 */
@Value
public class RenderedQuery {

    String sql;
    Map<String, Object> parameters;

    public RenderedQuery(String sql, Map<String, Object> parameters) {
        this.sql = sql;
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Copy with every placeholder replaced by its literal value.
     */
    public String substituted() {
        return QueryParameterSubstitutor.substitute(sql, parameters);
    }
}
