package com.funnelanalytics.domain.query;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Inlines {@code @name} parameters into query text for display.
 * The result is never executed.
 */
public final class QueryParameterSubstitutor {

    private QueryParameterSubstitutor() {
    }

    public static String substitute(String sql, Map<String, Object> parameters) {
        if (sql == null || parameters == null || parameters.isEmpty()) {
            return sql;
        }

        // Longest names first so @stepValue1 never eats the prefix of @stepValue10
        List<String> names = new ArrayList<>(parameters.keySet());
        names.sort(Comparator.comparingInt(String::length).reversed());

        String result = sql;
        for (String name : names) {
            Pattern placeholder = Pattern.compile("@" + Pattern.quote(name) + "\\b");
            String literal = toLiteral(parameters.get(name));
            result = placeholder.matcher(result).replaceAll(Matcher.quoteReplacement(literal));
        }
        return result;
    }

    static String toLiteral(Object value) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Collection<?> collection) {
            return collection.stream()
                    .map(QueryParameterSubstitutor::toLiteral)
                    .collect(Collectors.joining(", ", "[", "]"));
        }
        if (value instanceof Instant instant) {
            return "'" + instant + "'";
        }
        return "'" + value.toString().replace("'", "\\'") + "'";
    }
}
