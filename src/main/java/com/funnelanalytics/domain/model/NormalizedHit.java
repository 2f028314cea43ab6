package com.funnelanalytics.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One pageview or custom event of a session, after URL normalization.
 *
 * For pageviews {@code pathOrName} and {@code pageContext} are both the normalized path.
 * For events {@code pathOrName} is the raw event name and {@code pageContext} the page it fired on.
 */
@Value
@Builder
public class NormalizedHit {

    String sessionId;
    Instant timestamp;

    /** Arrival order, breaks timestamp ties. */
    long sequence;

    HitKind kind;
    String pathOrName;
    String pageContext;

    @Singular
    Map<String, List<String>> parameters;

    public List<String> parameterValues(String key) {
        List<String> values = parameters.get(key);
        return values == null ? List.of() : values;
    }
}
