package com.funnelanalytics.infrastructure.warehouse;

import com.funnelanalytics.domain.model.AnalysisWindow;
import com.funnelanalytics.domain.model.HitKind;
import lombok.Value;

import java.util.EnumSet;
import java.util.Set;

/**
 * Which hits an analysis needs: the window, the hit kinds, and whether event parameters must be attached.
 *
 * When parameters are attached, {@code parameterKeys} limits them to the listed keys. Empty means every key.
 */
@Value
public class HitStreamRequest {

    AnalysisWindow window;
    Set<HitKind> kinds;
    boolean includeParameters;
    Set<String> parameterKeys;

    public static HitStreamRequest of(AnalysisWindow window, Set<HitKind> kinds, boolean includeParameters) {
        return new HitStreamRequest(window, copyKinds(kinds), includeParameters, Set.of());
    }

    public static HitStreamRequest withParameterKeys(AnalysisWindow window, Set<HitKind> kinds, Set<String> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new IllegalArgumentException("At least one parameter key is required");
        }
        return new HitStreamRequest(window, copyKinds(kinds), true, Set.copyOf(keys));
    }

    public static HitStreamRequest pageviews(AnalysisWindow window) {
        return of(window, EnumSet.of(HitKind.PAGEVIEW), false);
    }

    public boolean restrictsParameterKeys() {
        return includeParameters && !parameterKeys.isEmpty();
    }

    private static Set<HitKind> copyKinds(Set<HitKind> kinds) {
        if (kinds == null || kinds.isEmpty()) {
            throw new IllegalArgumentException("At least one hit kind is required");
        }
        return Set.copyOf(EnumSet.copyOf(kinds));
    }
}
