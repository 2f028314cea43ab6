package com.funnelanalytics.domain.funnel;

/**
 * One explicit condition of a {@link FilterStage}. A hit qualifies for a stage when every predicate holds.
 *
 * Implementations are plain values so the same plan can be evaluated in memory
 * and rendered by {@link FunnelSqlRenderer}.
 */
public interface StagePredicate {

    boolean test(StageCandidate candidate);
}
