package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

/**
 * Uniform envelope returned by every planning stage.
 *
 * @param <T> stage payload
 * @param <K> stage KPIs
 */
@Value
@Builder
public class PlanResult<T, K> {

    public enum Outcome {
        SUCCESS,
        ERROR
    }

    Outcome outcome;
    T payload;
    K kpis;
    Diagnostic diagnostic; // only set on ERROR
    String strategy;
    long computationTimeMs;

    public boolean isSuccess() {
        return outcome == Outcome.SUCCESS;
    }

    public static <T, K> PlanResult<T, K> success(T payload, K kpis, String strategy, long computationTimeMs) {
        return PlanResult.<T, K>builder()
                .outcome(Outcome.SUCCESS)
                .payload(payload)
                .kpis(kpis)
                .strategy(strategy)
                .computationTimeMs(computationTimeMs)
                .build();
    }

    public static <T, K> PlanResult<T, K> failure(Diagnostic diagnostic, String strategy, long computationTimeMs) {
        return PlanResult.<T, K>builder()
                .outcome(Outcome.ERROR)
                .diagnostic(diagnostic)
                .strategy(strategy)
                .computationTimeMs(computationTimeMs)
                .build();
    }
}
