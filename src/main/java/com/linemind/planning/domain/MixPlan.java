package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * What a mix optimizer produced, before it is wrapped in a {@link PlanResult}.
 */
@Value
@Builder
public class MixPlan {
    String strategy;
    List<MixPlanEntry> entries;
    MixKpi kpi;
    double objectiveValue;
}
