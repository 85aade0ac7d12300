package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MixPlanEntry {
    int period; // 1-based week
    String lineId;
    String product;
    int plannedUnits;
    double utilization; // 0.0 - 1.0
}
