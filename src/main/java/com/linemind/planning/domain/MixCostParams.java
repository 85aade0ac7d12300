package com.linemind.planning.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MixCostParams {

    public static final double DEFAULT_UNIT_COST = 1000.0;
    public static final int DEFAULT_PLANNING_WEEKS = 4;

    // Production cost per unit
    private double unitCost;

    // Pairwise changeover table, only the exact strategy reads it
    @Builder.Default
    private List<ChangeoverCost> changeoverCosts = new ArrayList<>();

    // Weeks the exact model plans ahead, capped by the forecast horizon
    private int planningWeeks;

    // Advanced solver settings; 0 means "use the configured limit"
    private double solverTimeoutSec;

    public static MixCostParams defaults() {
        return MixCostParams.builder()
                .unitCost(DEFAULT_UNIT_COST)
                .planningWeeks(DEFAULT_PLANNING_WEEKS)
                .build();
    }

    public static MixCostParams withChangeovers(List<ChangeoverCost> changeoverCosts) {
        return defaults().toBuilder()
                .changeoverCosts(new ArrayList<>(changeoverCosts))
                .build();
    }
}
