package com.linemind.planning.engine;

import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixPlan;
import com.linemind.planning.domain.Strategy;

import java.util.List;
import java.util.Map;

/**
 * Assigns forecast demand to production lines. Implementations throw
 * {@link com.linemind.planning.exception.PlanningException} subclasses on failure.
 */
public interface MixOptimizer {

    String name();

    Strategy strategy();

    MixPlan optimize(Map<String, List<DemandPoint>> demand, List<Line> lines, MixCostParams params);
}
