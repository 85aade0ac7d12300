package com.linemind.planning.service;

import com.linemind.planning.config.LineMindProperties;
import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.Diagnostic;
import com.linemind.planning.domain.ErrorCode;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixKpi;
import com.linemind.planning.domain.MixPlan;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.PlanResult;
import com.linemind.planning.domain.Strategy;
import com.linemind.planning.engine.EvenSplitMixOptimizer;
import com.linemind.planning.engine.MilpMixOptimizer;
import com.linemind.planning.engine.MixOptimizer;
import com.linemind.planning.exception.DataShapeException;
import com.linemind.planning.exception.PlanningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Boundary of the mix stage: validates, picks the strategy, and turns every failure into an envelope.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MixPlanningService {

    private final EvenSplitMixOptimizer heuristicOptimizer;
    private final MilpMixOptimizer exactOptimizer;
    private final PlanningInputValidator validator;
    private final LineMindProperties properties;

    public PlanResult<List<MixPlanEntry>, MixKpi> runMixOptimization(Map<String, List<DemandPoint>> demand,
                                                                     List<Line> lines,
                                                                     MixCostParams costParams) {
        return runMixOptimization(demand, lines, costParams, properties.getMix().getStrategy());
    }

    public PlanResult<List<MixPlanEntry>, MixKpi> runMixOptimization(Map<String, List<DemandPoint>> demand,
                                                                     List<Line> lines,
                                                                     MixCostParams costParams,
                                                                     String strategy) {
        long startTime = System.currentTimeMillis();
        // Fallback to defaults if params are missing
        MixCostParams params = costParams == null ? MixCostParams.defaults() : costParams;
        String strategyName = strategy;

        try {
            Strategy selected = parseStrategy(strategy);
            validator.validateDemand(demand);
            validator.validateLines(lines);
            validator.validateCostParams(params);

            MixOptimizer optimizer = selected == Strategy.EXACT ? exactOptimizer : heuristicOptimizer;
            strategyName = optimizer.name();

            MixPlan plan;
            try {
                plan = optimizer.optimize(demand, lines, params);
            } catch (PlanningException e) {
                if (e.getErrorCode() != ErrorCode.SOLVER_UNAVAILABLE_ERROR
                        || !properties.getMix().isFallbackToHeuristic()
                        || optimizer.strategy() != Strategy.EXACT) {
                    throw e;
                }
                log.warn("{} unavailable ({}), falling back to {}", optimizer.name(), e.getMessage(),
                        heuristicOptimizer.name());
                plan = heuristicOptimizer.optimize(demand, lines, params);
            }

            return PlanResult.success(plan.getEntries(), plan.getKpi(), plan.getStrategy(),
                    System.currentTimeMillis() - startTime);
        } catch (PlanningException e) {
            log.warn("Mix optimization failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return PlanResult.failure(e.toDiagnostic(), strategyName, System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            log.error("Mix optimization failed unexpectedly", e);
            return PlanResult.failure(internalError(e), strategyName, System.currentTimeMillis() - startTime);
        }
    }

    static Strategy parseStrategy(String strategy) {
        try {
            return Strategy.parse(strategy);
        } catch (IllegalArgumentException e) {
            throw new DataShapeException(e.getMessage(), e);
        }
    }

    static Diagnostic internalError(RuntimeException e) {
        return Diagnostic.builder()
                .code(ErrorCode.INTERNAL_ERROR)
                .message(e.getClass().getSimpleName() + ": " + e.getMessage())
                .build();
    }
}
