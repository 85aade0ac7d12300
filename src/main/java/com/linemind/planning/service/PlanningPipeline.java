package com.linemind.planning.service;

import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.ForecastKpi;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixKpi;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.PlanResult;
import com.linemind.planning.domain.ProductionRecord;
import com.linemind.planning.domain.ScheduleEntry;
import com.linemind.planning.domain.ScheduleKpi;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Worker;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Forecast, then mix, then schedule. Stops at the first stage that fails.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PlanningPipeline {

    private final ForecastService forecastService;
    private final MixPlanningService mixPlanningService;
    private final SchedulingService schedulingService;

    @Value
    @Builder
    public static class Outcome {
        PlanResult<Map<String, List<DemandPoint>>, ForecastKpi> forecast;
        PlanResult<List<MixPlanEntry>, MixKpi> mix; // null if forecasting failed
        PlanResult<List<ScheduleEntry>, ScheduleKpi> schedule; // null if an earlier stage failed

        public boolean isComplete() {
            return schedule != null && schedule.isSuccess();
        }
    }

    public Outcome run(List<ProductionRecord> history, List<String> products, List<Line> lines,
                       MixCostParams costParams, List<Worker> workers, SchedulingParams schedulingParams,
                       String mixStrategy, String scheduleStrategy) {
        Outcome.OutcomeBuilder outcome = Outcome.builder();

        PlanResult<Map<String, List<DemandPoint>>, ForecastKpi> forecast = forecastService.runForecast(history, products);
        outcome.forecast(forecast);
        if (!forecast.isSuccess()) {
            return outcome.build();
        }

        PlanResult<List<MixPlanEntry>, MixKpi> mix = mixPlanningService.runMixOptimization(forecast.getPayload(), lines, costParams, mixStrategy);
        outcome.mix(mix);
        if (!mix.isSuccess()) {
            log.warn("Pipeline stopped after mix stage: {}", mix.getDiagnostic().getMessage());
            return outcome.build();
        }

        outcome.schedule(schedulingService.runSchedule(mix.getPayload(), workers,
                alignWithForecast(schedulingParams, forecast.getPayload()), scheduleStrategy));
        return outcome.build();
    }

    /**
     * Week 1 of the mix plan is the first forecast week, so a schedule without an explicit start
     * date begins on the earliest forecast date.
     */
    static SchedulingParams alignWithForecast(SchedulingParams params, Map<String, List<DemandPoint>> forecast) {
        SchedulingParams base = params == null ? SchedulingParams.defaults() : params;
        if (base.getStartDate() != null) {
            return base;
        }
        return forecast.values().stream()
                .filter(series -> !series.isEmpty())
                .map(series -> series.get(0).getDate())
                .min(Comparator.naturalOrder())
                .map(first -> base.toBuilder().startDate(first).build())
                .orElse(base);
    }
}
