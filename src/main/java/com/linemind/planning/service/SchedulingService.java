package com.linemind.planning.service;

import com.linemind.planning.config.LineMindProperties;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.PlanResult;
import com.linemind.planning.domain.ScheduleEntry;
import com.linemind.planning.domain.ScheduleKpi;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Strategy;
import com.linemind.planning.domain.Worker;
import com.linemind.planning.domain.WorkforceSchedule;
import com.linemind.planning.engine.CpSatWorkforceScheduler;
import com.linemind.planning.engine.GreedySeniorityScheduler;
import com.linemind.planning.engine.WorkforceScheduler;
import com.linemind.planning.exception.PlanningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Boundary of the scheduling stage. Accepts a mix plan from the optimizer or from any external caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingService {

    private final GreedySeniorityScheduler heuristicScheduler;
    private final CpSatWorkforceScheduler exactScheduler;
    private final PlanningInputValidator validator;
    private final LineMindProperties properties;
    private final Clock clock;

    public PlanResult<List<ScheduleEntry>, ScheduleKpi> runSchedule(List<MixPlanEntry> mixPlan,
                                                                  List<Worker> workers,
                                                                  SchedulingParams params) {
        return runSchedule(mixPlan, workers, params, properties.getSchedule().getStrategy());
    }

    public PlanResult<List<ScheduleEntry>, ScheduleKpi> runSchedule(List<MixPlanEntry> mixPlan,
                                                                  List<Worker> workers,
                                                                  SchedulingParams params,
                                                                  String strategy) {
        long startTime = System.currentTimeMillis();
        String strategyName = strategy;

        try {
            Strategy selected = MixPlanningService.parseStrategy(strategy);
            SchedulingParams resolved = resolve(params);
            validator.validateSchedulingParams(resolved);
            validator.validateMixPlan(mixPlan);
            validator.validateWorkers(workers);

            WorkforceScheduler scheduler = selected == Strategy.EXACT ? exactScheduler : heuristicScheduler;
            strategyName = scheduler.name();

            WorkforceSchedule schedule = scheduler.schedule(mixPlan, workers, resolved);
            log.info("{} ({}): {} entries, fulfillment {}%, cost {}", strategyName, scheduler.strategy(),
                    schedule.getEntries().size(), schedule.getKpi().getFulfillmentRate(),
                    schedule.getKpi().getTotalCost());

            return PlanResult.success(schedule.getEntries(), schedule.getKpi(), schedule.getStrategy(),
                    System.currentTimeMillis() - startTime);
        } catch (PlanningException e) {
            log.warn("Scheduling failed [{}]: {}", e.getErrorCode(), e.getMessage());
            return PlanResult.failure(e.toDiagnostic(), strategyName, System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            log.error("Scheduling failed unexpectedly", e);
            return PlanResult.failure(MixPlanningService.internalError(e), strategyName,
                    System.currentTimeMillis() - startTime);
        }
    }

    private SchedulingParams resolve(SchedulingParams params) {
        SchedulingParams base = params == null ? SchedulingParams.defaults() : params;
        if (base.getStartDate() != null) {
            return base;
        }
        return base.toBuilder().startDate(LocalDate.now(clock)).build();
    }
}
