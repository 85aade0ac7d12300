package com.linemind.planning.service;

import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.ErrorCode;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixKpi;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.PlanResult;
import com.linemind.planning.domain.ScheduleEntry;
import com.linemind.planning.domain.ScheduleKpi;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Shift;
import com.linemind.planning.domain.Worker;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.linemind.planning.PlanningFixtures.START;
import static com.linemind.planning.PlanningFixtures.entry;
import static com.linemind.planning.PlanningFixtures.flatDemand;
import static com.linemind.planning.PlanningFixtures.history;
import static com.linemind.planning.PlanningFixtures.line;
import static com.linemind.planning.PlanningFixtures.worker;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = "linemind.forecast.seed=42")
class PlanningPipelineIntegrationTest {

    @Autowired
    private PlanningPipeline pipeline;

    @Autowired
    private MixPlanningService mixPlanningService;

    @Autowired
    private SchedulingService schedulingService;

    private final List<Line> lines = List.of(line("L1", 150, "A"), line("L2", 150, "A"));
    private final List<Worker> workers = List.of(
            worker("W1", 10, 25, 48, false),
            worker("W2", 8, 24, 48, true),
            worker("W3", 5, 22, 48, false),
            worker("W4", 3, 21, 48, true),
            worker("W5", 1, 20, 48, false));

    @Test
    void heuristicPipeline_splitsDemandAndStaffsBySeniority() {
        PlanningPipeline.Outcome outcome = pipeline.run(history("A", 100, 14), List.of(), lines,
                MixCostParams.defaults(), workers, SchedulingParams.startingOn(START), "heuristic", "heuristic");

        assertThat(outcome.getForecast().isSuccess()).isTrue();
        assertThat(outcome.getForecast().getPayload().get("A")).hasSize(30);

        PlanResult<List<MixPlanEntry>, MixKpi> mix = outcome.getMix();
        assertThat(mix.isSuccess()).isTrue();
        assertThat(mix.getPayload()).extracting(MixPlanEntry::getLineId).containsExactly("L1", "L2");
        int l1Units = mix.getPayload().get(0).getPlannedUnits();
        int l2Units = mix.getPayload().get(1).getPlannedUnits();
        assertThat(l1Units).isBetween(300, 400);
        assertThat(l1Units - l2Units).isBetween(0, 1);
        assertThat(mix.getKpis().getFulfillmentRate()).isEqualTo(100.0);

        assertThat(outcome.isComplete()).isTrue();
        int headcount = Math.min((l1Units + 99) / 100, workers.size());
        List<String> firstSlot = outcome.getSchedule().getPayload().stream()
                .filter(e -> e.getDate().equals(START) && e.getLineId().equals("L1") && e.getShift() == Shift.DAY)
                .map(ScheduleEntry::getWorkerId)
                .collect(Collectors.toList());
        assertThat(firstSlot).containsExactlyElementsOf(
                List.of("W1", "W2", "W3", "W4", "W5").subList(0, headcount));
    }

    @Test
    void pipeline_schedulesFromFirstForecastDateByDefault() {
        PlanningPipeline.Outcome outcome = pipeline.run(history("A", 100, 14), List.of(), lines,
                MixCostParams.defaults(), workers, SchedulingParams.defaults(), "heuristic", "heuristic");

        LocalDate firstForecastDate = outcome.getForecast().getPayload().get("A").get(0).getDate();
        assertThat(firstForecastDate).isEqualTo(START);
        assertThat(outcome.getSchedule().getPayload().get(0).getDate()).isEqualTo(firstForecastDate);
    }

    @Test
    void exactMix_coversEveryWeekOfTheHorizon() {
        PlanningPipeline.Outcome outcome = pipeline.run(history("A", 100, 14), List.of("A"), lines,
                MixCostParams.defaults(), workers, SchedulingParams.startingOn(START), "exact", "heuristic");

        PlanResult<List<MixPlanEntry>, MixKpi> mix = outcome.getMix();
        assertThat(mix.isSuccess()).isTrue();
        assertThat(mix.getStrategy()).isEqualTo("milp_assignment");
        // 30 forecast days give 4 full weeks
        assertThat(mix.getPayload()).extracting(MixPlanEntry::getPeriod).containsOnly(1, 2, 3, 4);
        for (MixPlanEntry entry : mix.getPayload()) {
            assertThat(entry.getPlannedUnits()).isLessThanOrEqualTo(1050);
        }
        assertThat(mix.getKpis().getFulfillmentRate()).isEqualTo(100.0);
        assertThat(mix.getKpis().getChangeovers()).isZero();
        assertThat(outcome.getSchedule()).isNotNull();
    }

    @Test
    void exactMix_reportsInfeasibleCapacityAsEnvelope() {
        Map<String, List<DemandPoint>> demand = Map.of("A", flatDemand("A", 500, 7));

        PlanResult<List<MixPlanEntry>, MixKpi> result = mixPlanningService.runMixOptimization(
                demand, List.of(line("L1", 100, "A")), MixCostParams.defaults(), "exact");

        assertThat(result.getOutcome()).isEqualTo(PlanResult.Outcome.ERROR);
        assertThat(result.getDiagnostic().getCode()).isEqualTo(ErrorCode.INFEASIBLE_MODEL_ERROR);
        assertThat(result.getDiagnostic().getSuggestion()).isNotBlank();
        assertThat(result.getPayload()).isNull();
    }

    @Test
    void exactSchedule_reportsTimeoutWhenBudgetRunsOut() {
        List<MixPlanEntry> plan = new ArrayList<>();
        for (int period = 1; period <= 4; period++) {
            for (String lineId : List.of("L1", "L2", "L3")) {
                plan.add(entry(period, lineId, "A", 900));
            }
        }
        List<Worker> roster = new ArrayList<>();
        for (int i = 0; i < 120; i++) {
            roster.add(worker(String.format("W%03d", i), i % 15, 18 + i % 7, 40, i % 3 == 0));
        }
        SchedulingParams params = SchedulingParams.startingOn(START).toBuilder()
                .solverTimeoutSec(0.0001)
                .build();

        PlanResult<List<ScheduleEntry>, ScheduleKpi> result =
                schedulingService.runSchedule(plan, roster, params, "exact");

        assertThat(result.getOutcome()).isEqualTo(PlanResult.Outcome.ERROR);
        assertThat(result.getStrategy()).isEqualTo("cpsat_schedule");
        assertThat(result.getDiagnostic().getCode()).isEqualTo(ErrorCode.SOLVER_TIMEOUT_ERROR);
        assertThat(result.getDiagnostic().getSuggestion()).contains("time limit");
        assertThat(result.getPayload()).isNull();
    }

    @Test
    void pipeline_stopsAfterFailedMixStage() {
        PlanningPipeline.Outcome outcome = pipeline.run(history("A", 100, 14), List.of(), List.of(),
                MixCostParams.defaults(), workers, SchedulingParams.startingOn(START), "exact", "heuristic");

        assertThat(outcome.getForecast().isSuccess()).isTrue();
        assertThat(outcome.getMix().isSuccess()).isFalse();
        assertThat(outcome.getMix().getDiagnostic().getCode()).isEqualTo(ErrorCode.INFEASIBLE_MODEL_ERROR);
        assertThat(outcome.getSchedule()).isNull();
        assertThat(outcome.isComplete()).isFalse();
    }
}
