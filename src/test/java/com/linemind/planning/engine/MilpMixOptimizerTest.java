package com.linemind.planning.engine;

import com.linemind.planning.PlanningFixtures;
import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.ErrorCode;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixPlan;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.exception.DataShapeException;
import com.linemind.planning.exception.InfeasibleModelException;
import com.linemind.planning.exception.PlanningException;
import com.linemind.planning.exception.SolverUnavailableException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import static com.linemind.planning.PlanningFixtures.allPairs;
import static com.linemind.planning.PlanningFixtures.flatDemand;
import static com.linemind.planning.PlanningFixtures.line;
import static com.linemind.planning.PlanningFixtures.weeklyDemand;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;

class MilpMixOptimizerTest {

    private final MilpMixOptimizer optimizer =
            new MilpMixOptimizer(new OrToolsNativeLoader(), PlanningFixtures.properties());

    @Test
    void optimize_respectsEligibilitySingleProductAndDemand() {
        Map<String, List<DemandPoint>> demand = new TreeMap<>();
        demand.put("A", flatDemand("A", 80, 14));
        demand.put("B", flatDemand("B", 90, 14));
        List<Line> lines = List.of(
                line("L1", 100, "A", "B"),
                line("L2", 100, "B"),
                line("L3", 50, "A"));
        MixCostParams params = MixCostParams.withChangeovers(allPairs(2.0, 5000, "A", "B"));

        MixPlan plan = optimizer.optimize(demand, lines, params);

        assertThat(plan.getStrategy()).isEqualTo(MilpMixOptimizer.NAME);
        Map<String, Line> byId = new HashMap<>();
        lines.forEach(l -> byId.put(l.getLineId(), l));
        Map<String, String> productPerLineWeek = new HashMap<>();
        Map<String, Integer> coverage = new HashMap<>();
        for (MixPlanEntry e : plan.getEntries()) {
            assertThat(byId.get(e.getLineId()).canProduce(e.getProduct())).isTrue();
            assertThat(e.getPlannedUnits()).isLessThanOrEqualTo(byId.get(e.getLineId()).weeklyCapacity());
            String previous = productPerLineWeek.put(e.getLineId() + "#" + e.getPeriod(), e.getProduct());
            assertThat(previous).isNull();
            coverage.merge(e.getProduct() + "#" + e.getPeriod(), e.getPlannedUnits(), Integer::sum);
        }
        for (int week = 1; week <= 2; week++) {
            assertThat(coverage.get("A#" + week)).isGreaterThanOrEqualTo(560);
            assertThat(coverage.get("B#" + week)).isGreaterThanOrEqualTo(630);
        }
        assertThat(plan.getKpi().getFulfillmentRate()).isEqualTo(100.0);
        assertThat(plan.getKpi().getChangeovers()).isZero();
    }

    @Test
    void optimize_countsForcedChangeover() {
        Map<String, List<DemandPoint>> demand = new TreeMap<>();
        demand.put("A", weeklyDemand("A", 100, 0));
        demand.put("B", weeklyDemand("B", 0, 100));
        MixCostParams params = MixCostParams.withChangeovers(allPairs(2.0, 5000, "A", "B"))
                .toBuilder().planningWeeks(2).build();

        MixPlan plan = optimizer.optimize(demand, List.of(line("L1", 100, "A", "B")), params);

        assertThat(plan.getEntries()).extracting(MixPlanEntry::getProduct).containsExactly("A", "B");
        assertThat(plan.getEntries()).extracting(MixPlanEntry::getPeriod).containsExactly(1, 2);
        assertThat(plan.getKpi().getChangeovers()).isEqualTo(1);
        assertThat(plan.getKpi().getChangeoverHours()).isEqualTo(2.0);
        assertThat(plan.getKpi().getTotalCost()).isCloseTo(1400 * MixCostParams.DEFAULT_UNIT_COST + 5000, within(1e-6));
    }

    @Test
    void optimize_chargesChangeoverAcrossIdleWeek() {
        Map<String, List<DemandPoint>> demand = new TreeMap<>();
        demand.put("A", weeklyDemand("A", 100, 0, 0));
        demand.put("B", weeklyDemand("B", 0, 0, 100));
        MixCostParams params = MixCostParams.withChangeovers(allPairs(2.0, 5000, "A", "B"))
                .toBuilder().planningWeeks(3).build();

        MixPlan plan = optimizer.optimize(demand, List.of(line("L1", 100, "A", "B")), params);

        assertThat(plan.getEntries()).extracting(MixPlanEntry::getPeriod).containsExactly(1, 3);
        assertThat(plan.getKpi().getChangeovers()).isEqualTo(1);
        assertThat(plan.getKpi().getChangeoverHours()).isEqualTo(2.0);
        assertThat(plan.getKpi().getTotalCost()).isCloseTo(1400 * MixCostParams.DEFAULT_UNIT_COST + 5000, within(1e-6));
        // the solver pays the switch too, tie-break terms stay below one unit
        assertThat(plan.getObjectiveValue()).isCloseTo(1400 * MixCostParams.DEFAULT_UNIT_COST + 5000, within(1.0));
    }

    @Test
    void optimize_prefersLowerLineIdAmongEqualCostPlans() {
        Map<String, List<DemandPoint>> demand = Map.of("A", flatDemand("A", 50, 7));
        List<Line> lines = List.of(line("L2", 100, "A"), line("L1", 100, "A"));

        MixCostParams params = MixCostParams.defaults().toBuilder().unitCost(1.0).build();

        MixPlan plan = optimizer.optimize(demand, lines, params);

        assertThat(plan.getEntries()).extracting(MixPlanEntry::getLineId).containsExactly("L1");
        assertThat(plan.getEntries().get(0).getPlannedUnits()).isEqualTo(350);
    }

    @Test
    void optimize_reportsInfeasibleWhenCapacityIsShort() {
        Map<String, List<DemandPoint>> demand = Map.of("A", flatDemand("A", 500, 7));

        assertThatThrownBy(() -> optimizer.optimize(demand, List.of(line("L1", 100, "A")), MixCostParams.defaults()))
                .isInstanceOf(InfeasibleModelException.class)
                .satisfies(e -> assertThat(((PlanningException) e).getSuggestion()).isNotBlank());
    }

    @Test
    void optimize_reportsInfeasibleWhenProductHasNoLine() {
        Map<String, List<DemandPoint>> demand = Map.of("Z", flatDemand("Z", 10, 7));

        assertThatThrownBy(() -> optimizer.optimize(demand, List.of(line("L1", 100, "A")), MixCostParams.defaults()))
                .isInstanceOf(InfeasibleModelException.class)
                .hasMessageContaining("Z");
    }

    @Test
    void optimize_rejectsMissingChangeoverRow() {
        Map<String, List<DemandPoint>> demand = new TreeMap<>();
        demand.put("A", flatDemand("A", 10, 14));
        demand.put("B", flatDemand("B", 10, 14));

        assertThatThrownBy(() -> optimizer.optimize(demand, List.of(line("L1", 100, "A", "B")), MixCostParams.defaults()))
                .isInstanceOf(DataShapeException.class)
                .hasMessageContaining("changeover");
    }

    @Test
    void optimize_rejectsSeriesShorterThanOneWeek() {
        Map<String, List<DemandPoint>> demand = Map.of("A", flatDemand("A", 10, 5));

        assertThatThrownBy(() -> optimizer.optimize(demand, List.of(line("L1", 100, "A")), MixCostParams.defaults()))
                .isInstanceOf(DataShapeException.class);
    }

    @Test
    void optimize_reportsUnavailableWhenNativeLibrariesFail() {
        OrToolsNativeLoader loader = mock(OrToolsNativeLoader.class);
        doThrow(new SolverUnavailableException("no natives")).when(loader).ensureLoaded();
        MilpMixOptimizer broken = new MilpMixOptimizer(loader, PlanningFixtures.properties());

        assertThatThrownBy(() -> broken.optimize(Map.of("A", flatDemand("A", 10, 7)),
                List.of(line("L1", 100, "A")), MixCostParams.defaults()))
                .isInstanceOf(SolverUnavailableException.class)
                .satisfies(e -> assertThat(((PlanningException) e).getErrorCode())
                        .isEqualTo(ErrorCode.SOLVER_UNAVAILABLE_ERROR));
    }
}
