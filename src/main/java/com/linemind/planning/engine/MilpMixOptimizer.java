package com.linemind.planning.engine;

import com.google.ortools.linearsolver.MPConstraint;
import com.google.ortools.linearsolver.MPObjective;
import com.google.ortools.linearsolver.MPSolver;
import com.google.ortools.linearsolver.MPSolverParameters;
import com.google.ortools.linearsolver.MPVariable;
import com.linemind.planning.config.LineMindProperties;
import com.linemind.planning.domain.ChangeoverCost;
import com.linemind.planning.domain.ChangeoverTable;
import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixKpi;
import com.linemind.planning.domain.MixPlan;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.Strategy;
import com.linemind.planning.exception.DataShapeException;
import com.linemind.planning.exception.InfeasibleModelException;
import com.linemind.planning.exception.SolverUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Weekly production-mix MILP solved with SCIP.
 * <p>
 * Q[l][p][w] is the integer quantity line l makes of product p in week w, Y[l][p][w] says whether
 * l runs p that week. Both exist only for eligible (l, p) pairs. A line runs at most one product per
 * week, Q is bounded by Y times weekly capacity, and every product's weekly demand must be covered.
 * The objective is production cost plus changeover cost. Z[l][p][w] tracks the last product l ran
 * up to week w, so C[l][p][q][w] is forced to 1 when l starts q in week w after last running p,
 * even with idle weeks in between.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MilpMixOptimizer implements MixOptimizer {

    public static final String NAME = "milp_assignment";

    static final String INFEASIBLE_MESSAGE = "no feasible assignment";
    static final String INFEASIBLE_SUGGESTION = "relax capacity or eligibility constraints";

    private static final int DAYS_PER_WEEK = 7;

    // Per line-index cost on Y that makes lower line ids win among equal-cost plans
    private static final double TIE_BREAK_WEIGHT = 1e-3;

    private final OrToolsNativeLoader nativeLoader;
    private final LineMindProperties properties;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Strategy strategy() {
        return Strategy.EXACT;
    }

    @Override
    public MixPlan optimize(Map<String, List<DemandPoint>> demand, List<Line> lines, MixCostParams params) {
        long startTime = System.currentTimeMillis();

        // 1. Weekly demand matrix
        int weeks = planningWeeks(demand, params);
        List<String> allProducts = new ArrayList<>(new TreeSet<>(demand.keySet()));
        int totalDemand = 0;
        List<String> products = new ArrayList<>();
        List<int[]> demandRows = new ArrayList<>();
        for (String product : allProducts) {
            int[] row = weeklyDemand(demand.get(product), weeks);
            int sum = 0;
            for (int units : row) {
                sum += units;
            }
            totalDemand += sum;
            // Products without demand never need a line
            if (sum > 0) {
                products.add(product);
                demandRows.add(row);
            }
        }

        List<Line> sortedLines = lines.stream()
                .sorted(Comparator.comparing(Line::getLineId))
                .collect(Collectors.toList());

        // 2. Pre-checks that do not need the solver
        for (String product : products) {
            boolean producible = sortedLines.stream().anyMatch(line -> line.canProduce(product));
            if (!producible) {
                log.warn("{}: product {} has demand but no eligible line", NAME, product);
                throw new InfeasibleModelException(INFEASIBLE_MESSAGE + ": no line can produce " + product,
                        INFEASIBLE_SUGGESTION);
            }
        }
        ChangeoverTable changeovers = new ChangeoverTable(params.getChangeoverCosts());
        if (weeks > 1) {
            requireChangeoverCosts(sortedLines, products, changeovers);
        }

        // 3. Initialize Solver
        nativeLoader.ensureLoaded();
        MPSolver solver = MPSolver.createSolver("SCIP");
        if (solver == null) {
            log.error("Could not create solver SCIP");
            throw new SolverUnavailableException("Could not create solver SCIP");
        }

        double timeLimitSec = params.getSolverTimeoutSec() > 0
                ? params.getSolverTimeoutSec()
                : properties.getMix().getTimeLimitSeconds();

        try {
            solver.setTimeLimit((long) (timeLimitSec * 1000));

            int nLines = sortedLines.size();
            int nProducts = products.size();

            // 4. Define Variables
            MPVariable[][][] q = new MPVariable[nLines][nProducts][weeks];
            MPVariable[][][] y = new MPVariable[nLines][nProducts][weeks];

            for (int l = 0; l < nLines; l++) {
                Line line = sortedLines.get(l);
                for (int p = 0; p < nProducts; p++) {
                    if (!line.canProduce(products.get(p))) {
                        continue; // Y stays 0
                    }
                    for (int w = 0; w < weeks; w++) {
                        String suffix = line.getLineId() + "_" + products.get(p) + "_" + w;
                        q[l][p][w] = solver.makeIntVar(0.0, line.weeklyCapacity(), "q_" + suffix);
                        y[l][p][w] = solver.makeIntVar(0.0, 1.0, "y_" + suffix);
                    }
                }
            }

            // 5. Constraints

            // C1. At most one product per line per week
            for (int l = 0; l < nLines; l++) {
                for (int w = 0; w < weeks; w++) {
                    MPConstraint single = solver.makeConstraint(0.0, 1.0, "single_" + l + "_" + w);
                    for (int p = 0; p < nProducts; p++) {
                        if (y[l][p][w] != null) {
                            single.setCoefficient(y[l][p][w], 1.0);
                        }
                    }
                }
            }

            // C2. Capacity link: Q - cap * Y <= 0
            for (int l = 0; l < nLines; l++) {
                double capacity = sortedLines.get(l).weeklyCapacity();
                for (int p = 0; p < nProducts; p++) {
                    for (int w = 0; w < weeks; w++) {
                        if (q[l][p][w] == null) {
                            continue;
                        }
                        MPConstraint link = solver.makeConstraint(-MPSolver.infinity(), 0.0,
                                "link_" + l + "_" + p + "_" + w);
                        link.setCoefficient(q[l][p][w], 1.0);
                        link.setCoefficient(y[l][p][w], -capacity);
                    }
                }
            }

            // C3. Demand coverage: Sum_l Q >= demand
            for (int p = 0; p < nProducts; p++) {
                for (int w = 0; w < weeks; w++) {
                    MPConstraint cover = solver.makeConstraint(demandRows.get(p)[w], MPSolver.infinity(),
                            "demand_" + p + "_" + w);
                    for (int l = 0; l < nLines; l++) {
                        if (q[l][p][w] != null) {
                            cover.setCoefficient(q[l][p][w], 1.0);
                        }
                    }
                }
            }

            // 6. Objective
            MPObjective objective = solver.objective();

            // 6.1 Production cost + tie-break
            for (int l = 0; l < nLines; l++) {
                for (int p = 0; p < nProducts; p++) {
                    for (int w = 0; w < weeks; w++) {
                        if (q[l][p][w] == null) {
                            continue;
                        }
                        objective.setCoefficient(q[l][p][w], params.getUnitCost());
                        objective.setCoefficient(y[l][p][w], TIE_BREAK_WEIGHT * (l + 1));
                    }
                }
            }

            // 6.2 Last product run per line: Z[l][p][w] is 1 when p is the most recent product
            // l ran up to week w, carried through idle weeks
            MPVariable[][][] z = new MPVariable[nLines][nProducts][weeks];
            for (int l = 0; l < nLines; l++) {
                for (int w = 0; w < weeks; w++) {
                    MPConstraint last = solver.makeConstraint(0.0, 1.0, "last_" + l + "_" + w);
                    for (int p = 0; p < nProducts; p++) {
                        if (y[l][p][w] == null) {
                            continue;
                        }
                        z[l][p][w] = solver.makeIntVar(0.0, 1.0, "z_" + l + "_" + p + "_" + w);
                        last.setCoefficient(z[l][p][w], 1.0);

                        // Z >= Y
                        MPConstraint runs = solver.makeConstraint(0.0, MPSolver.infinity(),
                                "runs_" + l + "_" + p + "_" + w);
                        runs.setCoefficient(z[l][p][w], 1.0);
                        runs.setCoefficient(y[l][p][w], -1.0);

                        // Z[w] >= Z[w-1] - Sum_r Y[r][w]
                        if (w > 0) {
                            MPConstraint carry = solver.makeConstraint(0.0, MPSolver.infinity(),
                                    "carry_" + l + "_" + p + "_" + w);
                            carry.setCoefficient(z[l][p][w], 1.0);
                            carry.setCoefficient(z[l][p][w - 1], -1.0);
                            for (int r = 0; r < nProducts; r++) {
                                if (y[l][r][w] != null) {
                                    carry.setCoefficient(y[l][r][w], 1.0);
                                }
                            }
                        }
                    }
                }
            }

            // 6.3 Changeovers: C - Z[p][w-1] - Y[r][w] >= -1
            int changeoverVars = 0;
            for (int l = 0; l < nLines; l++) {
                for (int p = 0; p < nProducts; p++) {
                    for (int r = 0; r < nProducts; r++) {
                        if (p == r || y[l][p][0] == null || y[l][r][0] == null) {
                            continue;
                        }
                        double cost = changeovers.find(products.get(p), products.get(r))
                                .map(ChangeoverCost::getCost)
                                .orElse(0.0);
                        for (int w = 1; w < weeks; w++) {
                            MPVariable c = solver.makeNumVar(0.0, 1.0, "c_" + l + "_" + p + "_" + r + "_" + w);
                            MPConstraint switchCt = solver.makeConstraint(-1.0, MPSolver.infinity(),
                                    "switch_" + l + "_" + p + "_" + r + "_" + w);
                            switchCt.setCoefficient(c, 1.0);
                            switchCt.setCoefficient(z[l][p][w - 1], -1.0);
                            switchCt.setCoefficient(y[l][r][w], -1.0);
                            objective.setCoefficient(c, cost);
                            changeoverVars++;
                        }
                    }
                }
            }

            objective.setMinimization();

            log.debug("{}: {} lines x {} products x {} weeks, {} variables, {} constraints ({} changeover)",
                    NAME, nLines, nProducts, weeks, solver.numVariables(), solver.numConstraints(), changeoverVars);

            // 7. Solve
            MPSolverParameters solveParams = new MPSolverParameters();
            solveParams.setDoubleParam(MPSolverParameters.DoubleParam.RELATIVE_MIP_GAP, 0.0);
            SolverStatus status = SolverStatus.fromLinearSolver(solver.solve(solveParams));

            log.info("{}: solver finished with {} in {} ms", NAME, status, System.currentTimeMillis() - startTime);

            if (!status.hasSolution()) {
                throw status.toFailure(timeLimitSec, INFEASIBLE_MESSAGE, INFEASIBLE_SUGGESTION);
            }

            // 8. Build result
            List<MixPlanEntry> entries = new ArrayList<>();
            for (int w = 0; w < weeks; w++) {
                for (int l = 0; l < nLines; l++) {
                    Line line = sortedLines.get(l);
                    for (int p = 0; p < nProducts; p++) {
                        if (y[l][p][w] == null || y[l][p][w].solutionValue() < 0.5) {
                            continue;
                        }
                        int units = (int) Math.round(q[l][p][w].solutionValue());
                        if (units <= 0) {
                            continue;
                        }
                        entries.add(MixPlanEntry.builder()
                                .period(w + 1)
                                .lineId(line.getLineId())
                                .product(products.get(p))
                                .plannedUnits(units)
                                .utilization(MixKpiCalculator.round((double) units / line.weeklyCapacity(), 2))
                                .build());
                    }
                }
            }

            MixKpi kpi = MixKpiCalculator.calculate(entries, totalDemand, params.getUnitCost(), changeovers);
            return MixPlan.builder()
                    .strategy(NAME)
                    .entries(entries)
                    .kpi(kpi)
                    .objectiveValue(objective.value())
                    .build();
        } finally {
            solver.delete();
        }
    }

    private static int planningWeeks(Map<String, List<DemandPoint>> demand, MixCostParams params) {
        int requested = params.getPlanningWeeks() > 0 ? params.getPlanningWeeks() : MixCostParams.DEFAULT_PLANNING_WEEKS;
        int shortestSeries = demand.values().stream().mapToInt(List::size).min().orElse(DAYS_PER_WEEK);
        int available = shortestSeries / DAYS_PER_WEEK;
        if (available == 0) {
            throw new DataShapeException("exact mix planning needs at least " + DAYS_PER_WEEK
                    + " forecast days per product, shortest series has " + shortestSeries);
        }
        return Math.min(requested, available);
    }

    private static int[] weeklyDemand(List<DemandPoint> series, int weeks) {
        int[] row = new int[weeks];
        for (int day = 0; day < weeks * DAYS_PER_WEEK; day++) {
            row[day / DAYS_PER_WEEK] += series.get(day).getForecastUnits();
        }
        return row;
    }

    /**
     * Every ordered pair of distinct products a line could switch between must have a cost row.
     */
    private static void requireChangeoverCosts(List<Line> lines, List<String> products, ChangeoverTable table) {
        for (Line line : lines) {
            List<String> eligible = products.stream().filter(line::canProduce).collect(Collectors.toList());
            for (String from : eligible) {
                for (String to : eligible) {
                    if (!from.equals(to) && !table.contains(from, to)) {
                        throw new DataShapeException("missing changeover cost from " + from + " to " + to
                                + " (line " + line.getLineId() + ")");
                    }
                }
            }
        }
    }
}
