package com.linemind.planning.engine;

import com.google.ortools.sat.BoolVar;
import com.google.ortools.sat.CpModel;
import com.google.ortools.sat.CpSolver;
import com.google.ortools.sat.IntVar;
import com.google.ortools.sat.LinearExpr;
import com.google.ortools.sat.LinearExprBuilder;
import com.linemind.planning.config.LineMindProperties;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.ScheduleEntry;
import com.linemind.planning.domain.ScheduleKpi;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Shift;
import com.linemind.planning.domain.Strategy;
import com.linemind.planning.domain.Worker;
import com.linemind.planning.domain.WorkforceSchedule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Shift assignment as a CP-SAT model.
 * <p>
 * x[w][d][s][l] is true when worker w works shift s on day d at line l; it only exists where
 * line l needs staff. Hard rules: one shift per worker per day, weekly hours within the worker's
 * cap, at most 3 nights in any 4 consecutive days, no Day shift right after a Night shift, and
 * every seat filled. The objective (in cents) is wages plus a penalty for night shifts given to
 * workers who do not prefer nights plus a penalty per overtime hour above the soft weekly threshold.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CpSatWorkforceScheduler implements WorkforceScheduler {

    public static final String NAME = "cpsat_schedule";

    static final String INFEASIBLE_MESSAGE = "no schedule satisfies staffing, hour and rest constraints";
    static final String INFEASIBLE_SUGGESTION =
            "add workers, raise maxHoursPerWeek, or relax the night-shift and rest rules";

    private static final int MAX_CONSECUTIVE_NIGHTS = 3;
    private static final int NIGHT_WINDOW_DAYS = MAX_CONSECUTIVE_NIGHTS + 1;
    private static final int DAY = Shift.DAY.ordinal();
    private static final int NIGHT = Shift.NIGHT.ordinal();

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
    public WorkforceSchedule schedule(List<MixPlanEntry> mixPlan, List<Worker> workers, SchedulingParams params) {
        long startTime = System.currentTimeMillis();
        LocalDate start = params.getStartDate();

        // 1. Staffing floor per (day, shift, line)
        List<StaffingSlot> slots = StaffingRequirements.derive(mixPlan, params, start);
        int days = StaffingRequirements.horizonDays(mixPlan);
        List<String> lineIds = new ArrayList<>(new TreeSet<>(
                mixPlan.stream().map(MixPlanEntry::getLineId).collect(Collectors.toList())));
        int nShifts = Shift.values().length;
        int[][][] required = new int[days][nShifts][lineIds.size()];
        for (StaffingSlot slot : slots) {
            int d = (int) ChronoUnit.DAYS.between(start, slot.getDate());
            required[d][slot.getShift().ordinal()][lineIds.indexOf(slot.getLineId())] = slot.getRequired();
        }

        List<Worker> ranked = workers.stream()
                .sorted(GreedySeniorityScheduler.BY_SENIORITY)
                .collect(Collectors.toList());
        int nWorkers = ranked.size();
        int hoursPerShift = params.getHoursPerShift();

        nativeLoader.ensureLoaded();
        CpModel model = new CpModel();

        // 2. Decision variables
        BoolVar[][][][] x = new BoolVar[nWorkers][days][nShifts][lineIds.size()];
        for (int w = 0; w < nWorkers; w++) {
            for (int d = 0; d < days; d++) {
                for (int s = 0; s < nShifts; s++) {
                    for (int l = 0; l < lineIds.size(); l++) {
                        if (required[d][s][l] > 0) {
                            x[w][d][s][l] = model.newBoolVar("x_" + w + "_" + d + "_" + s + "_" + l);
                        }
                    }
                }
            }
        }

        LinearExprBuilder objective = LinearExpr.newBuilder();
        long overtimePenaltyCents = Math.round(params.getOvertimePenaltyPerHour() * 100);
        long nightPenaltyCents = Math.round(params.getNightAversionPenalty() * 100);

        for (int w = 0; w < nWorkers; w++) {
            Worker worker = ranked.get(w);
            long shiftWageCents = Math.round(worker.getWagePerHour() * hoursPerShift * 100);

            // (a) at most one shift per day
            for (int d = 0; d < days; d++) {
                List<BoolVar> daily = new ArrayList<>();
                daily.addAll(shiftVars(x[w][d][DAY]));
                daily.addAll(shiftVars(x[w][d][NIGHT]));
                if (daily.size() > 1) {
                    model.addLessOrEqual(LinearExpr.sum(daily.toArray(new BoolVar[0])), 1);
                }
            }

            // (b) weekly hour cap and soft overtime
            for (int weekStart = 0; weekStart < days; weekStart += StaffingRequirements.DAYS_PER_PERIOD) {
                List<BoolVar> weekly = new ArrayList<>();
                for (int d = weekStart; d < Math.min(days, weekStart + StaffingRequirements.DAYS_PER_PERIOD); d++) {
                    for (int s = 0; s < nShifts; s++) {
                        weekly.addAll(shiftVars(x[w][d][s]));
                    }
                }
                if (weekly.isEmpty()) {
                    continue;
                }
                BoolVar[] weeklyVars = weekly.toArray(new BoolVar[0]);
                model.addLessOrEqual(LinearExpr.sum(weeklyVars), worker.getMaxHoursPerWeek() / hoursPerShift);

                long maxHours = (long) weeklyVars.length * hoursPerShift;
                if (maxHours > params.getOvertimeThresholdHours()) {
                    IntVar overtime = model.newIntVar(0, maxHours, "ot_" + w + "_" + weekStart);
                    LinearExprBuilder hours = LinearExpr.newBuilder();
                    for (BoolVar v : weeklyVars) {
                        hours.addTerm(v, hoursPerShift);
                    }
                    hours.addTerm(overtime, -1);
                    model.addLessOrEqual(hours, params.getOvertimeThresholdHours());
                    objective.addTerm(overtime, overtimePenaltyCents);
                }
            }

            // (c) at most 3 nights in any 4-day window
            for (int d = 0; d + NIGHT_WINDOW_DAYS <= days; d++) {
                List<BoolVar> window = new ArrayList<>();
                for (int k = d; k < d + NIGHT_WINDOW_DAYS; k++) {
                    window.addAll(shiftVars(x[w][k][NIGHT]));
                }
                if (window.size() > MAX_CONSECUTIVE_NIGHTS) {
                    model.addLessOrEqual(LinearExpr.sum(window.toArray(new BoolVar[0])), MAX_CONSECUTIVE_NIGHTS);
                }
            }

            // (d) rest: no Day shift the morning after a Night shift
            for (int d = 0; d + 1 < days; d++) {
                List<BoolVar> pair = new ArrayList<>();
                pair.addAll(shiftVars(x[w][d][NIGHT]));
                pair.addAll(shiftVars(x[w][d + 1][DAY]));
                if (pair.size() > 1) {
                    model.addLessOrEqual(LinearExpr.sum(pair.toArray(new BoolVar[0])), 1);
                }
            }

            // Cost terms
            for (int d = 0; d < days; d++) {
                for (int s = 0; s < nShifts; s++) {
                    long penalty = (s == NIGHT && !worker.isPrefersNight()) ? nightPenaltyCents : 0;
                    for (BoolVar v : shiftVars(x[w][d][s])) {
                        objective.addTerm(v, shiftWageCents + penalty);
                    }
                }
            }
        }

        // (e) staffing floor
        for (int d = 0; d < days; d++) {
            for (int s = 0; s < nShifts; s++) {
                for (int l = 0; l < lineIds.size(); l++) {
                    if (required[d][s][l] == 0) {
                        continue;
                    }
                    BoolVar[] seat = new BoolVar[nWorkers];
                    for (int w = 0; w < nWorkers; w++) {
                        seat[w] = x[w][d][s][l];
                    }
                    model.addGreaterOrEqual(LinearExpr.sum(seat), required[d][s][l]);
                }
            }
        }

        model.minimize(objective.build());

        double timeLimitSec = params.getSolverTimeoutSec() > 0
                ? params.getSolverTimeoutSec()
                : properties.getSchedule().getTimeLimitSeconds();

        log.debug("{}: {} workers x {} days x {} lines, {} staffed slots",
                NAME, nWorkers, days, lineIds.size(), slots.size());

        // 3. Solve, single-threaded with a fixed seed so reruns give the same plan
        CpSolver solver = new CpSolver();
        solver.getParameters()
                .setMaxTimeInSeconds(timeLimitSec)
                .setNumWorkers(properties.getSchedule().getSearchWorkers())
                .setRandomSeed(properties.getSchedule().getRandomSeed());
        SolverStatus status = SolverStatus.fromCpSat(solver.solve(model));

        log.info("{}: solver finished with {} in {} ms", NAME, status, System.currentTimeMillis() - startTime);

        if (!status.hasSolution()) {
            throw status.toFailure(timeLimitSec, INFEASIBLE_MESSAGE, INFEASIBLE_SUGGESTION);
        }

        // 4. Extract
        List<ScheduleEntry> entries = new ArrayList<>();
        for (int d = 0; d < days; d++) {
            LocalDate date = start.plusDays(d);
            for (int l = 0; l < lineIds.size(); l++) {
                for (Shift shift : Shift.values()) {
                    for (int w = 0; w < nWorkers; w++) {
                        BoolVar v = x[w][d][shift.ordinal()][l];
                        if (v != null && solver.booleanValue(v)) {
                            Worker worker = ranked.get(w);
                            entries.add(ScheduleEntry.builder()
                                    .date(date)
                                    .lineId(lineIds.get(l))
                                    .shift(shift)
                                    .workerId(worker.getWorkerId())
                                    .workerName(worker.getName())
                                    .build());
                        }
                    }
                }
            }
        }
        entries.sort(Comparator.comparing(ScheduleEntry::getDate)
                .thenComparing(ScheduleEntry::getLineId)
                .thenComparing(ScheduleEntry::getShift)
                .thenComparing(ScheduleEntry::getWorkerId));

        Map<String, Worker> byId = workers.stream()
                .collect(Collectors.toMap(Worker::getWorkerId, Function.identity()));
        ScheduleKpi kpi = ScheduleKpiCalculator.calculate(entries, byId, slots, params, start);

        return WorkforceSchedule.builder()
                .strategy(NAME)
                .entries(entries)
                .kpi(kpi)
                .objectiveValue(solver.objectiveValue() / 100.0)
                .build();
    }

    private static List<BoolVar> shiftVars(BoolVar[] byLine) {
        List<BoolVar> vars = new ArrayList<>();
        for (BoolVar v : byLine) {
            if (v != null) {
                vars.add(v);
            }
        }
        return vars;
    }
}
