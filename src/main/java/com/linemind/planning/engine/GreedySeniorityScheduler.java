package com.linemind.planning.engine;

import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.ScheduleEntry;
import com.linemind.planning.domain.ScheduleKpi;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Strategy;
import com.linemind.planning.domain.Worker;
import com.linemind.planning.domain.WorkforceSchedule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fills seats in chronological order from a seniority-ranked roster with a round-robin cursor.
 * A worker is skipped on a date they already work; a seat nobody can take stays empty.
 */
@Slf4j
@Component
public class GreedySeniorityScheduler implements WorkforceScheduler {

    public static final String NAME = "greedy_seniority";

    static final Comparator<Worker> BY_SENIORITY = Comparator
            .comparingInt(Worker::getSeniorityYears).reversed()
            .thenComparing(Worker::getWorkerId);

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Strategy strategy() {
        return Strategy.HEURISTIC;
    }

    @Override
    public WorkforceSchedule schedule(List<MixPlanEntry> mixPlan, List<Worker> workers, SchedulingParams params) {
        LocalDate start = params.getStartDate();

        // 1. Required headcount per slot
        List<StaffingSlot> slots = StaffingRequirements.derive(mixPlan, params, start);

        // 2. Most senior first
        List<Worker> ranked = workers.stream().sorted(BY_SENIORITY).collect(Collectors.toList());

        // 3. Round-robin over slots
        List<ScheduleEntry> entries = new ArrayList<>();
        Map<LocalDate, Set<String>> busy = new HashMap<>();
        int cursor = 0;
        int unfilled = 0;

        for (StaffingSlot slot : slots) {
            Set<String> taken = busy.computeIfAbsent(slot.getDate(), d -> new HashSet<>());
            for (int seat = 0; seat < slot.getRequired(); seat++) {
                Worker chosen = null;
                for (int k = 0; k < ranked.size(); k++) {
                    Worker candidate = ranked.get((cursor + k) % ranked.size());
                    if (!taken.contains(candidate.getWorkerId())) {
                        chosen = candidate;
                        cursor = (cursor + k + 1) % ranked.size();
                        break;
                    }
                }
                if (chosen == null) {
                    unfilled += slot.getRequired() - seat;
                    break;
                }
                taken.add(chosen.getWorkerId());
                entries.add(ScheduleEntry.builder()
                        .date(slot.getDate())
                        .lineId(slot.getLineId())
                        .shift(slot.getShift())
                        .workerId(chosen.getWorkerId())
                        .workerName(chosen.getName())
                        .build());
            }
        }

        if (unfilled > 0) {
            log.info("{}: {} seats left unfilled, roster of {} is too small", NAME, unfilled, ranked.size());
        }

        Map<String, Worker> byId = workers.stream()
                .collect(Collectors.toMap(Worker::getWorkerId, Function.identity()));
        ScheduleKpi kpi = ScheduleKpiCalculator.calculate(entries, byId, slots, params, start);

        return WorkforceSchedule.builder()
                .strategy(NAME)
                .entries(entries)
                .kpi(kpi)
                .objectiveValue(kpi.getTotalCost())
                .build();
    }
}
