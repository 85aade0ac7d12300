package com.linemind.planning.engine;

import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Shift;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a mix plan into per-date, per-line, per-shift headcount.
 * <p>
 * A plan entry for period p covers the seven dates starting at {@code start + (p - 1) * 7}.
 * Each of those dates needs {@code ceil(plannedUnits / unitsPerWorkerShift)} workers on the
 * Day shift and the same number on the Night shift. Entries sharing a line and period are summed first.
 */
public final class StaffingRequirements {

    static final int DAYS_PER_PERIOD = 7;

    private static final Comparator<StaffingSlot> CHRONOLOGICAL = Comparator
            .comparing(StaffingSlot::getDate)
            .thenComparing(StaffingSlot::getLineId)
            .thenComparing(StaffingSlot::getShift);

    private StaffingRequirements() {
    }

    public static List<StaffingSlot> derive(List<MixPlanEntry> mixPlan, SchedulingParams params, LocalDate start) {
        // period -> lineId -> units
        Map<Integer, Map<String, Integer>> unitsByPeriod = new TreeMap<>();
        for (MixPlanEntry entry : mixPlan) {
            unitsByPeriod.computeIfAbsent(entry.getPeriod(), p -> new TreeMap<>())
                    .merge(entry.getLineId(), entry.getPlannedUnits(), Integer::sum);
        }

        List<StaffingSlot> slots = new ArrayList<>();
        unitsByPeriod.forEach((period, unitsByLine) -> unitsByLine.forEach((lineId, units) -> {
            int headcount = ceilDiv(units, params.getUnitsPerWorkerShift());
            if (headcount == 0) {
                return;
            }
            LocalDate periodStart = start.plusDays((long) (period - 1) * DAYS_PER_PERIOD);
            for (int day = 0; day < DAYS_PER_PERIOD; day++) {
                for (Shift shift : Shift.values()) {
                    slots.add(StaffingSlot.builder()
                            .date(periodStart.plusDays(day))
                            .lineId(lineId)
                            .shift(shift)
                            .required(headcount)
                            .build());
                }
            }
        }));
        slots.sort(CHRONOLOGICAL);
        return slots;
    }

    /**
     * Number of days the plan spans, a whole number of periods.
     */
    public static int horizonDays(List<MixPlanEntry> mixPlan) {
        int lastPeriod = mixPlan.stream().mapToInt(MixPlanEntry::getPeriod).max().orElse(0);
        return lastPeriod * DAYS_PER_PERIOD;
    }

    static int ceilDiv(int units, int perWorker) {
        return units <= 0 ? 0 : (units + perWorker - 1) / perWorker;
    }
}
