package com.linemind.planning.engine;

import com.linemind.planning.domain.ScheduleEntry;
import com.linemind.planning.domain.ScheduleKpi;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Shift;
import com.linemind.planning.domain.Worker;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * KPIs shared by both scheduling strategies. Weeks are counted in 7-day blocks from the plan start.
 */
public final class ScheduleKpiCalculator {

    private ScheduleKpiCalculator() {
    }

    public static ScheduleKpi calculate(List<ScheduleEntry> entries, Map<String, Worker> workersById,
                                        List<StaffingSlot> slots, SchedulingParams params, LocalDate start) {
        int hoursPerShift = params.getHoursPerShift();

        double totalCost = 0;
        int nightShifts = 0;
        Map<String, Integer> shiftsPerWorkerWeek = new HashMap<>();
        Map<String, Integer> assignedPerSlot = new HashMap<>();

        for (ScheduleEntry entry : entries) {
            Worker worker = workersById.get(entry.getWorkerId());
            if (worker != null) {
                totalCost += worker.getWagePerHour() * hoursPerShift;
            }
            if (entry.getShift() == Shift.NIGHT) {
                nightShifts++;
            }
            long week = ChronoUnit.DAYS.between(start, entry.getDate()) / StaffingRequirements.DAYS_PER_PERIOD;
            shiftsPerWorkerWeek.merge(entry.getWorkerId() + "#" + week, 1, Integer::sum);
            assignedPerSlot.merge(slotKey(entry.getDate(), entry.getLineId(), entry.getShift()), 1, Integer::sum);
        }

        int overtimeHours = 0;
        for (int shifts : shiftsPerWorkerWeek.values()) {
            overtimeHours += Math.max(0, shifts * hoursPerShift - params.getOvertimeThresholdHours());
        }

        int required = 0;
        int filled = 0;
        for (StaffingSlot slot : slots) {
            required += slot.getRequired();
            int assigned = assignedPerSlot.getOrDefault(slotKey(slot.getDate(), slot.getLineId(), slot.getShift()), 0);
            filled += Math.min(assigned, slot.getRequired());
        }

        double nightBias = entries.isEmpty() ? 0.0 : (double) nightShifts / entries.size();
        double fulfillment = required == 0 ? 100.0 : filled * 100.0 / required;

        return ScheduleKpi.builder()
                .totalCost(MixKpiCalculator.round(totalCost, 2))
                .totalOvertimeHours(overtimeHours)
                .nightBiasIndex(MixKpiCalculator.round(nightBias, 3))
                .fulfillmentRate(MixKpiCalculator.round(fulfillment, 1))
                .requiredShifts(required)
                .assignedShifts(entries.size())
                .build();
    }

    private static String slotKey(LocalDate date, String lineId, Shift shift) {
        return date + "|" + lineId + "|" + shift;
    }
}
