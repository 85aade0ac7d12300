package com.linemind.planning.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SchedulingParams {

    // First date of period 1; null means today
    private LocalDate startDate;

    private int hoursPerShift;

    // One worker handles this many units per shift
    private int unitsPerWorkerShift;

    // Soft weekly threshold above which overtime is penalized
    private int overtimeThresholdHours;

    // Penalties (currency units in the objective)
    private double overtimePenaltyPerHour;
    private double nightAversionPenalty;

    // 0 means "use the configured limit"
    private double solverTimeoutSec;

    public static SchedulingParams defaults() {
        return SchedulingParams.builder()
                .hoursPerShift(8)
                .unitsPerWorkerShift(100)
                .overtimeThresholdHours(40)
                .overtimePenaltyPerHour(15.0)
                .nightAversionPenalty(50.0)
                .build();
    }

    public static SchedulingParams startingOn(LocalDate startDate) {
        return defaults().toBuilder().startDate(startDate).build();
    }
}
