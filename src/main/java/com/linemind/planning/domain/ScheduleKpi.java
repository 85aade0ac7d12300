package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ScheduleKpi {
    double totalCost;
    int totalOvertimeHours;
    double nightBiasIndex; // night shifts / all shifts
    double fulfillmentRate; // percent of required seats filled
    int requiredShifts;
    int assignedShifts;
}
