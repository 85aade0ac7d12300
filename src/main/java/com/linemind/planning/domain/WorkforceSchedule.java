package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class WorkforceSchedule {
    String strategy;
    List<ScheduleEntry> entries;
    ScheduleKpi kpi;
    double objectiveValue;
}
