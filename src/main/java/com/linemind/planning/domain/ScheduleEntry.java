package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class ScheduleEntry {
    LocalDate date;
    String lineId;
    Shift shift;
    String workerId;
    String workerName;
}
