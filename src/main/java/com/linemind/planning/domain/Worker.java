package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class Worker {
    String workerId;
    String name;
    int seniorityYears;
    double wagePerHour;
    int maxHoursPerWeek;
    boolean prefersNight;
}
