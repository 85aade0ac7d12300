package com.linemind.planning.engine;

import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Strategy;
import com.linemind.planning.domain.Worker;
import com.linemind.planning.domain.WorkforceSchedule;

import java.util.List;

/**
 * Staffs the lines of a mix plan. {@code params.getStartDate()} must be set by the caller.
 */
public interface WorkforceScheduler {

    String name();

    Strategy strategy();

    WorkforceSchedule schedule(List<MixPlanEntry> mixPlan, List<Worker> workers, SchedulingParams params);
}
