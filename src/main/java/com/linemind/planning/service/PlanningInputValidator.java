package com.linemind.planning.service;

import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.ProductionRecord;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Worker;
import com.linemind.planning.exception.DataShapeException;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Shape checks run at the service boundary, before any model is built.
 */
@Component
public class PlanningInputValidator {

    public void validateHistory(List<ProductionRecord> history) {
        if (history == null) {
            return;
        }
        for (int i = 0; i < history.size(); i++) {
            ProductionRecord row = history.get(i);
            if (row == null) {
                throw new DataShapeException("history row #" + i + " is null");
            }
            if (row.getDate() == null) {
                throw new DataShapeException("history row #" + i + " has no date");
            }
            if (isBlank(row.getProduct())) {
                throw new DataShapeException("history row #" + i + " has no product");
            }
            if (row.getProducedUnits() < 0) {
                throw new DataShapeException("history row #" + i + " has negative producedUnits");
            }
        }
    }

    public void validateDemand(Map<String, List<DemandPoint>> demand) {
        if (demand == null) {
            throw new DataShapeException("demand is missing");
        }
        demand.forEach((product, series) -> {
            if (isBlank(product)) {
                throw new DataShapeException("demand contains a blank product key");
            }
            if (series == null) {
                throw new DataShapeException("demand series for " + product + " is missing");
            }
            for (DemandPoint point : series) {
                if (point == null) {
                    throw new DataShapeException("demand series for " + product + " contains a null point");
                }
                if (point.getForecastUnits() < 0) {
                    throw new DataShapeException("demand series for " + product + " has negative units on "
                            + point.getDate());
                }
            }
        });
    }

    public void validateLines(List<Line> lines) {
        if (lines == null) {
            throw new DataShapeException("line list is missing");
        }
        Set<String> seen = new HashSet<>();
        for (Line line : lines) {
            if (line == null || isBlank(line.getLineId())) {
                throw new DataShapeException("line without lineId");
            }
            if (!seen.add(line.getLineId())) {
                throw new DataShapeException("duplicate lineId " + line.getLineId());
            }
            if (line.getDailyCapacity() <= 0) {
                throw new DataShapeException("line " + line.getLineId() + " has no positive dailyCapacity");
            }
            if (line.getEligibleProducts() == null) {
                throw new DataShapeException("line " + line.getLineId() + " has no eligibleProducts");
            }
        }
    }

    public void validateCostParams(MixCostParams params) {
        if (params.getUnitCost() < 0) {
            throw new DataShapeException("unitCost must not be negative");
        }
        if (params.getChangeoverCosts() == null) {
            return;
        }
        params.getChangeoverCosts().forEach(row -> {
            if (row == null || isBlank(row.getFromProduct()) || isBlank(row.getToProduct())) {
                throw new DataShapeException("changeover row without fromProduct/toProduct");
            }
            if (row.getCost() < 0 || row.getHours() < 0) {
                throw new DataShapeException("changeover " + row.getFromProduct() + " -> " + row.getToProduct()
                        + " has negative cost or hours");
            }
        });
    }

    public void validateMixPlan(List<MixPlanEntry> mixPlan) {
        if (mixPlan == null) {
            throw new DataShapeException("mix plan is missing");
        }
        for (int i = 0; i < mixPlan.size(); i++) {
            MixPlanEntry entry = mixPlan.get(i);
            if (entry == null) {
                throw new DataShapeException("mix plan entry #" + i + " is null");
            }
            if (isBlank(entry.getLineId())) {
                throw new DataShapeException("mix plan entry #" + i + " has no lineId");
            }
            if (isBlank(entry.getProduct())) {
                throw new DataShapeException("mix plan entry #" + i + " has no product");
            }
            if (entry.getPeriod() < 1) {
                throw new DataShapeException("mix plan entry #" + i + " has period " + entry.getPeriod()
                        + ", periods start at 1");
            }
            if (entry.getPlannedUnits() < 0) {
                throw new DataShapeException("mix plan entry #" + i + " has negative plannedUnits");
            }
        }
    }

    public void validateWorkers(List<Worker> workers) {
        if (workers == null) {
            throw new DataShapeException("worker roster is missing");
        }
        Set<String> seen = new HashSet<>();
        for (Worker worker : workers) {
            if (worker == null || isBlank(worker.getWorkerId())) {
                throw new DataShapeException("worker without workerId");
            }
            if (!seen.add(worker.getWorkerId())) {
                throw new DataShapeException("duplicate workerId " + worker.getWorkerId());
            }
            if (worker.getMaxHoursPerWeek() < 0 || worker.getWagePerHour() < 0) {
                throw new DataShapeException("worker " + worker.getWorkerId()
                        + " has negative maxHoursPerWeek or wagePerHour");
            }
        }
    }

    public void validateSchedulingParams(SchedulingParams params) {
        if (params.getHoursPerShift() <= 0) {
            throw new DataShapeException("hoursPerShift must be positive");
        }
        if (params.getUnitsPerWorkerShift() <= 0) {
            throw new DataShapeException("unitsPerWorkerShift must be positive");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
