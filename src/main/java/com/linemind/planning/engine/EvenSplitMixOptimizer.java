package com.linemind.planning.engine;

import com.linemind.planning.domain.ChangeoverTable;
import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixKpi;
import com.linemind.planning.domain.MixPlan;
import com.linemind.planning.domain.MixPlanEntry;
import com.linemind.planning.domain.Strategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Splits each product's first-week demand evenly over the lines that can make it.
 * Line capacity is shared by all products, so later products may be only partly covered.
 * Never fails: a shortfall shows up as a fulfillment rate below 100.
 */
@Slf4j
@Component
public class EvenSplitMixOptimizer implements MixOptimizer {

    public static final String NAME = "simple_assignment";

    private static final int DAYS_PER_WEEK = 7;

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public Strategy strategy() {
        return Strategy.HEURISTIC;
    }

    @Override
    public MixPlan optimize(Map<String, List<DemandPoint>> demand, List<Line> lines, MixCostParams params) {
        // 1. Weekly demand per product (first 7 forecast days)
        Map<String, Integer> weeklyDemand = new TreeMap<>();
        demand.forEach((product, series) -> weeklyDemand.put(product, series.stream()
                .limit(DAYS_PER_WEEK)
                .mapToInt(DemandPoint::getForecastUnits)
                .sum()));

        // 2. Lines in stable id order, with their remaining weekly capacity
        List<Line> sortedLines = lines.stream()
                .sorted(Comparator.comparing(Line::getLineId))
                .collect(Collectors.toList());
        Map<String, Integer> remaining = new HashMap<>();
        sortedLines.forEach(line -> remaining.put(line.getLineId(), line.weeklyCapacity()));

        // 3. Even split, capped by what each line has left
        List<MixPlanEntry> entries = new ArrayList<>();
        for (Map.Entry<String, Integer> productDemand : weeklyDemand.entrySet()) {
            String product = productDemand.getKey();
            int total = productDemand.getValue();
            List<Line> eligible = sortedLines.stream()
                    .filter(line -> line.canProduce(product))
                    .collect(Collectors.toList());

            if (eligible.isEmpty()) {
                log.warn("No line can produce {}, {} units left unplanned", product, total);
                continue;
            }

            Map<String, Integer> planned = new LinkedHashMap<>();
            int share = total / eligible.size();
            int remainder = total % eligible.size();
            int uncovered = 0;

            for (int i = 0; i < eligible.size(); i++) {
                String lineId = eligible.get(i).getLineId();
                int wanted = share + (i < remainder ? 1 : 0);
                int given = Math.min(wanted, remaining.get(lineId));
                remaining.merge(lineId, -given, Integer::sum);
                planned.put(lineId, given);
                uncovered += wanted - given;
            }

            // Second pass: move what did not fit onto eligible lines that still have room
            for (Line line : eligible) {
                if (uncovered == 0) {
                    break;
                }
                int extra = Math.min(uncovered, remaining.get(line.getLineId()));
                if (extra > 0) {
                    remaining.merge(line.getLineId(), -extra, Integer::sum);
                    planned.merge(line.getLineId(), extra, Integer::sum);
                    uncovered -= extra;
                }
            }

            if (uncovered > 0) {
                log.info("Capacity short for {}: {} of {} units unplanned", product, uncovered, total);
            }

            for (Line line : eligible) {
                int units = planned.get(line.getLineId());
                if (units <= 0) {
                    continue;
                }
                double utilization = Math.min((double) units / line.weeklyCapacity(), 1.0);
                entries.add(MixPlanEntry.builder()
                        .period(1)
                        .lineId(line.getLineId())
                        .product(product)
                        .plannedUnits(units)
                        .utilization(MixKpiCalculator.round(utilization, 2))
                        .build());
            }
        }

        // 4. KPIs
        int totalDemand = weeklyDemand.values().stream().mapToInt(Integer::intValue).sum();
        MixKpi kpi = MixKpiCalculator.calculate(entries, totalDemand, params.getUnitCost(),
                new ChangeoverTable(params.getChangeoverCosts()));

        log.info("{}: {} entries, planned {}/{} units ({}%)",
                NAME, entries.size(), kpi.getTotalPlanned(), totalDemand, kpi.getFulfillmentRate());

        return MixPlan.builder()
                .strategy(NAME)
                .entries(entries)
                .kpi(kpi)
                .objectiveValue(kpi.getTotalCost())
                .build();
    }
}
