package com.linemind.planning.engine;

import com.linemind.planning.domain.ChangeoverCost;
import com.linemind.planning.domain.ChangeoverTable;
import com.linemind.planning.domain.MixKpi;
import com.linemind.planning.domain.MixPlanEntry;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * KPIs shared by both mix strategies.
 * <p>
 * A changeover is counted for every product pair (p, q), p != q, where a line runs q in a period
 * and p was among the products of the last period it ran before, idle periods in between or not.
 */
public final class MixKpiCalculator {

    private MixKpiCalculator() {
    }

    public static MixKpi calculate(List<MixPlanEntry> entries, int totalDemand,
                                   double unitCost, ChangeoverTable changeovers) {
        int totalPlanned = entries.stream().mapToInt(MixPlanEntry::getPlannedUnits).sum();

        // lineId -> period -> products
        Map<String, Map<Integer, Set<String>>> byLine = new TreeMap<>();
        for (MixPlanEntry e : entries) {
            byLine.computeIfAbsent(e.getLineId(), l -> new TreeMap<>())
                    .computeIfAbsent(e.getPeriod(), p -> new TreeSet<>())
                    .add(e.getProduct());
        }

        int changeoverCount = 0;
        double changeoverHours = 0;
        double changeoverCost = 0;
        for (Map<Integer, Set<String>> periods : byLine.values()) {
            // Idle periods have no entry, so the previous map entry is the last period the line ran
            Set<String> previous = null;
            for (Set<String> current : periods.values()) {
                if (previous == null) {
                    previous = current;
                    continue;
                }
                for (String from : previous) {
                    for (String to : current) {
                        if (from.equals(to)) {
                            continue;
                        }
                        changeoverCount++;
                        Optional<ChangeoverCost> row = changeovers.find(from, to);
                        if (row.isPresent()) {
                            changeoverHours += row.get().getHours();
                            changeoverCost += row.get().getCost();
                        }
                    }
                }
                previous = current;
            }
        }

        double averageUtilization = entries.stream()
                .mapToDouble(MixPlanEntry::getUtilization)
                .average()
                .orElse(0.0);

        return MixKpi.builder()
                .totalDemand(totalDemand)
                .totalPlanned(totalPlanned)
                .fulfillmentRate(fulfillmentRate(totalPlanned, totalDemand))
                .totalCost(totalPlanned * unitCost + changeoverCost)
                .changeovers(changeoverCount)
                .changeoverHours(changeoverHours)
                .averageUtilization(round(averageUtilization, 2))
                .build();
    }

    static double fulfillmentRate(int planned, int demand) {
        if (demand <= 0) {
            return 100.0;
        }
        return round(planned * 100.0 / demand, 1);
    }

    static double round(double value, int decimals) {
        double scale = Math.pow(10, decimals);
        return Math.round(value * scale) / scale;
    }
}
