package com.linemind.planning.service;

import com.linemind.planning.config.LineMindProperties;
import com.linemind.planning.domain.DemandPoint;
import com.linemind.planning.domain.Diagnostic;
import com.linemind.planning.domain.ErrorCode;
import com.linemind.planning.domain.ForecastKpi;
import com.linemind.planning.domain.PlanResult;
import com.linemind.planning.domain.ProductionRecord;
import com.linemind.planning.exception.PlanningException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;

/**
 * Moving-average demand forecast.
 * <p>
 * The trailing average of daily output (summed over lines and shifts) is projected forward with
 * Gaussian noise of 10% of that average. Products without history get a flat 100 units/day.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {

    public static final String NAME = "moving_average";

    static final int BASELINE_UNITS = 100;
    static final double NOISE_RATIO = 0.1;

    private final LineMindProperties properties;
    private final Clock clock;
    private final PlanningInputValidator validator;

    /**
     * Forecasts every product in {@code products}, or every product found in the history when
     * {@code products} is empty. Never throws.
     */
    public PlanResult<Map<String, List<DemandPoint>>, ForecastKpi> runForecast(List<ProductionRecord> history,
                                                                              Collection<String> products) {
        long startTime = System.currentTimeMillis();
        try {
            validator.validateHistory(history);
            List<ProductionRecord> rows = history == null ? List.of() : history;

            Set<String> targets = new LinkedHashSet<>();
            if (products == null || products.isEmpty()) {
                rows.forEach(r -> targets.add(r.getProduct()));
            } else {
                targets.addAll(products);
            }

            int horizon = properties.getForecast().getHorizonDays();
            Random random = newRandom();
            Map<String, List<DemandPoint>> forecasts = new LinkedHashMap<>();
            List<String> baseline = new ArrayList<>();
            for (String product : targets) {
                List<DemandPoint> series = forecast(product, rows, horizon, random);
                if (rows.stream().noneMatch(r -> product.equals(r.getProduct()))) {
                    baseline.add(product);
                }
                forecasts.put(product, series);
            }

            log.info("Forecast for {} products over {} days ({} on baseline)", forecasts.size(), horizon, baseline.size());

            ForecastKpi kpi = ForecastKpi.builder()
                    .productCount(forecasts.size())
                    .horizonDays(horizon)
                    .baselineProducts(baseline)
                    .build();
            return PlanResult.success(forecasts, kpi, NAME, System.currentTimeMillis() - startTime);
        } catch (PlanningException e) {
            log.warn("Forecast rejected: {}", e.getMessage());
            return PlanResult.failure(e.toDiagnostic(), NAME, System.currentTimeMillis() - startTime);
        } catch (RuntimeException e) {
            log.error("Forecast failed unexpectedly", e);
            return PlanResult.failure(Diagnostic.builder()
                    .code(ErrorCode.INTERNAL_ERROR)
                    .message(e.getMessage())
                    .build(), NAME, System.currentTimeMillis() - startTime);
        }
    }

    public List<DemandPoint> forecast(String product, List<ProductionRecord> history, int horizon) {
        return forecast(product, history, horizon, newRandom());
    }

    List<DemandPoint> forecast(String product, List<ProductionRecord> history, int horizon, Random random) {
        // 1. Daily totals for this product
        TreeMap<LocalDate, Integer> daily = new TreeMap<>();
        for (ProductionRecord row : history) {
            if (product.equals(row.getProduct())) {
                daily.merge(row.getDate(), row.getProducedUnits(), Integer::sum);
            }
        }

        // 2. No history: flat baseline from today
        List<DemandPoint> series = new ArrayList<>(horizon);
        if (daily.isEmpty()) {
            LocalDate today = LocalDate.now(clock);
            for (int i = 0; i < horizon; i++) {
                series.add(DemandPoint.of(today.plusDays(i), product, BASELINE_UNITS));
            }
            return series;
        }

        // 3. Trailing moving average
        int window = Math.min(properties.getForecast().getMovingAverageWindow(), daily.size());
        double average = daily.descendingMap().values().stream()
                .limit(window)
                .mapToInt(Integer::intValue)
                .average()
                .orElse(0.0);

        // 4. Project from the day after the last observation
        LocalDate next = daily.lastKey().plusDays(1);
        double sigma = average * NOISE_RATIO;
        for (int i = 0; i < horizon; i++) {
            double value = Math.max(0.0, average + random.nextGaussian() * sigma);
            series.add(DemandPoint.of(next.plusDays(i), product, (int) Math.round(value)));
        }
        return series;
    }

    private Random newRandom() {
        Long seed = properties.getForecast().getSeed();
        return seed != null ? new Random(seed) : new Random();
    }
}
