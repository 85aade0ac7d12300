package com.linemind.planning;

import com.linemind.planning.config.LineMindProperties;
import com.linemind.planning.domain.ChangeoverCost;
import com.linemind.planning.domain.Line;
import com.linemind.planning.domain.MixCostParams;
import com.linemind.planning.domain.MixKpi;
import com.linemind.planning.domain.ProductionRecord;
import com.linemind.planning.domain.ScheduleKpi;
import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Shift;
import com.linemind.planning.domain.Worker;
import com.linemind.planning.service.PlanningPipeline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs the whole pipeline once on built-in seed data. Enabled with {@code linemind.demo.enabled=true}.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "linemind.demo", name = "enabled", havingValue = "true")
public class DemoRunner implements CommandLineRunner {

    static final LocalDate HISTORY_START = LocalDate.of(2024, 1, 1);

    private final PlanningPipeline pipeline;
    private final LineMindProperties properties;

    public DemoRunner(PlanningPipeline pipeline, LineMindProperties properties) {
        this.pipeline = pipeline;
        this.properties = properties;
    }

    @Override
    public void run(String... args) {
        log.info("=== STARTING LINEMIND PLANNING DEMO ===");

        PlanningPipeline.Outcome outcome = pipeline.run(
                seedHistory(), List.of(), seedLines(), MixCostParams.withChangeovers(seedChangeovers()),
                seedWorkers(), SchedulingParams.defaults(),
                properties.getMix().getStrategy(), properties.getSchedule().getStrategy());

        log.info("Forecast: {} products", outcome.getForecast().getKpis() == null
                ? 0 : outcome.getForecast().getKpis().getProductCount());

        if (outcome.getMix() != null && outcome.getMix().isSuccess()) {
            MixKpi mix = outcome.getMix().getKpis();
            log.info("--- MIX PLAN ({}) ---", outcome.getMix().getStrategy());
            outcome.getMix().getPayload().forEach(e -> log.info("Week {} {} {}: {} units ({}%)",
                    e.getPeriod(), e.getLineId(), e.getProduct(), e.getPlannedUnits(),
                    Math.round(e.getUtilization() * 100)));
            log.info("Demand {} / planned {} / fulfillment {}% / cost {}",
                    mix.getTotalDemand(), mix.getTotalPlanned(), mix.getFulfillmentRate(), mix.getTotalCost());
        }

        if (outcome.getSchedule() != null && outcome.getSchedule().isSuccess()) {
            ScheduleKpi schedule = outcome.getSchedule().getKpis();
            log.info("--- SCHEDULE ({}) ---", outcome.getSchedule().getStrategy());
            log.info("{} shifts, fulfillment {}%, cost {}, overtime {} h, night bias {}",
                    schedule.getAssignedShifts(), schedule.getFulfillmentRate(), schedule.getTotalCost(),
                    schedule.getTotalOvertimeHours(), schedule.getNightBiasIndex());
        }

        if (!outcome.isComplete()) {
            log.warn("Demo pipeline did not complete, see the stage diagnostics above");
        }
    }

    static List<Line> seedLines() {
        return Arrays.asList(
                Line.builder().lineId("L1").eligibleProducts(Line.parseEligibleProducts("ModelA,ModelB"))
                        .dailyCapacity(150).build(),
                Line.builder().lineId("L2").eligibleProducts(Line.parseEligibleProducts("ModelB,ModelC"))
                        .dailyCapacity(120).build(),
                Line.builder().lineId("L3").eligibleProducts(Line.parseEligibleProducts("ModelA,ModelC"))
                        .dailyCapacity(100).build());
    }

    static List<Worker> seedWorkers() {
        return Arrays.asList(
                worker("W001", "Kim", 12, 28.0, false),
                worker("W002", "Lee", 9, 25.5, true),
                worker("W003", "Park", 7, 24.0, false),
                worker("W004", "Choi", 5, 22.0, true),
                worker("W005", "Jung", 3, 20.5, false),
                worker("W006", "Kang", 2, 19.0, true),
                worker("W007", "Yoon", 1, 18.5, false));
    }

    static List<ChangeoverCost> seedChangeovers() {
        List<ChangeoverCost> rows = new ArrayList<>();
        String[] models = {"ModelA", "ModelB", "ModelC"};
        for (String from : models) {
            for (String to : models) {
                if (!from.equals(to)) {
                    rows.add(ChangeoverCost.builder().fromProduct(from).toProduct(to)
                            .hours(2.0).cost(150_000).build());
                }
            }
        }
        return rows;
    }

    static List<ProductionRecord> seedHistory() {
        List<ProductionRecord> rows = new ArrayList<>();
        for (int day = 0; day < 14; day++) {
            LocalDate date = HISTORY_START.plusDays(day);
            rows.add(record(date, "L1", "ModelA", Shift.DAY, 60 + day % 3 * 5));
            rows.add(record(date, "L1", "ModelA", Shift.NIGHT, 40));
            rows.add(record(date, "L2", "ModelB", Shift.DAY, 70));
            rows.add(record(date, "L3", "ModelC", Shift.DAY, 45 + day % 2 * 10));
        }
        return rows;
    }

    private static Worker worker(String id, String name, int years, double wage, boolean prefersNight) {
        return Worker.builder()
                .workerId(id)
                .name(name)
                .seniorityYears(years)
                .wagePerHour(wage)
                .maxHoursPerWeek(48)
                .prefersNight(prefersNight)
                .build();
    }

    private static ProductionRecord record(LocalDate date, String line, String product, Shift shift, int units) {
        return ProductionRecord.builder()
                .date(date)
                .lineId(line)
                .product(product)
                .shift(shift)
                .producedUnits(units)
                .targetUnits(100)
                .build();
    }
}
