package com.linemind.planning.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "linemind")
public class LineMindProperties {

    private Forecast forecast = new Forecast();
    private Mix mix = new Mix();
    private Schedule schedule = new Schedule();
    private Demo demo = new Demo();

    @Data
    public static class Forecast {
        private int horizonDays = 30;
        private int movingAverageWindow = 7;
        // Fixed seed for reproducible noise; null draws a fresh seed per call
        private Long seed;
    }

    @Data
    public static class Mix {
        private String strategy = "heuristic";
        private double timeLimitSeconds = 10.0;
        private boolean fallbackToHeuristic = false;
    }

    @Data
    public static class Schedule {
        private String strategy = "heuristic";
        private double timeLimitSeconds = 30.0;
        private int searchWorkers = 1;
        private int randomSeed = 42;
    }

    @Data
    public static class Demo {
        private boolean enabled = false;
    }
}
