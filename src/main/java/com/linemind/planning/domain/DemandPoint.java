package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class DemandPoint {
    LocalDate date;
    String product;
    int forecastUnits;

    // Band is +/-20% of the (rounded) forecast
    double confidenceLow;
    double confidenceHigh;

    public static DemandPoint of(LocalDate date, String product, int forecastUnits) {
        return DemandPoint.builder()
                .date(date)
                .product(product)
                .forecastUnits(forecastUnits)
                .confidenceLow(forecastUnits * 0.8)
                .confidenceHigh(forecastUnits * 1.2)
                .build();
    }
}
