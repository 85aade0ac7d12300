package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ForecastKpi {
    int productCount;
    int horizonDays;
    // Products with no history that fell back to the flat baseline
    List<String> baselineProducts;
}
