package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class MixKpi {
    int totalDemand;
    int totalPlanned;
    double fulfillmentRate; // percent
    double totalCost;
    int changeovers;
    double changeoverHours;
    double averageUtilization;
}
