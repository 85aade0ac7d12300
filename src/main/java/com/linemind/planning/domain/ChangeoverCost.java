package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChangeoverCost {
    String fromProduct;
    String toProduct;
    double hours;
    double cost;
}
