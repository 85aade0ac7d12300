package com.linemind.planning.domain;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * One row of production history: what a line produced for a product on one shift.
 */
@Value
@Builder
public class ProductionRecord {
    LocalDate date;
    String lineId;
    String product;
    Shift shift;
    int producedUnits;
    int targetUnits;
}
