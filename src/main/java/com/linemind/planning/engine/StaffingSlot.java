package com.linemind.planning.engine;

import com.linemind.planning.domain.Shift;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Headcount a line needs on one shift of one date.
 */
@Value
@Builder
public class StaffingSlot {
    LocalDate date;
    String lineId;
    Shift shift;
    int required;
}
