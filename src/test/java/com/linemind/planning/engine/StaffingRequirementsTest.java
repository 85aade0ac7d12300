package com.linemind.planning.engine;

import com.linemind.planning.domain.SchedulingParams;
import com.linemind.planning.domain.Shift;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.linemind.planning.PlanningFixtures.START;
import static com.linemind.planning.PlanningFixtures.entry;
import static org.assertj.core.api.Assertions.assertThat;

class StaffingRequirementsTest {

    @Test
    void derive_roundsHeadcountUpForBothShifts() {
        List<StaffingSlot> slots = StaffingRequirements.derive(
                List.of(entry(1, "L1", "A", 350)), SchedulingParams.defaults(), START);

        assertThat(slots).hasSize(14);
        assertThat(slots).allMatch(s -> s.getRequired() == 4);
        assertThat(slots.get(0).getDate()).isEqualTo(START);
        assertThat(slots.get(0).getShift()).isEqualTo(Shift.DAY);
        assertThat(slots.get(1).getShift()).isEqualTo(Shift.NIGHT);
        assertThat(slots.get(13).getDate()).isEqualTo(START.plusDays(6));
    }

    @Test
    void derive_sumsEntriesOfTheSameLineAndPeriod() {
        List<StaffingSlot> slots = StaffingRequirements.derive(
                List.of(entry(1, "L1", "A", 120), entry(1, "L1", "B", 90)), SchedulingParams.defaults(), START);

        assertThat(slots).allMatch(s -> s.getRequired() == 3);
    }

    @Test
    void derive_placesLaterPeriodsInLaterWeeksAndSkipsEmptyEntries() {
        List<StaffingSlot> slots = StaffingRequirements.derive(
                List.of(entry(2, "L2", "A", 50), entry(1, "L1", "A", 0)), SchedulingParams.defaults(), START);

        assertThat(slots).hasSize(14);
        assertThat(slots.get(0).getDate()).isEqualTo(START.plusDays(7));
        assertThat(slots).allMatch(s -> s.getLineId().equals("L2") && s.getRequired() == 1);
    }

    @Test
    void horizonDays_coversWholePeriods() {
        assertThat(StaffingRequirements.horizonDays(List.of(entry(3, "L1", "A", 1)))).isEqualTo(21);
        assertThat(StaffingRequirements.horizonDays(List.of())).isZero();
        assertThat(StaffingRequirements.ceilDiv(101, 100)).isEqualTo(2);
        assertThat(StaffingRequirements.ceilDiv(0, 100)).isZero();
    }
}
