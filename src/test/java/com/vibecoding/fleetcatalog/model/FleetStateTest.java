package com.vibecoding.fleetcatalog.model;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FleetStateTest {

    @Test
    void worstOf_shouldDefaultToReady() {
        assertThat(FleetState.worstOf(Collections.emptyList())).isEqualTo("Ready");
        assertThat(FleetState.worstOf(Arrays.asList(null, null))).isEqualTo("Ready");
        assertThat(FleetState.worstOf(null)).isEqualTo("Ready");
    }

    @Test
    void worstOf_shouldPickHighestPriority() {
        assertThat(FleetState.worstOf(List.of("Ready", "ErrApplied", "Pending"))).isEqualTo("ErrApplied");
        assertThat(FleetState.worstOf(Arrays.asList("Ready", "", null, "NotReady"))).isEqualTo("NotReady");
    }

    @Test
    void worstOf_shouldRankUnknownStatusAboveKnownOnes() {
        assertThat(FleetState.priorityOf("Exploded")).isEqualTo(FleetState.UNKNOWN_PRIORITY);
        assertThat(FleetState.worstOf(List.of("ErrApplied", "Exploded"))).isEqualTo("Exploded");
    }

    @Test
    void toLifecycle_shouldMapStatusToStage() {
        assertThat(FleetState.toLifecycle("Ready")).isEqualTo("production");
        assertThat(FleetState.toLifecycle("WaitApplied")).isEqualTo("experimental");
        assertThat(FleetState.toLifecycle("Pending")).isEqualTo("experimental");
        assertThat(FleetState.toLifecycle("Modified")).isEqualTo("deprecated");
        assertThat(FleetState.toLifecycle("ErrApplied")).isEqualTo("deprecated");
        assertThat(FleetState.toLifecycle(null)).isEqualTo("production");
        assertThat(FleetState.toLifecycle("SomethingNew")).isEqualTo("production");
    }
}
