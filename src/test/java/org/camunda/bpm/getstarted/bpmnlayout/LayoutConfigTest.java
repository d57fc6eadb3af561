package org.camunda.bpm.getstarted.bpmnlayout;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LayoutConfigTest {
    @Test
    void shouldDeriveBoundaryEventPitch() {
        assertEquals(56, LayoutConfig.defaults().boundaryEventPitch());
    }

    @Test
    void shouldOverrideSingleValue() {
        LayoutConfig config = LayoutConfig.defaultsBuilder().laneHeaderWidth(40).build();

        assertEquals(40, config.laneHeaderWidth());
        assertEquals(LayoutConfig.defaults().poolHeaderWidth(), config.poolHeaderWidth());
    }

    @Test
    void shouldRejectInvalidGrid() {
        assertThrows(IllegalArgumentException.class, () -> LayoutConfig.defaultsBuilder().gridCellSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> LayoutConfig.defaultsBuilder().gridPadding(-1).build());
    }
}
