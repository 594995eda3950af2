package org.tanzu.proxmoxmcp.orchestration;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DispatchStateTest {

    @Test
    void movesForwardOnly() {
        assertTrue(DispatchState.VALIDATED.canAdvanceTo(DispatchState.RESOLVING));
        assertTrue(DispatchState.VALIDATED.canAdvanceTo(DispatchState.SUBMITTED));
        assertTrue(DispatchState.SUBMITTED.canAdvanceTo(DispatchState.TRACKING));
        assertFalse(DispatchState.TRACKING.canAdvanceTo(DispatchState.SUBMITTED));
        assertFalse(DispatchState.RESOLVING.canAdvanceTo(DispatchState.RESOLVING));
    }

    @Test
    void terminalIsReachableOnceFromAnywhere() {
        for (DispatchState state : DispatchState.values()) {
            assertEquals(state != DispatchState.TERMINAL, state.canAdvanceTo(DispatchState.TERMINAL), state.name());
        }
    }
}
