package com.bizflow.process.integration.enumerations;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class BizFlowStatusTest {

    @Test
    @DisplayName("should treat completed, terminated and error instances as terminal")
    void shouldClassifyProcessStatuses() {
        EnumSet<BizFlowProcessStatus> terminal = EnumSet.noneOf(BizFlowProcessStatus.class);
        for (BizFlowProcessStatus status : BizFlowProcessStatus.values()) {
            if (status.isTerminal()) {
                terminal.add(status);
            }
        }
        assertEquals(EnumSet.of(BizFlowProcessStatus.COMPLETED, BizFlowProcessStatus.TERMINATED,
                BizFlowProcessStatus.ERROR), terminal);
    }

    @Test
    @DisplayName("should split task statuses into open and finished")
    void shouldClassifyTaskStatuses() {
        for (BizFlowTaskStatus status : BizFlowTaskStatus.values()) {
            assertNotEquals(status.isOpen(), status.isTerminal(), status.name());
        }
        assertTrue(BizFlowTaskStatus.SKIPPED.satisfiesDependents());
        assertTrue(BizFlowTaskStatus.COMPLETED.satisfiesDependents());
        assertFalse(BizFlowTaskStatus.CANCELLED.satisfiesDependents());
        assertFalse(BizFlowTaskStatus.IN_PROGRESS.satisfiesDependents());
    }

    @Test
    @DisplayName("should resolve field types by keyword")
    void shouldResolveFieldTypes() {
        assertEquals(Optional.of(BizFlowFieldType.INT), BizFlowFieldType.fromKeyword(" Int "));
        assertEquals(Optional.of(BizFlowFieldType.ENUM), BizFlowFieldType.fromKeyword("enum"));
        assertTrue(BizFlowFieldType.fromKeyword("date").isEmpty());
        assertTrue(BizFlowFieldType.fromKeyword(null).isEmpty());
    }
}
