package com.bizflow.process.integration.models.definition;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StepBranchDefinition {

    public enum TargetKind {
        TRANSITION,
        STEP
    }

    /** Boolean expression over the task output; null matches unconditionally. */
    private final String condition;
    private final TargetKind targetKind;
    private final int targetIndex;

    public boolean isUnconditional() {
        return condition == null || condition.isBlank();
    }
}
