package com.bizflow.process.integration.enumerations;

public enum BizFlowTaskStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    SKIPPED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == SKIPPED || this == CANCELLED;
    }

    public boolean isOpen() {
        return this == PENDING || this == IN_PROGRESS;
    }

    /**
     * Whether a task in this status unblocks the steps that depend on its step.
     */
    public boolean satisfiesDependents() {
        return this == COMPLETED || this == SKIPPED;
    }
}
