package com.bizflow.process.integration.enumerations;

/**
 * Committed changes that are handed to side-effect handlers after the in-memory update.
 */
public enum BizFlowSideEffectType {
    INSTANCE_STARTED,
    TRANSITION_EXECUTED,
    INSTANCE_COMPLETED,
    INSTANCE_SUSPENDED,
    INSTANCE_RESUMED,
    INSTANCE_TERMINATED,
    INSTANCE_FAILED,
    TASK_CREATED,
    TASK_CLAIMED,
    TASK_COMPLETED,
    TASK_SKIPPED,
    TASK_CANCELLED,
    AUTO_STEP_EXECUTED
}
