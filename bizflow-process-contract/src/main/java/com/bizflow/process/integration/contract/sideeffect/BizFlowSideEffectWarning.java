package com.bizflow.process.integration.contract.sideeffect;

import java.time.Instant;

/**
 * Record of a side effect that could not be carried out. The in-memory commit that
 * triggered it stays in place.
 *
 * @param instanceId affected instance
 * @param taskId     affected task, null for instance-level effects
 * @param source     handler id or runtime component that reported the problem
 * @param message    failure description
 * @param timestamp  when the failure was recorded
 */
public record BizFlowSideEffectWarning(
        String instanceId,
        String taskId,
        String source,
        String message,
        Instant timestamp
) {
}
