package com.bizflow.process.core.engine.lock;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;

import java.time.Duration;

/**
 * Thrown when an operation cannot obtain the lock of its process instance in time
 * because another operation on the same instance is still running.
 */
public class ProcessInstanceLockedException extends BizFlowRuntimeException {

    private static final long serialVersionUID = 1L;

    private final String instanceId;

    public ProcessInstanceLockedException(String message, String instanceId) {
        super(BizFlowErrorCodes.INSTANCE_LOCKED, message);
        this.instanceId = instanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public static ProcessInstanceLockedException timeout(String instanceId, Duration timeout) {
        return new ProcessInstanceLockedException(
                String.format("Timeout after %s waiting for lock on instance %s", timeout, instanceId),
                instanceId);
    }
}
