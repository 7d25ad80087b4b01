package com.bizflow.process.core.engine.lock;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Serializes mutating operations per process instance.
 *
 * <p>Operations on the same instance id run one at a time; operations on different instances do
 * not block each other. Locks are reentrant for the holding thread, so an operation may trigger
 * another operation on the same instance.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * ProcessInstanceModel snapshot = lockService.executeWithLock(instanceId, Duration.ofSeconds(5),
 *     () -> applyTransition(instanceId));
 * }</pre>
 *
 * @see ProcessInstanceLockedException
 */
public interface IBizFlowInstanceLockService {

    /**
     * Waits up to {@code timeout} for the lock of an instance.
     *
     * @return true if the calling thread now holds the lock
     */
    boolean tryAcquire(String instanceId, Duration timeout);

    /**
     * Releases one hold of the calling thread on the instance lock.
     */
    void release(String instanceId);

    boolean isLocked(String instanceId);

    /**
     * Runs {@code action} while holding the instance lock.
     *
     * @throws ProcessInstanceLockedException if the lock is not obtained within {@code timeout}
     */
    default <T> T executeWithLock(String instanceId, Duration timeout, Supplier<T> action) {
        if (!tryAcquire(instanceId, timeout)) {
            throw ProcessInstanceLockedException.timeout(instanceId, timeout);
        }
        try {
            return action.get();
        } finally {
            release(instanceId);
        }
    }
}
