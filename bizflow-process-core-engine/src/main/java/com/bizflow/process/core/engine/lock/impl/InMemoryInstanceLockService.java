package com.bizflow.process.core.engine.lock.impl;

import com.bizflow.process.core.engine.lock.IBizFlowInstanceLockService;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory implementation of the instance lock service: one {@link ReentrantLock} per instance id.
 *
 * <p>Suitable for a single runtime process. Locks are created on first use and kept for the
 * lifetime of the service.</p>
 */
@Slf4j
public class InMemoryInstanceLockService implements IBizFlowInstanceLockService {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final AtomicLong acquiredCount = new AtomicLong(0);
    private final AtomicLong releasedCount = new AtomicLong(0);
    private final AtomicLong timeoutCount = new AtomicLong(0);

    @Override
    public boolean tryAcquire(String instanceId, Duration timeout) {
        if (instanceId == null || timeout == null) {
            throw new IllegalArgumentException("instanceId and timeout cannot be null");
        }
        ReentrantLock lock = locks.computeIfAbsent(instanceId, key -> new ReentrantLock());
        try {
            if (lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                acquiredCount.incrementAndGet();
                log.debug("Acquired lock: instanceId={}, holdCount={}", instanceId, lock.getHoldCount());
                return true;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for lock: instanceId={}", instanceId);
            return false;
        }
        timeoutCount.incrementAndGet();
        log.warn("Lock acquisition timed out: instanceId={}, timeout={}", instanceId, timeout);
        return false;
    }

    @Override
    public void release(String instanceId) {
        ReentrantLock lock = instanceId == null ? null : locks.get(instanceId);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            log.warn("Cannot release lock - not held by current thread: instanceId={}", instanceId);
            return;
        }
        lock.unlock();
        releasedCount.incrementAndGet();
        log.debug("Released lock: instanceId={}", instanceId);
    }

    @Override
    public boolean isLocked(String instanceId) {
        ReentrantLock lock = locks.get(instanceId);
        return lock != null && lock.isLocked();
    }

    /**
     * Gets statistics about lock operations.
     */
    public LockStatistics getStatistics() {
        return new LockStatistics(
                locks.size(),
                locks.values().stream().filter(ReentrantLock::isLocked).count(),
                acquiredCount.get(),
                releasedCount.get(),
                timeoutCount.get()
        );
    }

    /**
     * Clears all locks and counters (for testing).
     */
    public void reset() {
        locks.clear();
        acquiredCount.set(0);
        releasedCount.set(0);
        timeoutCount.set(0);
    }

    /**
     * Statistics record for lock operations.
     */
    public record LockStatistics(
            long knownInstances,
            long heldLocks,
            long acquiredCount,
            long releasedCount,
            long timeoutCount
    ) {}
}
