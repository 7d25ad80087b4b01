package com.bizflow.process.core.engine.runtime;

import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffect;
import com.bizflow.process.integration.enumerations.BizFlowSideEffectType;
import com.bizflow.process.integration.models.instance.ProcessInstanceModel;
import com.bizflow.process.integration.models.instance.TaskInstanceModel;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * One locked operation on an instance: collects the side effects of its changes and turns
 * them into {@link BizFlowSideEffect}s carrying the committed snapshot.
 */
final class InstanceMutation {

    private final ProcessInstanceEntry entry;
    private final Instant now = Instant.now();
    private final List<PendingEffect> pending = new ArrayList<>();
    private final List<BizFlowSideEffect> committed = new ArrayList<>();

    InstanceMutation(ProcessInstanceEntry entry) {
        this.entry = entry;
    }

    ProcessInstanceEntry entry() {
        return entry;
    }

    Instant now() {
        return now;
    }

    void instanceEffect(BizFlowSideEffectType type, BizFlowActor actor) {
        pending.add(new PendingEffect(type, null, actor));
    }

    void taskEffect(BizFlowSideEffectType type, TaskInstanceEntry task, BizFlowActor actor) {
        pending.add(new PendingEffect(type, task.publish(), actor));
    }

    boolean hasChanges() {
        return !pending.isEmpty();
    }

    /**
     * Commits the entry when anything changed since the last commit and returns the latest snapshot.
     */
    ProcessInstanceModel commit() {
        if (pending.isEmpty()) {
            return entry.getSnapshot();
        }
        ProcessInstanceModel snapshot = entry.commit(now);
        for (PendingEffect effect : pending) {
            committed.add(new BizFlowSideEffect(effect.type(), snapshot, effect.task(), effect.actor(), now));
        }
        pending.clear();
        return snapshot;
    }

    List<BizFlowSideEffect> sideEffects() {
        return committed;
    }

    private record PendingEffect(BizFlowSideEffectType type, TaskInstanceModel task, BizFlowActor actor) {
    }
}
