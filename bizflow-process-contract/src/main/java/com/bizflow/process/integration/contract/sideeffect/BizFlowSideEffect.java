package com.bizflow.process.integration.contract.sideeffect;

import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;
import com.bizflow.process.integration.contract.instance.IBizFlowTaskInstance;
import com.bizflow.process.integration.enumerations.BizFlowSideEffectType;

import java.time.Instant;
import java.util.Optional;

/**
 * A committed change, carried with the snapshots taken right after the commit.
 *
 * @param type     what happened
 * @param instance instance snapshot after the change
 * @param task     task snapshot for task-level changes, otherwise null
 * @param actor    who caused the change
 * @param occurredAt commit time
 */
public record BizFlowSideEffect(
        BizFlowSideEffectType type,
        IBizFlowProcessInstance instance,
        IBizFlowTaskInstance task,
        BizFlowActor actor,
        Instant occurredAt
) {

    public static BizFlowSideEffect ofInstance(BizFlowSideEffectType type, IBizFlowProcessInstance instance, BizFlowActor actor) {
        return new BizFlowSideEffect(type, instance, null, actor, Instant.now());
    }

    public static BizFlowSideEffect ofTask(BizFlowSideEffectType type, IBizFlowProcessInstance instance,
                                           IBizFlowTaskInstance task, BizFlowActor actor) {
        return new BizFlowSideEffect(type, instance, task, actor, Instant.now());
    }

    public String instanceId() {
        return instance != null ? instance.getInstanceId() : null;
    }

    public Optional<String> taskId() {
        return Optional.ofNullable(task).map(IBizFlowTaskInstance::getTaskId);
    }
}
