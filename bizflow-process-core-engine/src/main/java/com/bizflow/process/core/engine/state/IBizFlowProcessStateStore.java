package com.bizflow.process.core.engine.state;

import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;
import com.bizflow.process.integration.contract.instance.IBizFlowTaskInstance;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Durable store for instance and task snapshots.
 *
 * <p>The runtime writes to it after each committed change and never reads from it, so a store
 * failure only produces a side-effect warning. Implementations must keep the snapshot with the
 * highest version when writes arrive out of order.</p>
 */
public interface IBizFlowProcessStateStore {

    // ========================================================================
    // INSTANCES
    // ========================================================================

    Mono<IBizFlowProcessInstance> saveInstance(IBizFlowProcessInstance instance);

    Mono<IBizFlowProcessInstance> findInstance(String instanceId);

    Flux<IBizFlowProcessInstance> findInstancesByStatus(BizFlowProcessStatus status);

    Mono<Long> countInstances();

    // ========================================================================
    // TASKS
    // ========================================================================

    Mono<IBizFlowTaskInstance> saveTask(IBizFlowTaskInstance task);

    Mono<IBizFlowTaskInstance> findTask(String taskId);

    Flux<IBizFlowTaskInstance> findTasksByInstance(String instanceId);

    default Mono<Boolean> healthCheck() {
        return Mono.just(true);
    }
}
