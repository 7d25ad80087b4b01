package com.bizflow.process.integration.contract;

import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;
import com.bizflow.process.integration.contract.instance.IBizFlowTaskInstance;
import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffectWarning;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Service contract for driving process instances and their tasks.
 *
 * <p>Every failure is delivered as an error signal carrying the runtime's typed exception;
 * nothing is thrown from the assembly methods themselves.</p>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * runtimeService.startInstance(BizFlowStartRequest.of("OrderApproval"))
 *     .flatMap(instance -> runtimeService.executeTransition(
 *         instance.getInstanceId(), "submit", BizFlowActor.of("alice", "Employee")))
 *     .subscribe();
 * }</pre>
 */
public interface IBizFlowProcessRuntimeService {

    // ========================================================================
    // INSTANCE LIFECYCLE
    // ========================================================================

    Mono<IBizFlowProcessInstance> startInstance(BizFlowStartRequest request);

    default Mono<IBizFlowProcessInstance> startInstance(String definitionName, Map<String, Object> variables) {
        return startInstance(BizFlowStartRequest.builder()
                .definitionName(definitionName)
                .variables(variables)
                .build());
    }

    /**
     * Moves the instance along the named transition on behalf of the actor's role.
     */
    Mono<IBizFlowProcessInstance> executeTransition(String instanceId, String transitionName, BizFlowActor actor);

    Mono<IBizFlowProcessInstance> suspendInstance(String instanceId, String reason);

    Mono<IBizFlowProcessInstance> resumeInstance(String instanceId);

    Mono<IBizFlowProcessInstance> terminateInstance(String instanceId, String reason);

    Mono<IBizFlowProcessInstance> failInstance(String instanceId, String reason);

    // ========================================================================
    // INSTANCE QUERIES
    // ========================================================================

    Mono<IBizFlowProcessInstance> getInstance(String instanceId);

    Flux<IBizFlowProcessInstance> listInstances();

    Flux<IBizFlowProcessInstance> listInstancesByStatus(BizFlowProcessStatus status);

    Flux<IBizFlowProcessInstance> listInstancesByDefinition(String definitionName);

    // ========================================================================
    // TASKS
    // ========================================================================

    Mono<IBizFlowTaskInstance> getTask(String taskId);

    Flux<IBizFlowTaskInstance> listTasksByInstance(String instanceId);

    /**
     * Open tasks assigned to the role or to any role it supervises.
     */
    Flux<IBizFlowTaskInstance> listTasksByRole(String definitionName, String role);

    Flux<IBizFlowTaskInstance> listTasksByUser(String userId);

    Mono<IBizFlowTaskInstance> claimTask(String taskId, String userId);

    Mono<IBizFlowTaskInstance> completeTask(String taskId, BizFlowActor actor, Map<String, Object> output);

    Mono<IBizFlowTaskInstance> skipTask(String taskId, BizFlowActor actor, String reason);

    // ========================================================================
    // DIAGNOSTICS
    // ========================================================================

    Flux<BizFlowSideEffectWarning> getWarnings(String instanceId);
}
