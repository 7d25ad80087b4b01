package com.bizflow.process.core.engine.service;

import com.bizflow.process.core.engine.runtime.ProcessInstanceRuntime;
import com.bizflow.process.core.engine.suspension.ProcessSuspensionManager;
import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.contract.BizFlowStartRequest;
import com.bizflow.process.integration.contract.IBizFlowProcessRuntimeService;
import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;
import com.bizflow.process.integration.contract.instance.IBizFlowTaskInstance;
import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffectWarning;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reactive facade over the process runtime. Work happens on subscription; exceptions thrown by
 * the runtime become error signals.
 */
public class BizFlowProcessRuntimeService implements IBizFlowProcessRuntimeService {

    private final ProcessInstanceRuntime runtime;
    private final ProcessSuspensionManager suspensionManager;

    public BizFlowProcessRuntimeService(ProcessInstanceRuntime runtime, ProcessSuspensionManager suspensionManager) {
        this.runtime = runtime;
        this.suspensionManager = suspensionManager;
    }

    @Override
    public Mono<IBizFlowProcessInstance> startInstance(BizFlowStartRequest request) {
        return Mono.fromCallable(() -> runtime.start(request));
    }

    @Override
    public Mono<IBizFlowProcessInstance> executeTransition(String instanceId, String transitionName, BizFlowActor actor) {
        return Mono.fromCallable(() -> runtime.executeTransition(instanceId, transitionName, actor));
    }

    @Override
    public Mono<IBizFlowProcessInstance> suspendInstance(String instanceId, String reason) {
        return Mono.fromCallable(() -> suspensionManager.suspend(instanceId, reason));
    }

    @Override
    public Mono<IBizFlowProcessInstance> resumeInstance(String instanceId) {
        return Mono.fromCallable(() -> suspensionManager.resume(instanceId));
    }

    @Override
    public Mono<IBizFlowProcessInstance> terminateInstance(String instanceId, String reason) {
        return Mono.fromCallable(() -> runtime.terminate(instanceId, reason));
    }

    @Override
    public Mono<IBizFlowProcessInstance> failInstance(String instanceId, String reason) {
        return Mono.fromCallable(() -> runtime.fail(instanceId, reason));
    }

    @Override
    public Mono<IBizFlowProcessInstance> getInstance(String instanceId) {
        return Mono.fromCallable(() -> runtime.getInstance(instanceId));
    }

    @Override
    public Flux<IBizFlowProcessInstance> listInstances() {
        return fromList(runtime::listInstances);
    }

    @Override
    public Flux<IBizFlowProcessInstance> listInstancesByStatus(BizFlowProcessStatus status) {
        return fromList(() -> runtime.listInstancesByStatus(status));
    }

    @Override
    public Flux<IBizFlowProcessInstance> listInstancesByDefinition(String definitionName) {
        return fromList(() -> runtime.listInstancesByDefinition(definitionName));
    }

    @Override
    public Mono<IBizFlowTaskInstance> getTask(String taskId) {
        return Mono.fromCallable(() -> runtime.getTask(taskId));
    }

    @Override
    public Flux<IBizFlowTaskInstance> listTasksByInstance(String instanceId) {
        return fromList(() -> runtime.listTasksByInstance(instanceId));
    }

    @Override
    public Flux<IBizFlowTaskInstance> listTasksByRole(String definitionName, String role) {
        return fromList(() -> runtime.listTasksByRole(definitionName, role));
    }

    @Override
    public Flux<IBizFlowTaskInstance> listTasksByUser(String userId) {
        return fromList(() -> runtime.listTasksByUser(userId));
    }

    @Override
    public Mono<IBizFlowTaskInstance> claimTask(String taskId, String userId) {
        return Mono.fromCallable(() -> runtime.claimTask(taskId, userId));
    }

    @Override
    public Mono<IBizFlowTaskInstance> completeTask(String taskId, BizFlowActor actor, Map<String, Object> output) {
        return Mono.fromCallable(() -> runtime.completeTask(taskId, actor, output));
    }

    @Override
    public Mono<IBizFlowTaskInstance> skipTask(String taskId, BizFlowActor actor, String reason) {
        return Mono.fromCallable(() -> runtime.skipTask(taskId, actor, reason));
    }

    @Override
    public Flux<BizFlowSideEffectWarning> getWarnings(String instanceId) {
        return fromList(() -> runtime.getWarnings(instanceId));
    }

    private static <T> Flux<T> fromList(Supplier<? extends List<? extends T>> supplier) {
        return Flux.defer(() -> Flux.fromIterable(supplier.get()));
    }
}
