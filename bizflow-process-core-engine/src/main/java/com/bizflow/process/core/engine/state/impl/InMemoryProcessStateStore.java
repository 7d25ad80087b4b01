package com.bizflow.process.core.engine.state.impl;

import com.bizflow.process.core.engine.state.IBizFlowProcessStateStore;
import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;
import com.bizflow.process.integration.contract.instance.IBizFlowTaskInstance;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of the state store, for tests and single-process deployments.
 */
@Slf4j
public class InMemoryProcessStateStore implements IBizFlowProcessStateStore {

    private final Map<String, IBizFlowProcessInstance> instances = new ConcurrentHashMap<>();
    private final Map<String, IBizFlowTaskInstance> tasks = new ConcurrentHashMap<>();

    @Override
    public Mono<IBizFlowProcessInstance> saveInstance(IBizFlowProcessInstance instance) {
        return Mono.fromCallable(() -> {
            IBizFlowProcessInstance stored = instances.merge(instance.getInstanceId(), instance,
                    (existing, incoming) -> incoming.getVersion() >= existing.getVersion() ? incoming : existing);
            log.debug("Saved instance snapshot: instanceId={}, version={}", stored.getInstanceId(), stored.getVersion());
            return stored;
        });
    }

    @Override
    public Mono<IBizFlowProcessInstance> findInstance(String instanceId) {
        return Mono.justOrEmpty(instances.get(instanceId));
    }

    @Override
    public Flux<IBizFlowProcessInstance> findInstancesByStatus(BizFlowProcessStatus status) {
        return Flux.fromIterable(instances.values())
                .filter(instance -> instance.getStatus() == status)
                .sort(Comparator.comparing(IBizFlowProcessInstance::getCreatedAt));
    }

    @Override
    public Mono<Long> countInstances() {
        return Mono.fromCallable(() -> (long) instances.size());
    }

    @Override
    public Mono<IBizFlowTaskInstance> saveTask(IBizFlowTaskInstance task) {
        return Mono.fromCallable(() -> {
            IBizFlowTaskInstance stored = tasks.merge(task.getTaskId(), task,
                    (existing, incoming) -> incoming.getVersion() >= existing.getVersion() ? incoming : existing);
            log.debug("Saved task snapshot: taskId={}, status={}, version={}",
                    stored.getTaskId(), stored.getStatus(), stored.getVersion());
            return stored;
        });
    }

    @Override
    public Mono<IBizFlowTaskInstance> findTask(String taskId) {
        return Mono.justOrEmpty(tasks.get(taskId));
    }

    @Override
    public Flux<IBizFlowTaskInstance> findTasksByInstance(String instanceId) {
        return Flux.fromIterable(tasks.values())
                .filter(task -> task.getInstanceId().equals(instanceId))
                .sort(Comparator.comparing(IBizFlowTaskInstance::getCreatedAt)
                        .thenComparing(IBizFlowTaskInstance::getTaskId));
    }

    /**
     * Clears all stored snapshots (for testing).
     */
    public void clear() {
        instances.clear();
        tasks.clear();
    }
}
