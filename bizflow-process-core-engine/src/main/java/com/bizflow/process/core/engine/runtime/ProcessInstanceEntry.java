package com.bizflow.process.core.engine.runtime;

import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.instance.ProcessInstanceModel;
import com.bizflow.process.integration.models.instance.ProcessInstanceModel.StateChangeEntry;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mutable instance state owned by the runtime. Every field is changed under the instance lock;
 * readers outside the lock use the snapshot published by {@link #commit(Instant)}.
 */
@Getter
final class ProcessInstanceEntry {

    private final String instanceId;
    /** Definition pinned at start; later registry reloads do not affect the instance. */
    private final ProcessDefinition definition;
    private final Instant createdAt;
    private final String entityId;
    private final Map<String, Object> variables;
    private final Map<Integer, TaskInstanceEntry> tasksByStep = new LinkedHashMap<>();
    private final Set<Integer> activatedSteps = new LinkedHashSet<>();
    private final List<StateChangeEntry> history = new ArrayList<>();

    @Setter
    private int currentStateIndex;
    @Setter
    private BizFlowProcessStatus status;
    @Setter
    private Instant completedAt;
    @Setter
    private Instant suspendedAt;
    @Setter
    private String suspensionReason;
    @Setter
    private String endReason;
    private Instant updatedAt;
    private long version;

    private volatile ProcessInstanceModel snapshot;

    ProcessInstanceEntry(String instanceId, ProcessDefinition definition, int initialStateIndex, String entityId,
                         Map<String, Object> variables, Instant createdAt) {
        this.instanceId = instanceId;
        this.definition = definition;
        this.currentStateIndex = initialStateIndex;
        this.entityId = entityId;
        this.variables = variables;
        this.createdAt = createdAt;
        this.updatedAt = createdAt;
        this.status = BizFlowProcessStatus.RUNNING;
    }

    String getDefinitionName() {
        return definition.getName();
    }

    String currentStateName() {
        return definition.getState(currentStateIndex).getName();
    }

    boolean hasTaskFor(int stepIndex) {
        return tasksByStep.containsKey(stepIndex);
    }

    void addTask(TaskInstanceEntry task) {
        tasksByStep.put(task.getStepIndex(), task);
    }

    Collection<TaskInstanceEntry> tasks() {
        return tasksByStep.values();
    }

    Set<Integer> satisfiedSteps() {
        return tasksByStep.values().stream()
                .filter(task -> task.getStatus().satisfiesDependents())
                .map(TaskInstanceEntry::getStepIndex)
                .collect(Collectors.toSet());
    }

    Set<Integer> materializedSteps() {
        return Set.copyOf(tasksByStep.keySet());
    }

    List<TaskInstanceEntry> openTasks() {
        return tasksByStep.values().stream()
                .filter(task -> task.getStatus().isOpen())
                .collect(Collectors.toList());
    }

    void recordChange(BizFlowProcessStatus previousStatus, int previousStateIndex, BizFlowActor actor,
                      String reason, Instant at) {
        history.add(StateChangeEntry.builder()
                .timestamp(at)
                .previousStatus(previousStatus)
                .newStatus(status)
                .previousState(previousStateIndex == ProcessDefinition.NO_REFERENCE
                        ? null : definition.getState(previousStateIndex).getName())
                .newState(currentStateName())
                .actor(actor != null ? actor.displayName() : null)
                .reason(reason)
                .build());
    }

    /**
     * Bumps the version and publishes a new snapshot.
     */
    ProcessInstanceModel commit(Instant at) {
        version++;
        updatedAt = at;
        ProcessInstanceModel model = ProcessInstanceModel.builder()
                .instanceId(instanceId)
                .definitionName(definition.getName())
                .currentState(currentStateName())
                .status(status)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .completedAt(completedAt)
                .suspendedAt(suspendedAt)
                .suspensionReason(suspensionReason)
                .entityId(entityId)
                .endReason(endReason)
                .variables(ProcessVariables.unmodifiableCopy(variables))
                .taskIds(tasksByStep.values().stream().map(TaskInstanceEntry::getTaskId).collect(Collectors.toUnmodifiableList()))
                .stateHistory(List.copyOf(history))
                .version(version)
                .build();
        this.snapshot = model;
        return model;
    }
}
