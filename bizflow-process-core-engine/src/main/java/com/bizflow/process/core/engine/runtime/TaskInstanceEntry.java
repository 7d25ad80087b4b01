package com.bizflow.process.core.engine.runtime;

import com.bizflow.process.integration.enumerations.BizFlowTaskStatus;
import com.bizflow.process.integration.models.instance.TaskInstanceModel;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable task state owned by the runtime. Fields are changed under the owning instance's lock,
 * the assigned user included; it is a compare-and-set reference so a claim only ever replaces an empty slot.
 * Every published snapshot carries a higher version than the one before.
 */
@Getter
final class TaskInstanceEntry {

    private final String taskId;
    private final String instanceId;
    private final int stepIndex;
    private final String stepName;
    private final String assignedRole;
    private final boolean auto;
    private final Instant createdAt;
    private final AtomicReference<String> assignedUser = new AtomicReference<>();
    private final Map<String, Object> data = new LinkedHashMap<>();

    @Setter
    private BizFlowTaskStatus status;
    @Setter
    private Instant claimedAt;
    @Setter
    private Instant completedAt;
    @Setter
    private String completedBy;

    private long version;
    private volatile TaskInstanceModel snapshot;

    TaskInstanceEntry(String taskId, String instanceId, int stepIndex, String stepName, String assignedRole,
                      boolean auto, BizFlowTaskStatus status, Instant createdAt) {
        this.taskId = taskId;
        this.instanceId = instanceId;
        this.stepIndex = stepIndex;
        this.stepName = stepName;
        this.assignedRole = assignedRole;
        this.auto = auto;
        this.status = status;
        this.createdAt = createdAt;
        publish();
    }

    boolean tryAssign(String userId) {
        return assignedUser.compareAndSet(null, userId);
    }

    String currentAssignee() {
        return assignedUser.get();
    }

    /**
     * Moves the task to a terminal status and publishes the result.
     */
    void finish(BizFlowTaskStatus terminalStatus, String actorName, Instant at) {
        this.status = terminalStatus;
        this.completedAt = at;
        this.completedBy = actorName;
        publish();
    }

    TaskInstanceModel publish() {
        version++;
        TaskInstanceModel model = TaskInstanceModel.builder()
                .taskId(taskId)
                .instanceId(instanceId)
                .stepName(stepName)
                .status(status)
                .assignedRole(assignedRole)
                .assignedUser(assignedUser.get())
                .createdAt(createdAt)
                .claimedAt(claimedAt)
                .completedAt(completedAt)
                .completedBy(completedBy)
                .data(Collections.unmodifiableMap(new LinkedHashMap<>(data)))
                .auto(auto)
                .version(version)
                .build();
        this.snapshot = model;
        return model;
    }

    /**
     * Task attributes exposed to branch conditions as {@code task}.
     */
    Map<String, Object> attributes() {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("taskId", taskId);
        attributes.put("stepName", stepName);
        attributes.put("auto", auto);
        if (assignedRole != null) {
            attributes.put("assignedRole", assignedRole);
        }
        if (assignedUser.get() != null) {
            attributes.put("assignedUser", assignedUser.get());
        }
        if (completedBy != null) {
            attributes.put("completedBy", completedBy);
        }
        return attributes;
    }
}
