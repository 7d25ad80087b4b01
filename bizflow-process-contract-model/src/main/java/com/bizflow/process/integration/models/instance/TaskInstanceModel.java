package com.bizflow.process.integration.models.instance;

import com.bizflow.process.integration.contract.instance.IBizFlowTaskInstance;
import com.bizflow.process.integration.enumerations.BizFlowTaskStatus;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

@Data
@Builder(toBuilder = true)
@With
public class TaskInstanceModel implements IBizFlowTaskInstance, Serializable {

    private static final long serialVersionUID = 1L;

    private final String taskId;
    private final String instanceId;
    private final String stepName;
    private final BizFlowTaskStatus status;
    private final String assignedRole;
    private final String assignedUser;
    private final Instant createdAt;
    private final Instant claimedAt;
    private final Instant completedAt;
    private final String completedBy;
    private final Map<String, Object> data;
    private final boolean auto;
    private final long version;

    @Override
    public Optional<String> getAssignedRole() {
        return Optional.ofNullable(assignedRole);
    }

    @Override
    public Optional<String> getAssignedUser() {
        return Optional.ofNullable(assignedUser);
    }

    @Override
    public Optional<Instant> getClaimedAt() {
        return Optional.ofNullable(claimedAt);
    }

    @Override
    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    @Override
    public Optional<String> getCompletedBy() {
        return Optional.ofNullable(completedBy);
    }

    @Override
    public Map<String, Object> getData() {
        return data == null ? Map.of() : data;
    }
}
