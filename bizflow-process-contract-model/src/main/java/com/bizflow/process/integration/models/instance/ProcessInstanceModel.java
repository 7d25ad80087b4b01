package com.bizflow.process.integration.models.instance;

import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import lombok.Builder;
import lombok.Data;
import lombok.With;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Detached snapshot of a process instance. Produced by the runtime after every committed change
 * and handed to queries, the state store and side-effect handlers.
 */
@Data
@Builder(toBuilder = true)
@With
public class ProcessInstanceModel implements IBizFlowProcessInstance, Serializable {

    private static final long serialVersionUID = 1L;

    private final String instanceId;
    private final String definitionName;
    private final String currentState;
    private final BizFlowProcessStatus status;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant completedAt;
    private final Instant suspendedAt;
    private final String suspensionReason;
    private final String entityId;
    private final String endReason;
    private final Map<String, Object> variables;
    private final List<String> taskIds;
    private final List<StateChangeEntry> stateHistory;
    private final long version;

    @Override
    public Optional<Instant> getCompletedAt() {
        return Optional.ofNullable(completedAt);
    }

    @Override
    public Optional<Instant> getSuspendedAt() {
        return Optional.ofNullable(suspendedAt);
    }

    @Override
    public Optional<String> getSuspensionReason() {
        return Optional.ofNullable(suspensionReason);
    }

    @Override
    public Optional<String> getEntityId() {
        return Optional.ofNullable(entityId);
    }

    @Override
    public Optional<String> getEndReason() {
        return Optional.ofNullable(endReason);
    }

    @Override
    public Map<String, Object> getVariables() {
        return variables == null ? Map.of() : variables;
    }

    @Override
    public List<String> getTaskIds() {
        return taskIds == null ? List.of() : taskIds;
    }

    @Override
    public List<StateChangeEntry> getStateHistory() {
        return stateHistory == null ? List.of() : stateHistory;
    }

    @Data
    @Builder
    public static class StateChangeEntry implements IBizFlowStateChange, Serializable {

        private static final long serialVersionUID = 1L;

        private final Instant timestamp;
        private final BizFlowProcessStatus previousStatus;
        private final BizFlowProcessStatus newStatus;
        private final String previousState;
        private final String newState;
        private final String actor;
        private final String reason;
    }
}
