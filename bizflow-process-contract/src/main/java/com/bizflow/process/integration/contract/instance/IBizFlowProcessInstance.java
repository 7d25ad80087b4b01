package com.bizflow.process.integration.contract.instance;

import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only snapshot of a running or finished process instance.
 * Snapshots are detached copies; mutating the returned collections has no effect on the runtime.
 */
public interface IBizFlowProcessInstance {

    String getInstanceId();

    String getDefinitionName();

    String getCurrentState();

    BizFlowProcessStatus getStatus();

    Instant getCreatedAt();

    Instant getUpdatedAt();

    Optional<Instant> getCompletedAt();

    Optional<Instant> getSuspendedAt();

    Optional<String> getSuspensionReason();

    Optional<String> getEntityId();

    /**
     * Reason recorded when the instance was terminated or failed.
     */
    Optional<String> getEndReason();

    Map<String, Object> getVariables();

    List<String> getTaskIds();

    List<? extends IBizFlowStateChange> getStateHistory();

    long getVersion();

    default boolean isTerminal() {
        return getStatus() != null && getStatus().isTerminal();
    }

    interface IBizFlowStateChange {
        Instant getTimestamp();

        BizFlowProcessStatus getPreviousStatus();

        BizFlowProcessStatus getNewStatus();

        String getPreviousState();

        String getNewState();

        String getActor();

        String getReason();
    }
}
