package com.bizflow.process.integration.contract.instance;

import com.bizflow.process.integration.enumerations.BizFlowTaskStatus;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

public interface IBizFlowTaskInstance {

    String getTaskId();

    String getInstanceId();

    String getStepName();

    BizFlowTaskStatus getStatus();

    Optional<String> getAssignedRole();

    Optional<String> getAssignedUser();

    Instant getCreatedAt();

    Optional<Instant> getClaimedAt();

    Optional<Instant> getCompletedAt();

    Optional<String> getCompletedBy();

    Map<String, Object> getData();

    boolean isAuto();

    /**
     * Increases with every change to the task; stores keep the snapshot with the highest version.
     */
    long getVersion();
}
