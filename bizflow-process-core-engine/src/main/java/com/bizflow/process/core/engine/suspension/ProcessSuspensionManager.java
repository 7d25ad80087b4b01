package com.bizflow.process.core.engine.suspension;

import com.bizflow.process.core.engine.runtime.ProcessInstanceRuntime;
import com.bizflow.process.core.engine.runtime.StatusChange;
import com.bizflow.process.core.exception.state.TerminalStateReachedException;
import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import com.bizflow.process.integration.enumerations.BizFlowSideEffectType;
import com.bizflow.process.integration.models.instance.ProcessInstanceModel;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Pauses and resumes process instances.
 *
 * <p>A suspended instance keeps its state and tasks. Its tasks can still be claimed and completed,
 * but it rejects transitions and creates no new tasks until it is resumed. Both operations are
 * idempotent; terminal instances reject them.</p>
 */
@Slf4j
public class ProcessSuspensionManager {

    private final ProcessInstanceRuntime runtime;

    public ProcessSuspensionManager(ProcessInstanceRuntime runtime) {
        this.runtime = runtime;
    }

    public ProcessInstanceModel suspend(String instanceId, String reason) {
        return runtime.changeStatus(instanceId, BizFlowActor.system(), current -> {
            if (current.getStatus().isTerminal()) {
                throw new TerminalStateReachedException(instanceId, current.getStatus(), "suspend");
            }
            if (current.getStatus() == BizFlowProcessStatus.SUSPENDED) {
                log.debug("Instance {} already suspended", instanceId);
                return Optional.empty();
            }
            return Optional.of(new StatusChange(BizFlowProcessStatus.SUSPENDED, reason,
                    BizFlowSideEffectType.INSTANCE_SUSPENDED));
        });
    }

    public ProcessInstanceModel resume(String instanceId) {
        return runtime.changeStatus(instanceId, BizFlowActor.system(), current -> {
            if (current.getStatus().isTerminal()) {
                throw new TerminalStateReachedException(instanceId, current.getStatus(), "resume");
            }
            if (current.getStatus() == BizFlowProcessStatus.RUNNING) {
                log.debug("Instance {} already running", instanceId);
                return Optional.empty();
            }
            return Optional.of(new StatusChange(BizFlowProcessStatus.RUNNING, "resumed",
                    BizFlowSideEffectType.INSTANCE_RESUMED));
        });
    }

    public boolean isSuspended(String instanceId) {
        return runtime.getInstance(instanceId).getStatus() == BizFlowProcessStatus.SUSPENDED;
    }
}
