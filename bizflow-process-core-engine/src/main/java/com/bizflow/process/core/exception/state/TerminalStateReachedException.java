package com.bizflow.process.core.exception.state;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import lombok.Getter;

@Getter
public class TerminalStateReachedException extends BizFlowRuntimeException {

    private final String instanceId;
    private final BizFlowProcessStatus status;

    public TerminalStateReachedException(String instanceId, BizFlowProcessStatus status, String operation) {
        super(BizFlowErrorCodes.TERMINAL_STATE_REACHED,
                "Instance [" + instanceId + "] is " + status + ". Operation [" + operation + "] rejected");
        this.instanceId = instanceId;
        this.status = status;
    }
}
