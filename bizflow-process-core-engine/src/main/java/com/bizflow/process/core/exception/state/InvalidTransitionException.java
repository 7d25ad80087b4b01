package com.bizflow.process.core.exception.state;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import lombok.Getter;

@Getter
public class InvalidTransitionException extends BizFlowRuntimeException {

    private final String instanceId;
    private final String transitionName;

    public InvalidTransitionException(String instanceId, String transitionName, String message) {
        super(BizFlowErrorCodes.INVALID_TRANSITION, message);
        this.instanceId = instanceId;
        this.transitionName = transitionName;
    }

    public static InvalidTransitionException notFromCurrentState(String instanceId, String transitionName, String currentState) {
        return new InvalidTransitionException(instanceId, transitionName,
                "Transition [" + transitionName + "] does not leave state [" + currentState + "] of instance [" + instanceId + "]");
    }

    public static InvalidTransitionException suspended(String instanceId, String transitionName) {
        return new InvalidTransitionException(instanceId, transitionName,
                "Instance [" + instanceId + "] is suspended. Transition [" + transitionName + "] rejected");
    }
}
