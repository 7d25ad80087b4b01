package com.bizflow.process.core.exception.reference;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import lombok.Getter;

@Getter
public class ProcessStateNotFound extends BizFlowRuntimeException {
    private final String definitionName;
    private final String stateName;

    public ProcessStateNotFound(String definitionName, String stateName) {
        super(BizFlowErrorCodes.STATE_NOT_FOUND,
                "State Not Found. Definition: [" + definitionName + "], State: [" + stateName + "]");
        this.definitionName = definitionName;
        this.stateName = stateName;
    }
}
