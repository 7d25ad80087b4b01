package com.bizflow.process.core.exception.reference;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import lombok.Getter;

@Getter
public class ProcessInstanceNotFound extends BizFlowRuntimeException {
    private final String instanceId;

    public ProcessInstanceNotFound(String instanceId) {
        super(BizFlowErrorCodes.INSTANCE_NOT_FOUND, "Process Instance Not Found. Id: [" + instanceId + "]");
        this.instanceId = instanceId;
    }
}
