package com.bizflow.process.core.exception.state;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import com.bizflow.process.integration.enumerations.BizFlowTaskStatus;
import lombok.Getter;

@Getter
public class InvalidTaskStateException extends BizFlowRuntimeException {

    private final String taskId;
    private final BizFlowTaskStatus status;

    public InvalidTaskStateException(String taskId, BizFlowTaskStatus status, String operation) {
        super(BizFlowErrorCodes.INVALID_TASK_STATE,
                "Task [" + taskId + "] is " + status + ". Operation [" + operation + "] rejected");
        this.taskId = taskId;
        this.status = status;
    }
}
