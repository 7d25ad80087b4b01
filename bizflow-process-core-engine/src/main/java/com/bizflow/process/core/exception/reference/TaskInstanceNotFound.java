package com.bizflow.process.core.exception.reference;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import lombok.Getter;

@Getter
public class TaskInstanceNotFound extends BizFlowRuntimeException {
    private final String taskId;

    public TaskInstanceNotFound(String taskId) {
        super(BizFlowErrorCodes.TASK_NOT_FOUND, "Task Instance Not Found. Id: [" + taskId + "]");
        this.taskId = taskId;
    }
}
