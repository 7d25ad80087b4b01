package com.bizflow.process.core.exception.codes;

import com.bizflow.process.integration.contract.IBizFlowErrorInfo;
import com.bizflow.process.integration.enumerations.BizFlowErrorCategory;
import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum BizFlowErrorCodes implements IBizFlowErrorInfo {

    DEFINITION_VALIDATION_FAILED(
            "BIZFLOW_ERR_0001",
            BizFlowErrorCategory.VALIDATION,
            "Process definition document failed validation"
    ),

    DEFINITION_DOCUMENT_FAILED(
            "BIZFLOW_ERR_0002",
            BizFlowErrorCategory.VALIDATION,
            "Process definition document could not be read or written"
    ),

    ROLE_MISMATCH(
            "BIZFLOW_ERR_0101",
            BizFlowErrorCategory.AUTHORIZATION,
            "Acting role is not authorized"
    ),

    TASK_CLAIMED_BY_ANOTHER_USER(
            "BIZFLOW_ERR_0102",
            BizFlowErrorCategory.AUTHORIZATION,
            "Task is claimed by another user"
    ),

    INVALID_TRANSITION(
            "BIZFLOW_ERR_0201",
            BizFlowErrorCategory.STATE,
            "Transition cannot be executed from the current state"
    ),

    TERMINAL_STATE_REACHED(
            "BIZFLOW_ERR_0202",
            BizFlowErrorCategory.STATE,
            "Process instance has already finished"
    ),

    INVALID_TASK_STATE(
            "BIZFLOW_ERR_0203",
            BizFlowErrorCategory.STATE,
            "Task is not in a state that allows this operation"
    ),

    INSTANCE_LOCKED(
            "BIZFLOW_ERR_0204",
            BizFlowErrorCategory.STATE,
            "Process instance is locked by a concurrent operation"
    ),

    CONDITION_EVALUATION_FAILED(
            "BIZFLOW_ERR_0205",
            BizFlowErrorCategory.STATE,
            "Branch condition could not be evaluated"
    ),

    DEFINITION_NOT_FOUND(
            "BIZFLOW_ERR_0301",
            BizFlowErrorCategory.REFERENCE,
            "Process definition not found"
    ),

    INSTANCE_NOT_FOUND(
            "BIZFLOW_ERR_0302",
            BizFlowErrorCategory.REFERENCE,
            "Process instance not found"
    ),

    TASK_NOT_FOUND(
            "BIZFLOW_ERR_0303",
            BizFlowErrorCategory.REFERENCE,
            "Task instance not found"
    ),

    STATE_NOT_FOUND(
            "BIZFLOW_ERR_0304",
            BizFlowErrorCategory.REFERENCE,
            "State not declared by the process definition"
    )

    ;

    private final String errorCode;
    private final BizFlowErrorCategory category;
    private final String errorTemplate;
}
