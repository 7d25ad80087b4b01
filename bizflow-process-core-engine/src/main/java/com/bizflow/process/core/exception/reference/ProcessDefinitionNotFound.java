package com.bizflow.process.core.exception.reference;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import lombok.Getter;

@Getter
public class ProcessDefinitionNotFound extends BizFlowRuntimeException {
    private final String definitionName;

    public ProcessDefinitionNotFound(String definitionName) {
        super(BizFlowErrorCodes.DEFINITION_NOT_FOUND, "Process Definition Not Found. Name: [" + definitionName + "]");
        this.definitionName = definitionName;
    }
}
