package com.bizflow.process.core.exception.definition;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;

public class ProcessDefinitionDocumentException extends BizFlowRuntimeException {

    public ProcessDefinitionDocumentException(String message, Throwable cause) {
        super(BizFlowErrorCodes.DEFINITION_DOCUMENT_FAILED, message, cause);
    }
}
