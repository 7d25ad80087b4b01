package com.bizflow.process.core.exception;

import com.bizflow.process.integration.contract.IBizFlowErrorInfo;
import com.bizflow.process.integration.enumerations.BizFlowErrorCategory;

public class BizFlowRuntimeException extends RuntimeException {

    private final transient IBizFlowErrorInfo errorInfo;

    public BizFlowRuntimeException(IBizFlowErrorInfo errorInfo, String message) {
        super(message);
        this.errorInfo = errorInfo;
    }

    public BizFlowRuntimeException(IBizFlowErrorInfo errorInfo, String message, Throwable cause) {
        super(message, cause);
        this.errorInfo = errorInfo;
    }

    public IBizFlowErrorInfo getErrorInfo() {
        return errorInfo;
    }

    public String getErrorCode() {
        return errorInfo.getErrorCode();
    }

    public BizFlowErrorCategory getCategory() {
        return errorInfo.getCategory();
    }
}
