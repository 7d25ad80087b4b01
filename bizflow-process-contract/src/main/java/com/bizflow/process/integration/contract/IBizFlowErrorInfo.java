package com.bizflow.process.integration.contract;

import com.bizflow.process.integration.enumerations.BizFlowErrorCategory;

public interface IBizFlowErrorInfo {
    String getErrorCode();
    BizFlowErrorCategory getCategory();
    String getErrorTemplate();
}
