package com.bizflow.process.integration.enumerations;

public enum BizFlowErrorCategory {
    VALIDATION,
    AUTHORIZATION,
    STATE,
    REFERENCE,
    SIDE_EFFECT
}
