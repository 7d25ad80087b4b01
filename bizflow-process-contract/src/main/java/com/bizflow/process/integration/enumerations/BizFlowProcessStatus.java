package com.bizflow.process.integration.enumerations;

public enum BizFlowProcessStatus {
    RUNNING,
    COMPLETED,
    SUSPENDED,
    TERMINATED,
    ERROR;

    /**
     * Terminal statuses accept no further transitions, suspension or resumption.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == TERMINATED || this == ERROR;
    }
}
