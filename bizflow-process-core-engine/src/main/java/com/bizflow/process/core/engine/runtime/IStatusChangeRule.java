package com.bizflow.process.core.engine.runtime;

import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;

import java.util.Optional;

/**
 * Decides, under the instance lock, how the status of an instance changes.
 */
@FunctionalInterface
public interface IStatusChangeRule {

    /**
     * @param current latest committed snapshot of the instance
     * @return the change to apply, or empty to leave the instance untouched
     * @throws com.bizflow.process.core.exception.BizFlowRuntimeException to reject the request
     */
    Optional<StatusChange> evaluate(IBizFlowProcessInstance current);
}
