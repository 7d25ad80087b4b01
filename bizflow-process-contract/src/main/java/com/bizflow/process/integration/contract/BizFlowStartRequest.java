package com.bizflow.process.integration.contract;

import lombok.Builder;

import java.util.Map;

/**
 * Parameters for starting a process instance.
 *
 * @param definitionName name of a registered process definition
 * @param initialState   explicit start state, or null for the definition's initial state
 * @param entityId       id of the business entity the instance works on, optional
 * @param variables      initial variables, values limited to String, Number and Boolean
 * @param actor          who starts the instance, defaults to the system actor
 */
@Builder
public record BizFlowStartRequest(
        String definitionName,
        String initialState,
        String entityId,
        Map<String, Object> variables,
        BizFlowActor actor
) {

    public static BizFlowStartRequest of(String definitionName) {
        return BizFlowStartRequest.builder().definitionName(definitionName).build();
    }
}
