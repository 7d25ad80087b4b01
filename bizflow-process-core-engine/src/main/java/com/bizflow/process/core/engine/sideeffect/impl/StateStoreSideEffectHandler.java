package com.bizflow.process.core.engine.sideeffect.impl;

import com.bizflow.process.core.engine.state.IBizFlowProcessStateStore;
import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffect;
import com.bizflow.process.integration.contract.sideeffect.IBizFlowSideEffectHandler;
import reactor.core.publisher.Mono;

/**
 * Persists the instance snapshot, and the task snapshot when present, of every committed change.
 */
public class StateStoreSideEffectHandler implements IBizFlowSideEffectHandler {

    public static final String HANDLER_ID = "state-store";

    private final IBizFlowProcessStateStore stateStore;

    public StateStoreSideEffectHandler(IBizFlowProcessStateStore stateStore) {
        this.stateStore = stateStore;
    }

    @Override
    public String getHandlerId() {
        return HANDLER_ID;
    }

    @Override
    public Mono<Void> handle(BizFlowSideEffect sideEffect) {
        Mono<?> saveTask = sideEffect.task() != null ? stateStore.saveTask(sideEffect.task()) : Mono.empty();
        return stateStore.saveInstance(sideEffect.instance())
                .then(saveTask)
                .then();
    }
}
