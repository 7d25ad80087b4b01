package com.bizflow.process.integration.contract.sideeffect;

import com.bizflow.process.integration.enumerations.BizFlowSideEffectType;
import reactor.core.publisher.Mono;

/**
 * Receiver of committed runtime changes: persistence, notifications, entity updates
 * and the actions behind auto steps.
 *
 * <p>Handlers are invoked after the change is visible in memory. An error signal or a
 * thrown exception is recorded as a warning and never rolls the change back.</p>
 */
public interface IBizFlowSideEffectHandler {

    String getHandlerId();

    default boolean supports(BizFlowSideEffectType type) {
        return true;
    }

    Mono<Void> handle(BizFlowSideEffect sideEffect);
}
