package com.bizflow.process.core.engine.sideeffect;

import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffect;
import com.bizflow.process.integration.contract.sideeffect.IBizFlowSideEffectHandler;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Hands committed changes to the registered handlers without waiting for them.
 *
 * <p>Each handler runs independently; an error signal, a thrown exception or a missing publisher
 * becomes a {@link com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffectWarning}
 * for the affected instance. Nothing is propagated back to the caller.</p>
 */
@Slf4j
public class BizFlowSideEffectDispatcher {

    private final List<IBizFlowSideEffectHandler> handlers = new CopyOnWriteArrayList<>();
    private final SideEffectWarningRecorder warningRecorder;
    private final Scheduler scheduler;

    public BizFlowSideEffectDispatcher(SideEffectWarningRecorder warningRecorder) {
        this(warningRecorder, Schedulers.immediate());
    }

    public BizFlowSideEffectDispatcher(SideEffectWarningRecorder warningRecorder, Scheduler scheduler) {
        this.warningRecorder = warningRecorder;
        this.scheduler = scheduler;
    }

    public BizFlowSideEffectDispatcher register(IBizFlowSideEffectHandler handler) {
        handlers.add(handler);
        log.info("Registered side effect handler: {}", handler.getHandlerId());
        return this;
    }

    public List<IBizFlowSideEffectHandler> getHandlers() {
        return List.copyOf(handlers);
    }

    public void dispatch(List<BizFlowSideEffect> sideEffects) {
        sideEffects.forEach(this::dispatch);
    }

    public void dispatch(BizFlowSideEffect sideEffect) {
        for (IBizFlowSideEffectHandler handler : handlers) {
            if (!handler.supports(sideEffect.type())) {
                continue;
            }
            Mono.defer(() -> {
                        Mono<Void> result = handler.handle(sideEffect);
                        return result != null ? result : Mono.<Void>error(
                                new IllegalStateException("Handler returned no publisher"));
                    })
                    .subscribeOn(scheduler)
                    .doOnSuccess(ignored -> log.debug("Side effect {} handled by {} for instance {}",
                            sideEffect.type(), handler.getHandlerId(), sideEffect.instanceId()))
                    .onErrorResume(error -> {
                        warningRecorder.record(sideEffect.instanceId(), sideEffect.taskId().orElse(null),
                                handler.getHandlerId(), sideEffect.type() + " failed: " + error.getMessage());
                        return Mono.empty();
                    })
                    .subscribe();
        }
    }
}
