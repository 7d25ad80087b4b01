package com.bizflow.process.core.engine.sideeffect.impl;

import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffect;
import com.bizflow.process.integration.contract.sideeffect.IBizFlowSideEffectHandler;
import com.bizflow.process.integration.enumerations.BizFlowSideEffectType;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Log-based notification handler for development and testing.
 * Writes one line per committed change and counts changes per type.
 */
@Slf4j
public class LoggingSideEffectHandler implements IBizFlowSideEffectHandler {

    public static final String HANDLER_ID = "logging";

    private final Map<BizFlowSideEffectType, AtomicLong> counts = new EnumMap<>(BizFlowSideEffectType.class);

    public LoggingSideEffectHandler() {
        for (BizFlowSideEffectType type : BizFlowSideEffectType.values()) {
            counts.put(type, new AtomicLong());
        }
    }

    @Override
    public String getHandlerId() {
        return HANDLER_ID;
    }

    @Override
    public Mono<Void> handle(BizFlowSideEffect sideEffect) {
        return Mono.fromRunnable(() -> {
            counts.get(sideEffect.type()).incrementAndGet();
            if (sideEffect.task() != null) {
                log.info("[{}] instance={} task={} step={} status={} by={}",
                        sideEffect.type(), sideEffect.instanceId(), sideEffect.task().getTaskId(),
                        sideEffect.task().getStepName(), sideEffect.task().getStatus(),
                        sideEffect.actor() != null ? sideEffect.actor().displayName() : null);
            } else {
                log.info("[{}] instance={} state={} status={} by={}",
                        sideEffect.type(), sideEffect.instanceId(), sideEffect.instance().getCurrentState(),
                        sideEffect.instance().getStatus(),
                        sideEffect.actor() != null ? sideEffect.actor().displayName() : null);
            }
        });
    }

    public long getCount(BizFlowSideEffectType type) {
        return counts.get(type).get();
    }
}
