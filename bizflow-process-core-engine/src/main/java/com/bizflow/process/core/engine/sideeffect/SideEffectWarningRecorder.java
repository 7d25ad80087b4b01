package com.bizflow.process.core.engine.sideeffect;

import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffectWarning;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps the side-effect failures of each instance so callers can inspect them later.
 */
@Slf4j
public class SideEffectWarningRecorder {

    private final Map<String, List<BizFlowSideEffectWarning>> warningsByInstance = new ConcurrentHashMap<>();

    public BizFlowSideEffectWarning record(String instanceId, String taskId, String source, String message) {
        BizFlowSideEffectWarning warning = new BizFlowSideEffectWarning(instanceId, taskId, source, message, Instant.now());
        warningsByInstance.computeIfAbsent(instanceId, key -> new CopyOnWriteArrayList<>()).add(warning);
        log.warn("Side effect warning: instanceId={}, taskId={}, source={}, message={}", instanceId, taskId, source, message);
        return warning;
    }

    public List<BizFlowSideEffectWarning> getWarnings(String instanceId) {
        List<BizFlowSideEffectWarning> warnings = warningsByInstance.get(instanceId);
        return warnings == null ? List.of() : List.copyOf(warnings);
    }

    public List<BizFlowSideEffectWarning> getAllWarnings() {
        List<BizFlowSideEffectWarning> all = new ArrayList<>();
        warningsByInstance.values().forEach(all::addAll);
        return all;
    }

    /**
     * Clears all recorded warnings (for testing).
     */
    public void clear() {
        warningsByInstance.clear();
    }
}
