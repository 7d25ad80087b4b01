package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.StepSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Flow entries name declared steps, appear once, and never put a step before one of
 * its direct or transitive dependencies.
 */
public class FlowCheck extends AbstractProcessCheck {

    @Override
    public String getName() {
        return "flow";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        Map<String, Integer> positions = new LinkedHashMap<>();
        List<String> flow = process.getFlow();
        for (int position = 0; position < flow.size(); position++) {
            String entry = flow.get(position);
            if (process.stepIndex(entry).isEmpty()) {
                errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.FLOW,
                        entry, "Flow references unknown step [" + entry + "]"));
            } else if (positions.putIfAbsent(entry, position) != null) {
                errors.add(error(ValidationErrorKind.DUPLICATE_NAME, process, ValidationElementKind.FLOW,
                        entry, "Step [" + entry + "] appears more than once in the flow"));
            }
        }

        for (Map.Entry<String, Integer> placed : positions.entrySet()) {
            StepSource step = process.getSteps().get(process.stepIndex(placed.getKey()).orElseThrow());
            for (String dependency : transitiveDependencies(process, step)) {
                Integer dependencyPosition = positions.get(dependency);
                if (dependencyPosition != null && dependencyPosition > placed.getValue()) {
                    errors.add(error(ValidationErrorKind.INVALID_FLOW_ORDER, process, ValidationElementKind.FLOW,
                            step.getName(), "Step [" + step.getName() + "] is placed before its dependency ["
                                    + dependency + "] in the flow"));
                }
            }
        }
    }

    private static Set<String> transitiveDependencies(ProcessSourceView process, StepSource step) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<StepSource> pending = new ArrayDeque<>();
        pending.push(step);
        while (!pending.isEmpty()) {
            for (String dependency : ProcessSourceView.dependenciesOf(pending.pop())) {
                if (visited.add(dependency)) {
                    process.stepIndex(dependency).ifPresent(index -> pending.push(process.getSteps().get(index)));
                }
            }
        }
        visited.remove(step.getName());
        return visited;
    }
}
