package com.bizflow.process.core.engine.scheduling;

import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.definition.StepDefinition;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Computes which steps of an instance should get a task next.
 *
 * <p>A step is eligible when it is schedulable (in the flow, or activated by a branch), every
 * step it depends on has a completed or skipped task, and it has no task yet. Results come in
 * flow order, followed by activated steps outside the flow in declaration order.</p>
 */
public class TaskScheduler {

    /**
     * @param satisfiedSteps    indexes of steps whose task is COMPLETED or SKIPPED
     * @param materializedSteps indexes of steps that already have a task, in any status
     * @param activatedSteps    indexes of steps activated by an {@code onComplete} branch
     */
    public List<StepDefinition> eligibleSteps(ProcessDefinition definition, Set<Integer> satisfiedSteps,
                                              Set<Integer> materializedSteps, Set<Integer> activatedSteps) {
        List<StepDefinition> eligible = new ArrayList<>();
        for (StepDefinition step : definition.flowSteps()) {
            if (isReady(step, satisfiedSteps, materializedSteps)) {
                eligible.add(step);
            }
        }
        for (StepDefinition step : definition.getSteps()) {
            if (!step.isInFlow() && activatedSteps.contains(step.getIndex())
                    && isReady(step, satisfiedSteps, materializedSteps)) {
                eligible.add(step);
            }
        }
        return eligible;
    }

    private static boolean isReady(StepDefinition step, Set<Integer> satisfiedSteps, Set<Integer> materializedSteps) {
        return !materializedSteps.contains(step.getIndex()) && satisfiedSteps.containsAll(step.getDependsOn());
    }
}
