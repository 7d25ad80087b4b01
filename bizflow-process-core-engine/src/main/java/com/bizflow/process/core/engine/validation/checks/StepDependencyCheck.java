package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.StepSource;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@code dependsOn} references resolve and the step graph is acyclic.
 *
 * <p>Cycles are found with a depth-first search that keeps the current path on a stack;
 * an edge back to a step on that stack closes a cycle. Each back edge is reported once.</p>
 */
public class StepDependencyCheck extends AbstractProcessCheck {

    private static final int UNVISITED = 0;
    private static final int ON_STACK = 1;
    private static final int DONE = 2;

    @Override
    public String getName() {
        return "step-dependencies";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        List<StepSource> steps = process.getSteps();
        List<List<Integer>> edges = new ArrayList<>(steps.size());
        for (StepSource step : steps) {
            List<Integer> resolved = new ArrayList<>();
            for (String dependency : ProcessSourceView.dependenciesOf(step)) {
                Optional<Integer> target = process.stepIndex(dependency);
                if (target.isPresent()) {
                    resolved.add(target.get());
                } else {
                    errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.STEP,
                            step.getName(), "Step [" + step.getName() + "] depends on unknown step [" + dependency + "]"));
                }
            }
            edges.add(resolved);
        }

        int[] marks = new int[steps.size()];
        Deque<Integer> path = new ArrayDeque<>();
        for (int start = 0; start < steps.size(); start++) {
            if (marks[start] == UNVISITED) {
                visit(start, process, edges, marks, path, errors);
            }
        }
    }

    /**
     * Depth-first search from {@code start} driven by an explicit stack of {@code {node, next edge}}
     * frames, so long dependency chains do not exhaust the thread stack.
     */
    private static void visit(int start, ProcessSourceView process, List<List<Integer>> edges,
                              int[] marks, Deque<Integer> path, List<ValidationError> errors) {
        Deque<int[]> frames = new ArrayDeque<>();
        marks[start] = ON_STACK;
        path.addLast(start);
        frames.push(new int[]{start, 0});
        while (!frames.isEmpty()) {
            int[] frame = frames.peek();
            List<Integer> targets = edges.get(frame[0]);
            if (frame[1] == targets.size()) {
                frames.pop();
                path.removeLast();
                marks[frame[0]] = DONE;
                continue;
            }
            int next = targets.get(frame[1]++);
            if (marks[next] == ON_STACK) {
                errors.add(cycleError(process, path, next));
            } else if (marks[next] == UNVISITED) {
                marks[next] = ON_STACK;
                path.addLast(next);
                frames.push(new int[]{next, 0});
            }
        }
    }

    private static ValidationError cycleError(ProcessSourceView process, Deque<Integer> path, int closing) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (int node : path) {
            inCycle = inCycle || node == closing;
            if (inCycle) {
                cycle.add(process.getSteps().get(node).getName());
            }
        }
        String closingName = process.getSteps().get(closing).getName();
        cycle.add(closingName);
        return error(ValidationErrorKind.CYCLIC_DEPENDENCY, process, ValidationElementKind.STEP, closingName,
                "Steps depend on each other in a cycle: " + cycle.stream().collect(Collectors.joining(" -> ")));
    }
}
