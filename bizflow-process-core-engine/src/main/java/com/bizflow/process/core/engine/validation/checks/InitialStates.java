package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.integration.models.source.StateSource;
import com.bizflow.process.integration.models.source.TransitionSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public final class InitialStates {

    private InitialStates() {
    }

    /**
     * Declared states without incoming transitions, in declaration order.
     */
    public static List<String> candidates(ProcessSourceView process) {
        Set<String> entered = new HashSet<>();
        for (TransitionSource transition : process.getTransitions()) {
            if (transition.getTo() != null && !transition.getTo().equals(transition.getFrom())) {
                entered.add(transition.getTo());
            }
        }
        List<String> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (StateSource state : process.getStates()) {
            String name = state.getName();
            if (!ProcessSourceView.isBlank(name) && !entered.contains(name) && seen.add(name)) {
                candidates.add(name);
            }
        }
        return candidates;
    }

    /**
     * The start state of a process that passed validation.
     */
    public static String resolve(ProcessSourceView process) {
        if (!ProcessSourceView.isBlank(process.getInitialState())) {
            return process.getInitialState();
        }
        return candidates(process).get(0);
    }
}
