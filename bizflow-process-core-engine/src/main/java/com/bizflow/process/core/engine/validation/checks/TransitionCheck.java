package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.TransitionSource;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Transitions connect two different declared states and are authorized by a declared role.
 * At most one transition may exist per (from, to, role) triple.
 */
public class TransitionCheck extends AbstractProcessCheck {

    @Override
    public String getName() {
        return "transitions";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        Set<List<String>> triples = new HashSet<>();
        for (TransitionSource transition : process.getTransitions()) {
            String name = transition.getName();
            boolean fromKnown = checkState(process, transition, transition.getFrom(), "source", errors);
            boolean toKnown = checkState(process, transition, transition.getTo(), "destination", errors);
            boolean roleKnown = process.roleIndex(transition.getBy()).isPresent();
            if (!roleKnown) {
                errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.TRANSITION, name,
                        "Transition [" + name + "] is authorized by unknown role [" + transition.getBy() + "]"));
            }
            if (fromKnown && toKnown && transition.getFrom().equals(transition.getTo())) {
                errors.add(error(ValidationErrorKind.SELF_TRANSITION, process, ValidationElementKind.TRANSITION, name,
                        "Transition [" + name + "] leaves and enters the same state [" + transition.getFrom() + "]"));
            }
            if (fromKnown && toKnown && roleKnown
                    && !triples.add(List.of(transition.getFrom(), transition.getTo(), transition.getBy()))) {
                errors.add(error(ValidationErrorKind.AMBIGUOUS_TRANSITION, process, ValidationElementKind.TRANSITION, name,
                        "Transition [" + name + "] duplicates another transition from [" + transition.getFrom()
                                + "] to [" + transition.getTo() + "] by [" + transition.getBy() + "]"));
            }
        }
    }

    private static boolean checkState(ProcessSourceView process, TransitionSource transition, String state,
                                      String end, List<ValidationError> errors) {
        if (process.stateIndex(state).isPresent()) {
            return true;
        }
        errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.TRANSITION,
                transition.getName(), "Transition [" + transition.getName() + "] has unknown " + end + " state [" + state + "]"));
        return false;
    }
}
