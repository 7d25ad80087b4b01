package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;

import java.util.List;

/**
 * A process needs exactly one start state: the configured {@code initialState}, or else
 * the only declared state that no transition enters.
 */
public class InitialStateCheck extends AbstractProcessCheck {

    @Override
    public String getName() {
        return "initial-state";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        String configured = process.getInitialState();
        if (!ProcessSourceView.isBlank(configured)) {
            if (process.stateIndex(configured).isEmpty()) {
                errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.STATE,
                        configured, "Initial state [" + configured + "] is not declared"));
            }
            return;
        }
        List<String> candidates = InitialStates.candidates(process);
        if (candidates.size() != 1) {
            String detail = candidates.isEmpty()
                    ? "every state is entered by a transition"
                    : "several states are never entered: " + candidates;
            errors.add(error(ValidationErrorKind.AMBIGUOUS_INITIAL_STATE, process, ValidationElementKind.PROCESS,
                    process.getName(), "Cannot determine the initial state, " + detail));
        }
    }
}
