package com.bizflow.process.core.engine.validation;

public enum ValidationErrorKind {
    MISSING_PROJECT_NAME,
    MISSING_NAME,
    DUPLICATE_NAME,
    UNKNOWN_REFERENCE,
    MISSING_STEP_ROLE,
    CYCLIC_DEPENDENCY,
    INVALID_FLOW_ORDER,
    SELF_TRANSITION,
    AMBIGUOUS_TRANSITION,
    CONFLICTING_SUPERVISOR,
    AMBIGUOUS_INITIAL_STATE,
    INVALID_CONDITION
}
