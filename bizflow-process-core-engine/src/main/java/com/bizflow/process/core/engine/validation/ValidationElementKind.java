package com.bizflow.process.core.engine.validation;

public enum ValidationElementKind {
    PROJECT,
    PROCESS,
    ENTITY,
    ENTITY_FIELD,
    ROLE,
    STATE,
    STEP,
    TRANSITION,
    FLOW,
    BRANCH
}
