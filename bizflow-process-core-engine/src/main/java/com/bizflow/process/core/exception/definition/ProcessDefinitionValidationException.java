package com.bizflow.process.core.exception.definition;

import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Carries every violation found in a rejected definition document.
 */
public class ProcessDefinitionValidationException extends BizFlowRuntimeException {

    private final transient List<ValidationError> errors;

    public ProcessDefinitionValidationException(List<ValidationError> errors) {
        super(BizFlowErrorCodes.DEFINITION_VALIDATION_FAILED, describe(errors));
        this.errors = List.copyOf(errors);
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String describe(List<ValidationError> errors) {
        return "Process definition document has " + errors.size() + " error(s):" + errors.stream()
                .map(error -> "\n  - " + error)
                .collect(Collectors.joining());
    }
}
