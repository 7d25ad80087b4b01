package com.bizflow.process.core.engine.validation;

import com.bizflow.process.integration.models.definition.ProcessDefinition;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@ToString
public class ValidationResult {

    private final List<ProcessDefinition> definitions;
    private final List<ValidationError> errors;

    public ValidationResult(List<ProcessDefinition> definitions, List<ValidationError> errors) {
        this.definitions = List.copyOf(definitions);
        this.errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<ValidationError> errorsOfKind(ValidationErrorKind kind) {
        return errors.stream().filter(error -> error.getKind() == kind).toList();
    }
}
