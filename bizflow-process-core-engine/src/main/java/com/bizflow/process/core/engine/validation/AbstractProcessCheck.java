package com.bizflow.process.core.engine.validation;

import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import com.bizflow.process.integration.models.source.ProcessSource;

import java.util.ArrayList;
import java.util.List;

/**
 * Base for rules that look at one process block at a time.
 */
public abstract class AbstractProcessCheck implements IProcessDefinitionCheck {

    @Override
    public List<ValidationError> check(ProcessDocumentSource document) {
        List<ValidationError> errors = new ArrayList<>();
        for (ProcessSource process : ProcessSourceView.nullSafe(document.getProcesses())) {
            if (process != null) {
                checkProcess(new ProcessSourceView(process), errors);
            }
        }
        return errors;
    }

    protected abstract void checkProcess(ProcessSourceView process, List<ValidationError> errors);

    protected static ValidationError error(ValidationErrorKind kind, ProcessSourceView process,
                                           ValidationElementKind elementKind, String elementName, String message) {
        return ValidationError.of(kind, process.getName(), elementKind, elementName, message);
    }
}
