package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.IProcessDefinitionCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import com.bizflow.process.integration.models.source.ProcessSource;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Process names must be present and unique across the document.
 */
public class ProcessNameCheck implements IProcessDefinitionCheck {

    @Override
    public String getName() {
        return "process-name";
    }

    @Override
    public List<ValidationError> check(ProcessDocumentSource document) {
        List<ValidationError> errors = new ArrayList<>();
        List<ProcessSource> processes = ProcessSourceView.nullSafe(document.getProcesses());
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (int position = 0; position < processes.size(); position++) {
            ProcessSource process = processes.get(position);
            String name = process == null ? null : process.getName();
            if (ProcessSourceView.isBlank(name)) {
                errors.add(ValidationError.of(ValidationErrorKind.MISSING_NAME, null,
                        ValidationElementKind.PROCESS, null, "Process at position " + position + " has no name"));
            } else if (!seen.add(name) && reported.add(name)) {
                errors.add(ValidationError.of(ValidationErrorKind.DUPLICATE_NAME, name,
                        ValidationElementKind.PROCESS, name, "Process [" + name + "] is declared more than once"));
            }
        }
        return errors;
    }
}
