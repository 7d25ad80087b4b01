package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.IProcessDefinitionCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;

import java.util.List;

public class ProjectNameCheck implements IProcessDefinitionCheck {

    @Override
    public String getName() {
        return "project-name";
    }

    @Override
    public List<ValidationError> check(ProcessDocumentSource document) {
        if (document.getProject() != null && !ProcessSourceView.isBlank(document.getProject().getName())) {
            return List.of();
        }
        return List.of(ValidationError.of(ValidationErrorKind.MISSING_PROJECT_NAME, null,
                ValidationElementKind.PROJECT, null, "Project name is missing or empty"));
    }
}
