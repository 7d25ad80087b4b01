package com.bizflow.process.core.engine.validation;

import lombok.Builder;
import lombok.Data;

/**
 * One violated rule of a definition document.
 * {@code processName} is null for document-level problems.
 */
@Data
@Builder
public class ValidationError {
    private final ValidationErrorKind kind;
    private final String processName;
    private final ValidationElementKind elementKind;
    private final String elementName;
    private final String message;

    public static ValidationError of(ValidationErrorKind kind, String processName,
                                     ValidationElementKind elementKind, String elementName, String message) {
        return ValidationError.builder()
                .kind(kind)
                .processName(processName)
                .elementKind(elementKind)
                .elementName(elementName)
                .message(message)
                .build();
    }

    public boolean isDocumentLevel() {
        return processName == null;
    }

    @Override
    public String toString() {
        return kind + " [" + (processName == null ? "<document>" : processName) + "/" + elementKind
                + (elementName == null ? "" : ":" + elementName) + "] " + message;
    }
}
