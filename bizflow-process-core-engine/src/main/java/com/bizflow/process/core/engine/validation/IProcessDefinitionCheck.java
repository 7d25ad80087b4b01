package com.bizflow.process.core.engine.validation;

import com.bizflow.process.integration.models.source.ProcessDocumentSource;

import java.util.List;

/**
 * A single integrity rule over a definition document. Implementations are pure: the same
 * document always yields the same errors, and nothing is shared between checks.
 */
public interface IProcessDefinitionCheck {

    String getName();

    List<ValidationError> check(ProcessDocumentSource document);
}
