package com.bizflow.process.core.engine.registry;

import com.bizflow.process.core.engine.validation.ProcessDefinitionValidator;
import com.bizflow.process.core.engine.validation.ValidationResult;
import com.bizflow.process.core.exception.definition.ProcessDefinitionValidationException;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Publishes the active {@link ProcessDefinitionRegistry}. Readers take the current value without
 * locking; {@link #reload} swaps in a new registry only when the whole document is valid.
 */
@Slf4j
public class ProcessDefinitionRegistryHolder {

    private final ProcessDefinitionValidator validator;
    private final AtomicReference<ProcessDefinitionRegistry> current =
            new AtomicReference<>(ProcessDefinitionRegistry.empty());

    public ProcessDefinitionRegistryHolder(ProcessDefinitionValidator validator) {
        this.validator = validator;
    }

    public ProcessDefinitionRegistry current() {
        return current.get();
    }

    /**
     * Validates the document and replaces the active registry with its definitions.
     *
     * @throws ProcessDefinitionValidationException with every violation; the active registry is kept
     */
    public ProcessDefinitionRegistry reload(ProcessDocumentSource document) {
        ValidationResult result = validator.validate(document);
        if (!result.isValid()) {
            log.warn("Definition reload rejected with {} error(s); keeping {} active definition(s)",
                    result.getErrors().size(), current.get().size());
            throw new ProcessDefinitionValidationException(result.getErrors());
        }
        ProcessDefinitionRegistry registry = ProcessDefinitionRegistry.of(result.getDefinitions());
        ProcessDefinitionRegistry previous = current.getAndSet(registry);
        log.info("Definition registry reloaded: {} -> {} definition(s) {}", previous.size(), registry.size(), registry.names());
        return registry;
    }
}
