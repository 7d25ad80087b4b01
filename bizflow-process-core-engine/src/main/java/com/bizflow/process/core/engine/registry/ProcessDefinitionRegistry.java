package com.bizflow.process.core.engine.registry;

import com.bizflow.process.core.exception.reference.ProcessDefinitionNotFound;
import com.bizflow.process.integration.models.definition.ProcessDefinition;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable name to definition map. A new registry replaces the old one as a whole.
 */
public final class ProcessDefinitionRegistry {

    private static final ProcessDefinitionRegistry EMPTY = new ProcessDefinitionRegistry(Map.of());

    private final Map<String, ProcessDefinition> definitions;

    private ProcessDefinitionRegistry(Map<String, ProcessDefinition> definitions) {
        this.definitions = definitions;
    }

    public static ProcessDefinitionRegistry empty() {
        return EMPTY;
    }

    public static ProcessDefinitionRegistry of(Collection<ProcessDefinition> definitions) {
        Map<String, ProcessDefinition> byName = new LinkedHashMap<>();
        for (ProcessDefinition definition : definitions) {
            if (byName.putIfAbsent(definition.getName(), definition) != null) {
                throw new IllegalArgumentException("Duplicate process definition: " + definition.getName());
            }
        }
        return new ProcessDefinitionRegistry(Collections.unmodifiableMap(byName));
    }

    public ProcessDefinition get(String name) {
        return find(name).orElseThrow(() -> new ProcessDefinitionNotFound(name));
    }

    public Optional<ProcessDefinition> find(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(definitions.get(name));
    }

    public Set<String> names() {
        return definitions.keySet();
    }

    public Collection<ProcessDefinition> all() {
        return definitions.values();
    }

    public int size() {
        return definitions.size();
    }
}
