package com.bizflow.process.core.engine.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Checks and copies the variable bag of a new instance. Keys must be non-blank and values
 * limited to {@link String}, {@link Number} and {@link Boolean}.
 */
public final class ProcessVariables {

    private ProcessVariables() {
    }

    public static Map<String, Object> validate(Map<String, Object> variables) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (variables == null) {
            return copy;
        }
        for (Map.Entry<String, Object> entry : variables.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                throw new IllegalArgumentException("Variable name cannot be empty");
            }
            if (!isSupported(entry.getValue())) {
                throw new IllegalArgumentException("Unsupported value for variable [" + entry.getKey() + "]: "
                        + (entry.getValue() == null ? "null" : entry.getValue().getClass().getName())
                        + ". Expected String, Number or Boolean");
            }
            copy.put(entry.getKey(), entry.getValue());
        }
        return copy;
    }

    public static Map<String, Object> unmodifiableCopy(Map<String, Object> variables) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }

    private static boolean isSupported(Object value) {
        return value instanceof String || value instanceof Number || value instanceof Boolean;
    }
}
