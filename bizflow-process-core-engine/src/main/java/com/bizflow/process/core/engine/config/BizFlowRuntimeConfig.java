package com.bizflow.process.core.engine.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Tunable parameters of the process runtime.
 *
 * <p>{@link #fromSystemProperties()} reads {@code bizflow.*} system properties and falls back to the
 * matching {@code BIZFLOW_*} environment variable ({@code bizflow.lock.timeout} becomes
 * {@code BIZFLOW_LOCK_TIMEOUT}). Durations accept ISO-8601 ({@code PT5S}) or plain milliseconds.</p>
 */
@Slf4j
@Getter
@Builder(toBuilder = true)
@ToString
public final class BizFlowRuntimeConfig {

    public static final String LOCK_TIMEOUT_PROPERTY = "bizflow.lock.timeout";
    public static final String INSTANCE_ID_PREFIX_PROPERTY = "bizflow.instance.id-prefix";
    public static final String TASK_ID_PREFIX_PROPERTY = "bizflow.task.id-prefix";
    public static final String CANCEL_OPEN_TASKS_PROPERTY = "bizflow.cancel-open-tasks-on-terminal";
    public static final String DEFINITION_LOCATION_PROPERTY = "bizflow.definition.location";

    // Concurrency
    @Builder.Default
    private final Duration lockTimeout = Duration.ofSeconds(5);

    // Identifiers
    @Builder.Default
    private final String instanceIdPrefix = "instance-";

    @Builder.Default
    private final String taskIdPrefix = "task-";

    // Lifecycle
    @Builder.Default
    private final boolean cancelOpenTasksOnTerminal = true;

    // Definitions
    private final String definitionLocation;

    public static BizFlowRuntimeConfig defaultConfig() {
        return BizFlowRuntimeConfig.builder().build();
    }

    public static BizFlowRuntimeConfig fromSystemProperties() {
        return resolve(System.getProperties(), System.getenv());
    }

    /**
     * Builds a configuration from the given properties, falling back to environment entries
     * and then to the defaults.
     */
    public static BizFlowRuntimeConfig resolve(Properties properties, Map<String, String> environment) {
        BizFlowRuntimeConfig defaults = defaultConfig();
        BizFlowRuntimeConfig config = BizFlowRuntimeConfig.builder()
                .lockTimeout(parseDuration(LOCK_TIMEOUT_PROPERTY,
                        lookup(properties, environment, LOCK_TIMEOUT_PROPERTY), defaults.getLockTimeout()))
                .instanceIdPrefix(orDefault(lookup(properties, environment, INSTANCE_ID_PREFIX_PROPERTY),
                        defaults.getInstanceIdPrefix()))
                .taskIdPrefix(orDefault(lookup(properties, environment, TASK_ID_PREFIX_PROPERTY),
                        defaults.getTaskIdPrefix()))
                .cancelOpenTasksOnTerminal(Boolean.parseBoolean(orDefault(
                        lookup(properties, environment, CANCEL_OPEN_TASKS_PROPERTY),
                        String.valueOf(defaults.isCancelOpenTasksOnTerminal()))))
                .definitionLocation(lookup(properties, environment, DEFINITION_LOCATION_PROPERTY))
                .build();
        config.validate();
        return config;
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (lockTimeout == null || lockTimeout.isNegative() || lockTimeout.isZero()) {
            throw new IllegalStateException("lockTimeout must be positive");
        }
        if (instanceIdPrefix == null || instanceIdPrefix.isBlank()) {
            throw new IllegalStateException("instanceIdPrefix must not be blank");
        }
        if (taskIdPrefix == null || taskIdPrefix.isBlank()) {
            throw new IllegalStateException("taskIdPrefix must not be blank");
        }
        if (instanceIdPrefix.equals(taskIdPrefix)) {
            throw new IllegalStateException("instanceIdPrefix and taskIdPrefix must differ");
        }
    }

    static String environmentName(String property) {
        return property.toUpperCase(Locale.ROOT).replace('.', '_').replace('-', '_');
    }

    private static String lookup(Properties properties, Map<String, String> environment, String property) {
        String value = properties.getProperty(property);
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        value = environment.get(environmentName(property));
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return null;
    }

    private static String orDefault(String value, String fallback) {
        return value != null ? value : fallback;
    }

    private static Duration parseDuration(String property, String value, Duration fallback) {
        if (value == null) {
            return fallback;
        }
        try {
            return value.startsWith("P") || value.startsWith("p") ? Duration.parse(value) : Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException | DateTimeParseException e) {
            log.warn("Invalid duration for {}: {}. Using default {}", property, value, fallback);
            return fallback;
        }
    }
}
