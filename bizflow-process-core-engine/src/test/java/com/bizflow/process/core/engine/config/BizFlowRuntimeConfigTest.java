package com.bizflow.process.core.engine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class BizFlowRuntimeConfigTest {

    @Test
    @DisplayName("should use defaults when nothing is configured")
    void shouldUseDefaults() {
        // When
        BizFlowRuntimeConfig config = BizFlowRuntimeConfig.resolve(new Properties(), Map.of());

        // Then
        assertEquals(Duration.ofSeconds(5), config.getLockTimeout());
        assertEquals("instance-", config.getInstanceIdPrefix());
        assertEquals("task-", config.getTaskIdPrefix());
        assertTrue(config.isCancelOpenTasksOnTerminal());
        assertNull(config.getDefinitionLocation());
    }

    @Test
    @DisplayName("should prefer properties over environment variables")
    void shouldResolvePropertiesThenEnvironment() {
        // Given
        Properties properties = new Properties();
        properties.setProperty(BizFlowRuntimeConfig.LOCK_TIMEOUT_PROPERTY, "PT10S");
        properties.setProperty(BizFlowRuntimeConfig.INSTANCE_ID_PREFIX_PROPERTY, "proc-");
        Map<String, String> environment = Map.of(
                "BIZFLOW_LOCK_TIMEOUT", "250",
                "BIZFLOW_TASK_ID_PREFIX", "work-",
                "BIZFLOW_CANCEL_OPEN_TASKS_ON_TERMINAL", "false",
                "BIZFLOW_DEFINITION_LOCATION", "classpath:definitions/processes.yml");

        // When
        BizFlowRuntimeConfig config = BizFlowRuntimeConfig.resolve(properties, environment);

        // Then
        assertEquals(Duration.ofSeconds(10), config.getLockTimeout());
        assertEquals("proc-", config.getInstanceIdPrefix());
        assertEquals("work-", config.getTaskIdPrefix());
        assertFalse(config.isCancelOpenTasksOnTerminal());
        assertEquals("classpath:definitions/processes.yml", config.getDefinitionLocation());
    }

    @Test
    @DisplayName("should accept milliseconds and fall back on unparsable durations")
    void shouldParseDurations() {
        // Given
        Properties millis = new Properties();
        millis.setProperty(BizFlowRuntimeConfig.LOCK_TIMEOUT_PROPERTY, "1500");
        Properties broken = new Properties();
        broken.setProperty(BizFlowRuntimeConfig.LOCK_TIMEOUT_PROPERTY, "soon");

        // When / Then
        assertEquals(Duration.ofMillis(1500), BizFlowRuntimeConfig.resolve(millis, Map.of()).getLockTimeout());
        assertEquals(Duration.ofSeconds(5), BizFlowRuntimeConfig.resolve(broken, Map.of()).getLockTimeout());
    }

    @Test
    @DisplayName("should reject invalid settings")
    void shouldRejectInvalidSettings() {
        assertThrows(IllegalStateException.class,
                () -> BizFlowRuntimeConfig.builder().lockTimeout(Duration.ZERO).build().validate());
        assertThrows(IllegalStateException.class,
                () -> BizFlowRuntimeConfig.builder().taskIdPrefix(" ").build().validate());
        assertThrows(IllegalStateException.class,
                () -> BizFlowRuntimeConfig.builder().instanceIdPrefix("x-").taskIdPrefix("x-").build().validate());
        Properties negative = new Properties();
        negative.setProperty(BizFlowRuntimeConfig.LOCK_TIMEOUT_PROPERTY, "-5");
        assertThrows(IllegalStateException.class, () -> BizFlowRuntimeConfig.resolve(negative, Map.of()));
    }

    @Test
    @DisplayName("should derive environment variable names from property names")
    void shouldDeriveEnvironmentNames() {
        assertEquals("BIZFLOW_INSTANCE_ID_PREFIX",
                BizFlowRuntimeConfig.environmentName(BizFlowRuntimeConfig.INSTANCE_ID_PREFIX_PROPERTY));
    }
}
