package com.bizflow.process.core.engine.registry;

import com.bizflow.process.core.engine.validation.ProcessDefinitionValidator;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.core.exception.definition.ProcessDefinitionValidationException;
import com.bizflow.process.core.exception.reference.ProcessDefinitionNotFound;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import com.bizflow.process.integration.models.source.ProcessSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.bizflow.process.core.engine.BizFlowTestFixtures.document;
import static com.bizflow.process.core.engine.BizFlowTestFixtures.list;
import static com.bizflow.process.core.engine.BizFlowTestFixtures.simpleProcess;
import static org.junit.jupiter.api.Assertions.*;

class ProcessDefinitionRegistryHolderTest {

    private ProcessDefinitionRegistryHolder holder;

    @BeforeEach
    void setUp() {
        holder = new ProcessDefinitionRegistryHolder(new ProcessDefinitionValidator());
    }

    @Nested
    @DisplayName("Registry lookups")
    class LookupTests {

        @Test
        @DisplayName("should start with an empty registry")
        void shouldStartEmpty() {
            assertEquals(0, holder.current().size());
            assertTrue(holder.current().find("Simple").isEmpty());
        }

        @Test
        @DisplayName("should find loaded definitions by name and fail for unknown names")
        void shouldFindLoadedDefinitions() {
            // When
            ProcessDefinitionRegistry registry = holder.reload(document(simpleProcess("First"), simpleProcess("Second")));

            // Then
            assertSame(registry, holder.current());
            assertEquals(Set.of("First", "Second"), registry.names());
            assertEquals("Second", registry.get("Second").getName());
            ProcessDefinitionNotFound error = assertThrows(ProcessDefinitionNotFound.class, () -> registry.get("Third"));
            assertTrue(error.getMessage().contains("Third"));
            assertTrue(registry.find(null).isEmpty());
        }

        @Test
        @DisplayName("should not allow two definitions with the same name")
        void shouldRejectDuplicateDefinitions() {
            // Given
            ProcessDefinitionRegistry loaded = holder.reload(document(simpleProcess("Only")));

            // When / Then
            assertThrows(IllegalArgumentException.class,
                    () -> ProcessDefinitionRegistry.of(List.of(loaded.get("Only"), loaded.get("Only"))));
        }
    }

    @Nested
    @DisplayName("Reload")
    class ReloadTests {

        @Test
        @DisplayName("should swap the whole registry on a valid reload")
        void shouldSwapRegistry() {
            // Given
            holder.reload(document(simpleProcess("Old")));

            // When
            holder.reload(document(simpleProcess("New")));

            // Then
            assertEquals(Set.of("New"), holder.current().names());
        }

        @Test
        @DisplayName("should keep the active registry when the new document has errors")
        void shouldFailClosed() {
            // Given
            ProcessDefinitionRegistry active = holder.reload(document(simpleProcess("Active")));
            ProcessSource cyclic = simpleProcess("Cyclic");
            cyclic.getSteps().get(0).setDependsOn(list("B"));
            cyclic.setFlow(null);
            ProcessDocumentSource broken = document(simpleProcess("Valid"), cyclic);

            // When
            ProcessDefinitionValidationException error = assertThrows(ProcessDefinitionValidationException.class,
                    () -> holder.reload(broken));

            // Then
            assertSame(active, holder.current());
            assertTrue(error.getErrors().stream()
                    .anyMatch(e -> e.getKind() == ValidationErrorKind.CYCLIC_DEPENDENCY && "Cyclic".equals(e.getProcessName())));
        }
    }
}
