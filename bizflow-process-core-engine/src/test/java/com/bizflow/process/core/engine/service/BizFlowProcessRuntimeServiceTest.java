package com.bizflow.process.core.engine.service;

import com.bizflow.process.core.engine.BizFlowProcessEngine;
import com.bizflow.process.core.engine.BizFlowTestFixtures;
import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.authorization.BizFlowAuthorizationException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import com.bizflow.process.core.exception.reference.ProcessDefinitionNotFound;
import com.bizflow.process.core.exception.reference.ProcessInstanceNotFound;
import com.bizflow.process.core.exception.state.InvalidTransitionException;
import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.contract.BizFlowStartRequest;
import com.bizflow.process.integration.contract.IBizFlowProcessRuntimeService;
import com.bizflow.process.integration.contract.instance.IBizFlowProcessInstance;
import com.bizflow.process.integration.contract.instance.IBizFlowTaskInstance;
import com.bizflow.process.integration.enumerations.BizFlowErrorCategory;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import com.bizflow.process.integration.enumerations.BizFlowTaskStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BizFlowProcessRuntimeServiceTest {

    private BizFlowProcessEngine engine;
    private IBizFlowProcessRuntimeService service;

    @BeforeEach
    void setUp() {
        engine = BizFlowTestFixtures.engine();
        service = engine.getRuntimeService();
    }

    private IBizFlowProcessInstance startOrderApproval() {
        return service.startInstance(BizFlowStartRequest.of("OrderApproval")).block();
    }

    // ========================================================================
    // INSTANCE OPERATIONS
    // ========================================================================

    @Nested
    @DisplayName("Instance operations")
    class InstanceTests {

        @Test
        @DisplayName("should start an instance on subscription only")
        void shouldStartLazily() {
            // Given
            Mono<IBizFlowProcessInstance> start = service.startInstance(BizFlowStartRequest.of("OrderApproval"));
            assertTrue(engine.getRuntime().listInstances().isEmpty());

            // When / Then
            StepVerifier.create(start)
                    .assertNext(instance -> {
                        assertEquals("Draft", instance.getCurrentState());
                        assertEquals(BizFlowProcessStatus.RUNNING, instance.getStatus());
                    })
                    .verifyComplete();
            assertEquals(1, engine.getRuntime().listInstances().size());
        }

        @Test
        @DisplayName("should signal lookup failures as errors")
        void shouldSignalErrors() {
            StepVerifier.create(service.startInstance(BizFlowStartRequest.of("Missing")))
                    .expectError(ProcessDefinitionNotFound.class)
                    .verify(Duration.ofSeconds(5));

            StepVerifier.create(service.getInstance("instance-404"))
                    .expectErrorSatisfies(error -> {
                        assertInstanceOf(ProcessInstanceNotFound.class, error);
                        assertEquals(BizFlowErrorCategory.REFERENCE, ((BizFlowRuntimeException) error).getCategory());
                    })
                    .verify(Duration.ofSeconds(5));

            StepVerifier.create(service.listTasksByInstance("instance-404"))
                    .expectError(ProcessInstanceNotFound.class)
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should run an instance through its transitions")
        void shouldExecuteTransitions() {
            // Given
            String instanceId = startOrderApproval().getInstanceId();

            // When
            StepVerifier.create(service.executeTransition(instanceId, "submit", BizFlowActor.role("Employee"))
                            .then(service.executeTransition(instanceId, "approve", BizFlowActor.role("Manager"))))
                    .assertNext(instance -> {
                        assertEquals("Approved", instance.getCurrentState());
                        assertEquals(BizFlowProcessStatus.COMPLETED, instance.getStatus());
                    })
                    .verifyComplete();

            // Then
            StepVerifier.create(service.listInstancesByStatus(BizFlowProcessStatus.COMPLETED))
                    .expectNextCount(1)
                    .verifyComplete();
        }

        @Test
        @DisplayName("should signal authorization failures with their error code")
        void shouldSignalAuthorizationFailure() {
            // Given
            String instanceId = startOrderApproval().getInstanceId();
            service.executeTransition(instanceId, "submit", BizFlowActor.role("Employee")).block();

            // When / Then
            StepVerifier.create(service.executeTransition(instanceId, "approve", BizFlowActor.role("Employee")))
                    .expectErrorSatisfies(error -> {
                        assertInstanceOf(BizFlowAuthorizationException.class, error);
                        assertEquals(BizFlowErrorCodes.ROLE_MISMATCH.getErrorCode(),
                                ((BizFlowRuntimeException) error).getErrorCode());
                    })
                    .verify(Duration.ofSeconds(5));
        }

        @Test
        @DisplayName("should suspend, reject transitions, and resume")
        void shouldSuspendAndResume() {
            // Given
            String instanceId = startOrderApproval().getInstanceId();

            // When / Then
            StepVerifier.create(service.suspendInstance(instanceId, "holiday"))
                    .assertNext(instance -> assertEquals(BizFlowProcessStatus.SUSPENDED, instance.getStatus()))
                    .verifyComplete();
            StepVerifier.create(service.executeTransition(instanceId, "submit", BizFlowActor.role("Employee")))
                    .expectError(InvalidTransitionException.class)
                    .verify(Duration.ofSeconds(5));
            StepVerifier.create(service.resumeInstance(instanceId))
                    .assertNext(instance -> assertEquals(BizFlowProcessStatus.RUNNING, instance.getStatus()))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should terminate and fail instances with a reason")
        void shouldTerminateAndFail() {
            // Given
            String first = startOrderApproval().getInstanceId();
            String second = startOrderApproval().getInstanceId();

            // When / Then
            StepVerifier.create(service.terminateInstance(first, "duplicate"))
                    .assertNext(instance -> assertEquals("duplicate", instance.getEndReason().orElseThrow()))
                    .verifyComplete();
            StepVerifier.create(service.failInstance(second, "entity missing"))
                    .assertNext(instance -> assertEquals(BizFlowProcessStatus.ERROR, instance.getStatus()))
                    .verifyComplete();
            StepVerifier.create(service.listInstancesByDefinition("OrderApproval").map(IBizFlowProcessInstance::getStatus))
                    .expectNext(BizFlowProcessStatus.TERMINATED, BizFlowProcessStatus.ERROR)
                    .verifyComplete();
        }
    }

    // ========================================================================
    // TASK OPERATIONS
    // ========================================================================

    @Nested
    @DisplayName("Task operations")
    class TaskTests {

        @Test
        @DisplayName("should claim, list and complete a task")
        void shouldWorkOnTask() {
            // Given
            String instanceId = startOrderApproval().getInstanceId();
            IBizFlowTaskInstance fillForm = service.listTasksByRole("OrderApproval", "Employee").blockFirst();
            assertNotNull(fillForm);

            // When / Then
            StepVerifier.create(service.claimTask(fillForm.getTaskId(), "erin"))
                    .assertNext(task -> assertEquals("erin", task.getAssignedUser().orElseThrow()))
                    .verifyComplete();
            StepVerifier.create(service.listTasksByUser("erin").map(IBizFlowTaskInstance::getStepName))
                    .expectNext("FillForm")
                    .verifyComplete();
            StepVerifier.create(service.claimTask(fillForm.getTaskId(), "frank"))
                    .expectErrorSatisfies(error -> assertEquals(
                            BizFlowErrorCodes.TASK_CLAIMED_BY_ANOTHER_USER.getErrorCode(),
                            ((BizFlowRuntimeException) error).getErrorCode()))
                    .verify(Duration.ofSeconds(5));
            StepVerifier.create(service.completeTask(fillForm.getTaskId(), BizFlowActor.user("erin"),
                            Map.of("amount", 120, "priority", "LOW")))
                    .assertNext(task -> {
                        assertEquals(BizFlowTaskStatus.COMPLETED, task.getStatus());
                        assertEquals(120, task.getData().get("amount"));
                    })
                    .verifyComplete();
            StepVerifier.create(service.listTasksByInstance(instanceId).map(IBizFlowTaskInstance::getStepName))
                    .expectNext("FillForm", "Review")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should skip a task and expose it by id")
        void shouldSkipTask() {
            // Given
            String instanceId = startOrderApproval().getInstanceId();
            String taskId = service.listTasksByInstance(instanceId).blockFirst().getTaskId();

            // When
            service.skipTask(taskId, BizFlowActor.role("Employee"), "filled on paper").block();

            // Then
            StepVerifier.create(service.getTask(taskId))
                    .assertNext(task -> {
                        assertEquals(BizFlowTaskStatus.SKIPPED, task.getStatus());
                        assertEquals("filled on paper", task.getData().get("skipReason"));
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("should expose side-effect warnings of an instance")
        void shouldListWarnings() {
            // Given
            String instanceId = service.startInstance(BizFlowStartRequest.of("Expense")).block().getInstanceId();
            String prepare = service.listTasksByInstance(instanceId).blockFirst().getTaskId();

            // When
            service.completeTask(prepare, BizFlowActor.role("Employee"), Map.of()).block();

            // Then
            StepVerifier.create(service.getWarnings(instanceId))
                    .assertNext(warning -> assertEquals("onComplete", warning.source()))
                    .verifyComplete();
            StepVerifier.create(service.listInstances())
                    .expectNextCount(1)
                    .verifyComplete();
        }
    }
}
