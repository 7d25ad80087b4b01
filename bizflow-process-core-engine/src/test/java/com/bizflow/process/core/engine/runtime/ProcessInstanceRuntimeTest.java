package com.bizflow.process.core.engine.runtime;

import com.bizflow.process.core.engine.BizFlowProcessEngine;
import com.bizflow.process.core.engine.BizFlowTestFixtures;
import com.bizflow.process.core.engine.config.BizFlowRuntimeConfig;
import com.bizflow.process.core.exception.authorization.BizFlowAuthorizationException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import com.bizflow.process.core.exception.reference.ProcessDefinitionNotFound;
import com.bizflow.process.core.exception.reference.ProcessInstanceNotFound;
import com.bizflow.process.core.exception.reference.ProcessStateNotFound;
import com.bizflow.process.core.exception.reference.TaskInstanceNotFound;
import com.bizflow.process.core.exception.state.InvalidTaskStateException;
import com.bizflow.process.core.exception.state.InvalidTransitionException;
import com.bizflow.process.core.exception.state.TerminalStateReachedException;
import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.contract.BizFlowStartRequest;
import com.bizflow.process.integration.contract.sideeffect.BizFlowSideEffectWarning;
import com.bizflow.process.integration.enumerations.BizFlowProcessStatus;
import com.bizflow.process.integration.enumerations.BizFlowTaskStatus;
import com.bizflow.process.integration.models.instance.ProcessInstanceModel;
import com.bizflow.process.integration.models.instance.TaskInstanceModel;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ProcessInstanceRuntimeTest {

    private static final BizFlowActor CLERK = BizFlowActor.role("Clerk");
    private static final BizFlowActor EMPLOYEE = BizFlowActor.role("Employee");
    private static final BizFlowActor MANAGER = BizFlowActor.role("Manager");
    private static final BizFlowActor OPERATOR = BizFlowActor.role("Operator");

    private ProcessInstanceRuntime runtime;

    @BeforeEach
    void setUp() {
        runtime = BizFlowTestFixtures.engine().getRuntime();
    }

    private ProcessInstanceModel start(String definitionName) {
        return runtime.start(BizFlowStartRequest.of(definitionName));
    }

    private TaskInstanceModel taskFor(String instanceId, String stepName) {
        return runtime.listTasksByInstance(instanceId).stream()
                .filter(task -> task.getStepName().equals(stepName))
                .findFirst()
                .orElseThrow(() -> new AssertionError("No task for step " + stepName));
    }

    private List<String> stepNames(String instanceId) {
        return runtime.listTasksByInstance(instanceId).stream()
                .map(TaskInstanceModel::getStepName)
                .collect(Collectors.toList());
    }

    // ========================================================================
    // START
    // ========================================================================

    @Nested
    @DisplayName("Starting instances")
    class StartTests {

        @Test
        @DisplayName("should start at the initial state with tasks for the first steps")
        void shouldStartAtInitialState() {
            // When
            ProcessInstanceModel instance = start("Simple");

            // Then
            assertEquals("instance-1", instance.getInstanceId());
            assertEquals("Simple", instance.getDefinitionName());
            assertEquals("Open", instance.getCurrentState());
            assertEquals(BizFlowProcessStatus.RUNNING, instance.getStatus());
            assertEquals(1L, instance.getVersion());
            assertEquals(List.of("A"), stepNames(instance.getInstanceId()));
            TaskInstanceModel task = taskFor(instance.getInstanceId(), "A");
            assertEquals(BizFlowTaskStatus.PENDING, task.getStatus());
            assertEquals("Clerk", task.getAssignedRole().orElseThrow());
            assertTrue(task.getAssignedUser().isEmpty());
            assertEquals(1, instance.getStateHistory().size());
            assertEquals("started", instance.getStateHistory().get(0).getReason());
            assertEquals("Open", instance.getStateHistory().get(0).getNewState());
        }

        @Test
        @DisplayName("should honour an explicit initial state, entity id and variables")
        void shouldUseRequestParameters() {
            // Given
            BizFlowStartRequest request = BizFlowStartRequest.builder()
                    .definitionName("OrderApproval")
                    .initialState("Submitted")
                    .entityId("order-42")
                    .variables(Map.of("amount", 250, "channel", "web"))
                    .actor(BizFlowActor.of("alice", "Employee"))
                    .build();

            // When
            ProcessInstanceModel instance = runtime.start(request);

            // Then
            assertEquals("Submitted", instance.getCurrentState());
            assertEquals("order-42", instance.getEntityId().orElseThrow());
            assertEquals(250, instance.getVariables().get("amount"));
            assertEquals("alice", instance.getStateHistory().get(0).getActor());
        }

        @Test
        @DisplayName("should reject unknown definitions, unknown states and unsupported variables")
        void shouldRejectInvalidRequests() {
            // Given
            Map<String, Object> nested = new HashMap<>();
            nested.put("items", List.of(1, 2));

            // When / Then
            assertThrows(ProcessDefinitionNotFound.class, () -> start("Unknown"));
            assertThrows(ProcessStateNotFound.class, () -> runtime.start(BizFlowStartRequest.builder()
                    .definitionName("Simple").initialState("Archived").build()));
            assertThrows(IllegalArgumentException.class, () -> runtime.start(BizFlowStartRequest.builder()
                    .definitionName("Simple").variables(nested).build()));
            assertThrows(IllegalArgumentException.class, () -> runtime.start(null));
            assertTrue(runtime.listInstances().isEmpty());
        }

        @Test
        @DisplayName("should complete an instance started at a terminal state")
        void shouldCompleteWhenStartedAtTerminalState() {
            // When
            ProcessInstanceModel instance = runtime.start(BizFlowStartRequest.builder()
                    .definitionName("Simple").initialState("Closed").build());

            // Then
            assertEquals(BizFlowProcessStatus.COMPLETED, instance.getStatus());
            assertEquals("Closed", instance.getCurrentState());
            assertTrue(instance.getCompletedAt().isPresent());
            assertTrue(runtime.listTasksByInstance(instance.getInstanceId()).isEmpty());
            assertThrows(TerminalStateReachedException.class,
                    () -> runtime.executeTransition(instance.getInstanceId(), "close", CLERK));
        }

        @Test
        @DisplayName("should keep instances apart and list them by status and definition")
        void shouldListInstances() {
            // Given
            ProcessInstanceModel first = start("Simple");
            ProcessInstanceModel second = start("OrderApproval");
            runtime.terminate(second.getInstanceId(), "withdrawn");

            // Then
            assertEquals(2, runtime.listInstances().size());
            assertEquals(List.of(first.getInstanceId()), runtime.listInstancesByStatus(BizFlowProcessStatus.RUNNING)
                    .stream().map(ProcessInstanceModel::getInstanceId).collect(Collectors.toList()));
            assertEquals(1, runtime.listInstancesByDefinition("OrderApproval").size());
            assertTrue(runtime.listInstancesByDefinition("Expense").isEmpty());
            assertThrows(ProcessInstanceNotFound.class, () -> runtime.getInstance("instance-99"));
            assertThrows(TaskInstanceNotFound.class, () -> runtime.getTask("task-99"));
        }
    }

    // ========================================================================
    // TRANSITIONS
    // ========================================================================

    @Nested
    @DisplayName("Transitions")
    class TransitionTests {

        @Test
        @DisplayName("should move the instance and complete it at a terminal state")
        void shouldCompleteAtTerminalState() {
            // Given
            ProcessInstanceModel instance = start("Simple");

            // When
            ProcessInstanceModel closed = runtime.executeTransition(instance.getInstanceId(), "close", CLERK);

            // Then
            assertEquals("Closed", closed.getCurrentState());
            assertEquals(BizFlowProcessStatus.COMPLETED, closed.getStatus());
            assertTrue(closed.getCompletedAt().isPresent());
            assertTrue(closed.getVersion() > instance.getVersion());
            assertEquals(BizFlowTaskStatus.CANCELLED, taskFor(instance.getInstanceId(), "A").getStatus());
            ProcessInstanceModel.StateChangeEntry last = closed.getStateHistory().get(closed.getStateHistory().size() - 1);
            assertEquals("Open", last.getPreviousState());
            assertEquals("Closed", last.getNewState());
        }

        @Test
        @DisplayName("should reject any transition once the instance is completed")
        void shouldRejectTransitionAfterCompletion() {
            // Given
            String instanceId = start("Simple").getInstanceId();
            runtime.executeTransition(instanceId, "close", CLERK);

            // When
            TerminalStateReachedException error = assertThrows(TerminalStateReachedException.class,
                    () -> runtime.executeTransition(instanceId, "close", CLERK));

            // Then
            assertEquals(BizFlowErrorCodes.TERMINAL_STATE_REACHED, error.getErrorInfo());
            assertThrows(TerminalStateReachedException.class, () -> runtime.terminate(instanceId, "late"));
        }

        @Test
        @DisplayName("should let a supervising role execute a transition of its subordinate")
        void shouldAllowSupervisor() {
            // Given
            String instanceId = start("OrderApproval").getInstanceId();

            // When
            ProcessInstanceModel submitted = runtime.executeTransition(instanceId, "submit", MANAGER);

            // Then
            assertEquals("Submitted", submitted.getCurrentState());
            assertEquals("Approved", runtime.executeTransition(instanceId, "approve",
                    BizFlowActor.role("Director")).getCurrentState());
        }

        @Test
        @DisplayName("should deny a subordinate or unknown role")
        void shouldDenySubordinate() {
            // Given
            String instanceId = start("OrderApproval").getInstanceId();
            runtime.executeTransition(instanceId, "submit", EMPLOYEE);

            // When
            BizFlowAuthorizationException error = assertThrows(BizFlowAuthorizationException.class,
                    () -> runtime.executeTransition(instanceId, "approve", EMPLOYEE));

            // Then
            assertEquals(BizFlowErrorCodes.ROLE_MISMATCH, error.getErrorInfo());
            assertEquals("Manager", error.getRequiredRole());
            assertThrows(BizFlowAuthorizationException.class,
                    () -> runtime.executeTransition(instanceId, "approve", BizFlowActor.role("Auditor")));
            assertThrows(BizFlowAuthorizationException.class,
                    () -> runtime.executeTransition(instanceId, "approve", BizFlowActor.user("bob")));
            assertEquals("Submitted", runtime.getInstance(instanceId).getCurrentState());
        }

        @Test
        @DisplayName("should reject transitions that do not leave the current state")
        void shouldRejectTransitionFromOtherState() {
            // Given
            String instanceId = start("OrderApproval").getInstanceId();

            // When / Then
            InvalidTransitionException wrongState = assertThrows(InvalidTransitionException.class,
                    () -> runtime.executeTransition(instanceId, "approve", MANAGER));
            assertEquals(BizFlowErrorCodes.INVALID_TRANSITION, wrongState.getErrorInfo());
            assertThrows(InvalidTransitionException.class,
                    () -> runtime.executeTransition(instanceId, "publish", MANAGER));
        }

        @Test
        @DisplayName("should allow a transition back to an earlier state")
        void shouldAllowRework() {
            // Given
            String instanceId = start("OrderApproval").getInstanceId();
            runtime.executeTransition(instanceId, "submit", EMPLOYEE);

            // When
            ProcessInstanceModel reworked = runtime.executeTransition(instanceId, "rework", MANAGER);

            // Then
            assertEquals("Draft", reworked.getCurrentState());
            assertEquals(BizFlowProcessStatus.RUNNING, reworked.getStatus());
            assertEquals(3, reworked.getStateHistory().size());
        }
    }

    // ========================================================================
    // TASKS
    // ========================================================================

    @Nested
    @DisplayName("Task lifecycle")
    class TaskTests {

        @Test
        @DisplayName("should create the next task once its dependency completes")
        void shouldScheduleDependentStep() {
            // Given
            String instanceId = start("Simple").getInstanceId();
            TaskInstanceModel taskA = taskFor(instanceId, "A");

            // When
            TaskInstanceModel completed = runtime.completeTask(taskA.getTaskId(), CLERK, Map.of("note", "done"));

            // Then
            assertEquals(BizFlowTaskStatus.COMPLETED, completed.getStatus());
            assertEquals("role:Clerk", completed.getCompletedBy().orElseThrow());
            assertEquals("done", completed.getData().get("note"));
            assertTrue(completed.getCompletedAt().isPresent());
            assertEquals(List.of("A", "B"), stepNames(instanceId));
            assertEquals(BizFlowTaskStatus.PENDING, taskFor(instanceId, "B").getStatus());
            assertEquals("Open", runtime.getInstance(instanceId).getCurrentState());
        }

        @Test
        @DisplayName("should give a task to the first claimant only")
        void shouldClaimOnce() {
            // Given
            String taskId = taskFor(start("Simple").getInstanceId(), "A").getTaskId();

            // When
            TaskInstanceModel claimed = runtime.claimTask(taskId, "alice");
            TaskInstanceModel again = runtime.claimTask(taskId, "alice");
            BizFlowAuthorizationException error = assertThrows(BizFlowAuthorizationException.class,
                    () -> runtime.claimTask(taskId, "bob"));

            // Then
            assertEquals(BizFlowTaskStatus.IN_PROGRESS, claimed.getStatus());
            assertEquals("alice", claimed.getAssignedUser().orElseThrow());
            assertTrue(claimed.getClaimedAt().isPresent());
            assertEquals(claimed.getClaimedAt(), again.getClaimedAt());
            assertEquals(BizFlowErrorCodes.TASK_CLAIMED_BY_ANOTHER_USER, error.getErrorInfo());
            assertEquals("alice", runtime.getTask(taskId).getAssignedUser().orElseThrow());
            assertThrows(IllegalArgumentException.class, () -> runtime.claimTask(taskId, " "));
        }

        @Test
        @DisplayName("should let only the claimant complete a claimed task")
        void shouldRestrictClaimedTask() {
            // Given
            String taskId = taskFor(start("Simple").getInstanceId(), "A").getTaskId();
            runtime.claimTask(taskId, "alice");

            // When
            BizFlowAuthorizationException error = assertThrows(BizFlowAuthorizationException.class,
                    () -> runtime.completeTask(taskId, BizFlowActor.of("bob", "Clerk"), Map.of()));
            TaskInstanceModel completed = runtime.completeTask(taskId, BizFlowActor.user("alice"), null);

            // Then
            assertEquals(BizFlowErrorCodes.ROLE_MISMATCH, error.getErrorInfo());
            assertEquals("alice", completed.getCompletedBy().orElseThrow());
        }

        @Test
        @DisplayName("should let a supervisor complete an unclaimed task but not a subordinate")
        void shouldAuthorizeUnclaimedTaskByRole() {
            // Given
            String instanceId = start("OrderApproval").getInstanceId();
            String fillForm = taskFor(instanceId, "FillForm").getTaskId();
            runtime.completeTask(fillForm, MANAGER, Map.of("amount", 10));
            String review = taskFor(instanceId, "Review").getTaskId();

            // When / Then
            assertThrows(BizFlowAuthorizationException.class, () -> runtime.completeTask(review, EMPLOYEE, Map.of()));
            assertThrows(BizFlowAuthorizationException.class, () -> runtime.completeTask(review, null, Map.of()));
            assertEquals(BizFlowTaskStatus.COMPLETED,
                    runtime.completeTask(review, BizFlowActor.role("Director"), Map.of()).getStatus());
        }

        @Test
        @DisplayName("should reject finishing a task twice")
        void shouldRejectFinishedTask() {
            // Given
            String taskId = taskFor(start("Simple").getInstanceId(), "A").getTaskId();
            runtime.completeTask(taskId, CLERK, Map.of());

            // When
            InvalidTaskStateException error = assertThrows(InvalidTaskStateException.class,
                    () -> runtime.completeTask(taskId, CLERK, Map.of()));

            // Then
            assertEquals(BizFlowErrorCodes.INVALID_TASK_STATE, error.getErrorInfo());
            assertThrows(InvalidTaskStateException.class, () -> runtime.skipTask(taskId, CLERK, "again"));
            assertThrows(InvalidTaskStateException.class, () -> runtime.claimTask(taskId, "alice"));
        }

        @Test
        @DisplayName("should unblock dependents when a task is skipped")
        void shouldSkipTask() {
            // Given
            String instanceId = start("Simple").getInstanceId();
            String taskId = taskFor(instanceId, "A").getTaskId();

            // When
            TaskInstanceModel skipped = runtime.skipTask(taskId, CLERK, "not needed");

            // Then
            assertEquals(BizFlowTaskStatus.SKIPPED, skipped.getStatus());
            assertEquals("not needed", skipped.getData().get(ProcessInstanceRuntime.SKIP_REASON_KEY));
            assertEquals(BizFlowTaskStatus.PENDING, taskFor(instanceId, "B").getStatus());
        }

        @Test
        @DisplayName("should not follow branches of a skipped task")
        void shouldNotBranchOnSkip() {
            // Given
            String instanceId = start("Expense").getInstanceId();
            String prepare = taskFor(instanceId, "Prepare").getTaskId();

            // When
            runtime.skipTask(prepare, EMPLOYEE, null);

            // Then
            assertEquals("Draft", runtime.getInstance(instanceId).getCurrentState());
            assertEquals(List.of("Prepare", "Notify"), stepNames(instanceId));
        }

        @Test
        @DisplayName("should cancel open tasks when the instance is terminated")
        void shouldCancelOpenTasksOnTerminate() {
            // Given
            String instanceId = start("Simple").getInstanceId();
            String taskId = taskFor(instanceId, "A").getTaskId();

            // When
            ProcessInstanceModel terminated = runtime.terminate(instanceId, "customer left");

            // Then
            assertEquals(BizFlowProcessStatus.TERMINATED, terminated.getStatus());
            assertEquals("customer left", terminated.getEndReason().orElseThrow());
            TaskInstanceModel task = runtime.getTask(taskId);
            assertEquals(BizFlowTaskStatus.CANCELLED, task.getStatus());
            assertEquals("system", task.getCompletedBy().orElseThrow());
            assertThrows(InvalidTaskStateException.class, () -> runtime.completeTask(taskId, CLERK, Map.of()));
        }

        @Test
        @DisplayName("should keep open tasks but refuse work on them when cancellation is disabled")
        void shouldKeepOpenTasksWhenConfigured() {
            // Given
            ProcessInstanceRuntime keeping = BizFlowTestFixtures.engine(BizFlowRuntimeConfig.builder()
                    .cancelOpenTasksOnTerminal(false)
                    .build()).getRuntime();
            String instanceId = keeping.start(BizFlowStartRequest.of("Simple")).getInstanceId();
            String taskId = keeping.listTasksByInstance(instanceId).get(0).getTaskId();

            // When
            ProcessInstanceModel failed = keeping.fail(instanceId, "backend down");

            // Then
            assertEquals(BizFlowProcessStatus.ERROR, failed.getStatus());
            assertEquals(BizFlowTaskStatus.PENDING, keeping.getTask(taskId).getStatus());
            assertThrows(TerminalStateReachedException.class, () -> keeping.completeTask(taskId, CLERK, Map.of()));
            assertThrows(TerminalStateReachedException.class, () -> keeping.claimTask(taskId, "alice"));
            assertTrue(keeping.getTask(taskId).getAssignedUser().isEmpty());
        }

        @Test
        @DisplayName("should raise the version on every change")
        void shouldIncreaseVersion() {
            // Given
            String instanceId = start("Simple").getInstanceId();
            String taskId = taskFor(instanceId, "A").getTaskId();

            // When
            runtime.claimTask(taskId, "alice");
            long afterClaim = runtime.getInstance(instanceId).getVersion();
            runtime.completeTask(taskId, BizFlowActor.user("alice"), Map.of());
            long afterComplete = runtime.getInstance(instanceId).getVersion();

            // Then
            assertEquals(2L, afterClaim);
            assertEquals(3L, afterComplete);
            assertTrue(runtime.getTask(taskId).getVersion() > 2L);
        }
    }

    // ========================================================================
    // BRANCHES AND AUTO STEPS
    // ========================================================================

    @Nested
    @DisplayName("Branches and auto steps")
    class BranchTests {

        @Test
        @DisplayName("should activate a step outside the flow when its condition holds")
        void shouldActivateStep() {
            // Given
            String instanceId = start("Expense").getInstanceId();
            String prepare = taskFor(instanceId, "Prepare").getTaskId();

            // When
            runtime.completeTask(prepare, EMPLOYEE, Map.of("amount", 5000));

            // Then
            assertEquals("Draft", runtime.getInstance(instanceId).getCurrentState());
            assertEquals(BizFlowTaskStatus.PENDING, taskFor(instanceId, "ManagerReview").getStatus());
            TaskInstanceModel notify = taskFor(instanceId, "Notify");
            assertEquals(BizFlowTaskStatus.COMPLETED, notify.getStatus());
            assertTrue(notify.isAuto());
            assertEquals("system", notify.getCompletedBy().orElseThrow());
        }

        @Test
        @DisplayName("should fall through to the unconditional transition branch")
        void shouldApplyTransitionBranch() {
            // Given
            String instanceId = start("Expense").getInstanceId();
            String prepare = taskFor(instanceId, "Prepare").getTaskId();

            // When
            runtime.completeTask(prepare, EMPLOYEE, Map.of("amount", 500));

            // Then
            ProcessInstanceModel instance = runtime.getInstance(instanceId);
            assertEquals("Submitted", instance.getCurrentState());
            assertEquals("system", instance.getStateHistory().get(instance.getStateHistory().size() - 1).getActor());
            assertFalse(stepNames(instanceId).contains("ManagerReview"));
            assertTrue(runtime.getWarnings(instanceId).isEmpty());
        }

        @Test
        @DisplayName("should record a warning when a condition cannot be evaluated and treat it as false")
        void shouldWarnOnConditionFailure() {
            // Given
            String instanceId = start("Expense").getInstanceId();
            String prepare = taskFor(instanceId, "Prepare").getTaskId();

            // When
            runtime.completeTask(prepare, EMPLOYEE, Map.of());

            // Then
            assertEquals("Submitted", runtime.getInstance(instanceId).getCurrentState());
            List<BizFlowSideEffectWarning> warnings = runtime.getWarnings(instanceId);
            assertEquals(1, warnings.size());
            assertEquals(ProcessInstanceRuntime.BRANCH_SOURCE, warnings.get(0).source());
            assertEquals(prepare, warnings.get(0).taskId());
            assertTrue(warnings.get(0).message().contains("output.amount > 1000"));
        }

        @Test
        @DisplayName("should run chained auto steps until a human step is reached")
        void shouldCascadeAutoSteps() {
            // When
            String instanceId = start("Pipeline").getInstanceId();

            // Then
            assertEquals(List.of("Ingest", "Transform", "Check"), stepNames(instanceId));
            assertEquals(BizFlowTaskStatus.COMPLETED, taskFor(instanceId, "Ingest").getStatus());
            assertEquals(BizFlowTaskStatus.COMPLETED, taskFor(instanceId, "Transform").getStatus());
            assertEquals(BizFlowTaskStatus.PENDING, taskFor(instanceId, "Check").getStatus());
        }

        @Test
        @DisplayName("should complete the instance through an auto step's transition branch")
        void shouldCompleteThroughAutoStep() {
            // Given
            String instanceId = start("Pipeline").getInstanceId();
            String check = taskFor(instanceId, "Check").getTaskId();

            // When
            runtime.completeTask(check, OPERATOR, Map.of("ok", true));

            // Then
            ProcessInstanceModel instance = runtime.getInstance(instanceId);
            assertEquals("Done", instance.getCurrentState());
            assertEquals(BizFlowProcessStatus.COMPLETED, instance.getStatus());
            assertEquals(BizFlowTaskStatus.COMPLETED, taskFor(instanceId, "Publish").getStatus());
        }
    }

    // ========================================================================
    // TASK QUERIES
    // ========================================================================

    @Nested
    @DisplayName("Task queries")
    class TaskQueryTests {

        @Test
        @DisplayName("should list open tasks of a role and of the roles it supervises")
        void shouldListTasksByRole() {
            // Given
            String instanceId = start("OrderApproval").getInstanceId();
            start("Simple");

            // When
            List<TaskInstanceModel> employeeTasks = runtime.listTasksByRole("OrderApproval", "Employee");
            List<TaskInstanceModel> directorTasks = runtime.listTasksByRole("OrderApproval", "Director");

            // Then
            assertEquals(1, employeeTasks.size());
            assertEquals("FillForm", employeeTasks.get(0).getStepName());
            assertEquals(1, directorTasks.size());
            assertEquals(instanceId, directorTasks.get(0).getInstanceId());
            assertTrue(runtime.listTasksByRole("OrderApproval", "Clerk").isEmpty());
            assertTrue(runtime.listTasksByRole("Simple", "Employee").isEmpty());
        }

        @Test
        @DisplayName("should drop finished tasks from the role listing")
        void shouldHideFinishedTasks() {
            // Given
            String instanceId = start("OrderApproval").getInstanceId();
            runtime.completeTask(taskFor(instanceId, "FillForm").getTaskId(), EMPLOYEE, Map.of());

            // When
            List<TaskInstanceModel> managerTasks = runtime.listTasksByRole("OrderApproval", "Manager");

            // Then
            assertEquals(List.of("Review"), managerTasks.stream()
                    .map(TaskInstanceModel::getStepName).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("should list the open tasks a user has claimed")
        void shouldListTasksByUser() {
            // Given
            String first = taskFor(start("Simple").getInstanceId(), "A").getTaskId();
            String second = taskFor(start("Simple").getInstanceId(), "A").getTaskId();
            runtime.claimTask(first, "alice");
            runtime.claimTask(second, "alice");
            runtime.completeTask(second, BizFlowActor.user("alice"), Map.of());

            // When
            List<TaskInstanceModel> aliceTasks = runtime.listTasksByUser("alice");

            // Then
            assertEquals(List.of(first), aliceTasks.stream()
                    .map(TaskInstanceModel::getTaskId).collect(Collectors.toList()));
            assertTrue(runtime.listTasksByUser("bob").isEmpty());
        }
    }

    @Test
    @DisplayName("should keep running instances on the definition they started with")
    void shouldPinDefinitionAtStart() {
        // Given
        BizFlowProcessEngine engine = BizFlowTestFixtures.engine();
        String instanceId = engine.getRuntime().start(BizFlowStartRequest.of("Simple")).getInstanceId();

        // When
        engine.reloadDefinitions(BizFlowTestFixtures.document(BizFlowTestFixtures.simpleProcess("Other")));

        // Then
        String taskId = engine.getRuntime().listTasksByInstance(instanceId).get(0).getTaskId();
        engine.getRuntime().completeTask(taskId, CLERK, Map.of());
        assertEquals(List.of("A", "B"), engine.getRuntime().listTasksByInstance(instanceId).stream()
                .map(TaskInstanceModel::getStepName).collect(Collectors.toList()));
        assertEquals("Closed", engine.getRuntime().executeTransition(instanceId, "close", CLERK).getCurrentState());
        assertThrows(ProcessDefinitionNotFound.class,
                () -> engine.getRuntime().start(BizFlowStartRequest.of("Simple")));
    }
}
