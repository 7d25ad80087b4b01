package com.bizflow.process.core.engine.runtime;

import com.bizflow.process.core.engine.authorization.TaskAuthorizer;
import com.bizflow.process.core.engine.authorization.TransitionAuthorizer;
import com.bizflow.process.core.engine.config.BizFlowRuntimeConfig;
import com.bizflow.process.core.engine.expression.BranchConditionEvaluator;
import com.bizflow.process.core.engine.lock.IBizFlowInstanceLockService;
import com.bizflow.process.core.engine.registry.ProcessDefinitionRegistryHolder;
import com.bizflow.process.core.engine.scheduling.TaskScheduler;
import com.bizflow.process.core.engine.sideeffect.BizFlowSideEffectDispatcher;
import com.bizflow.process.core.engine.sideeffect.SideEffectWarningRecorder;
import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.authorization.BizFlowAuthorizationException;
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
import com.bizflow.process.integration.enumerations.BizFlowSideEffectType;
import com.bizflow.process.integration.enumerations.BizFlowTaskStatus;
import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.definition.RoleDefinition;
import com.bizflow.process.integration.models.definition.StateDefinition;
import com.bizflow.process.integration.models.definition.StepBranchDefinition;
import com.bizflow.process.integration.models.definition.StepDefinition;
import com.bizflow.process.integration.models.definition.TransitionDefinition;
import com.bizflow.process.integration.models.instance.ProcessInstanceModel;
import com.bizflow.process.integration.models.instance.TaskInstanceModel;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Drives process instances through their states and their tasks through the task lifecycle.
 *
 * <p>Every mutating operation runs under the instance lock, commits a new snapshot with a
 * higher version and, once the lock is released, hands the committed changes to the side-effect
 * dispatcher. Reads never lock; they see the latest committed snapshot.</p>
 *
 * <p>After a task completes (or is skipped) the runtime schedules every newly eligible step.
 * Auto steps complete on creation and may make further steps eligible, so scheduling repeats
 * until no auto step completes. Scheduling only runs while the instance is RUNNING; a resumed
 * instance catches up on what was deferred.</p>
 */
@Slf4j
public class ProcessInstanceRuntime {

    public static final String SKIP_REASON_KEY = "skipReason";
    static final String BRANCH_SOURCE = "onComplete";

    private static final Comparator<ProcessInstanceModel> INSTANCE_ORDER =
            Comparator.comparing(ProcessInstanceModel::getCreatedAt).thenComparing(ProcessInstanceModel::getInstanceId);
    private static final Comparator<TaskInstanceModel> TASK_ORDER =
            Comparator.comparing(TaskInstanceModel::getCreatedAt).thenComparing(TaskInstanceModel::getTaskId);

    private final ProcessDefinitionRegistryHolder registryHolder;
    private final BranchConditionEvaluator conditionEvaluator;
    private final IBizFlowInstanceLockService lockService;
    private final BizFlowSideEffectDispatcher dispatcher;
    private final SideEffectWarningRecorder warningRecorder;
    private final BizFlowRuntimeConfig config;
    private final TransitionAuthorizer transitionAuthorizer = new TransitionAuthorizer();
    private final TaskAuthorizer taskAuthorizer = new TaskAuthorizer();
    private final TaskScheduler taskScheduler = new TaskScheduler();

    private final Map<String, ProcessInstanceEntry> instances = new ConcurrentHashMap<>();
    private final Map<String, TaskInstanceEntry> tasks = new ConcurrentHashMap<>();
    private final AtomicLong instanceIdCounter = new AtomicLong(0);
    private final AtomicLong taskIdCounter = new AtomicLong(0);

    public ProcessInstanceRuntime(ProcessDefinitionRegistryHolder registryHolder,
                                  BranchConditionEvaluator conditionEvaluator,
                                  IBizFlowInstanceLockService lockService,
                                  BizFlowSideEffectDispatcher dispatcher,
                                  SideEffectWarningRecorder warningRecorder,
                                  BizFlowRuntimeConfig config) {
        config.validate();
        this.registryHolder = registryHolder;
        this.conditionEvaluator = conditionEvaluator;
        this.lockService = lockService;
        this.dispatcher = dispatcher;
        this.warningRecorder = warningRecorder;
        this.config = config;
    }

    // ========================================================================
    // INSTANCE LIFECYCLE
    // ========================================================================

    /**
     * Starts an instance of a registered definition and creates the tasks of its first eligible steps.
     * An instance started at a state without outgoing transitions is completed at once.
     *
     * @throws com.bizflow.process.core.exception.reference.ProcessDefinitionNotFound if the definition is not registered
     * @throws ProcessStateNotFound     if an explicit initial state is not declared
     * @throws IllegalArgumentException if a variable has an unsupported value
     */
    public ProcessInstanceModel start(BizFlowStartRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Start request cannot be null");
        }
        ProcessDefinition definition = registryHolder.current().get(request.definitionName());
        int initialStateIndex = resolveInitialState(definition, request.initialState());
        Map<String, Object> variables = ProcessVariables.validate(request.variables());
        BizFlowActor actor = request.actor() != null ? request.actor() : BizFlowActor.system();

        String instanceId = config.getInstanceIdPrefix() + instanceIdCounter.incrementAndGet();
        ProcessInstanceEntry entry = new ProcessInstanceEntry(instanceId, definition, initialStateIndex,
                request.entityId(), variables, Instant.now());

        ProcessInstanceModel snapshot = mutate(entry, mutation -> {
            entry.recordChange(null, ProcessDefinition.NO_REFERENCE, actor, "started", mutation.now());
            mutation.instanceEffect(BizFlowSideEffectType.INSTANCE_STARTED, actor);
            if (definition.getState(initialStateIndex).isTerminal()) {
                entry.setStatus(BizFlowProcessStatus.COMPLETED);
                entry.setCompletedAt(mutation.now());
                entry.recordChange(BizFlowProcessStatus.RUNNING, initialStateIndex, actor,
                        "started at terminal state", mutation.now());
                mutation.instanceEffect(BizFlowSideEffectType.INSTANCE_COMPLETED, actor);
            }
            schedule(mutation);
            ProcessInstanceModel committed = mutation.commit();
            instances.put(instanceId, entry);
            return committed;
        });
        log.info("Started process instance: {} ({}) at state [{}] with {} task(s)",
                instanceId, definition.getName(), snapshot.getCurrentState(), snapshot.getTaskIds().size());
        return snapshot;
    }

    /**
     * Moves the instance along the named transition on behalf of the actor's role.
     */
    public ProcessInstanceModel executeTransition(String instanceId, String transitionName, BizFlowActor actor) {
        ProcessInstanceEntry entry = requireInstance(instanceId);
        return mutate(entry, mutation -> {
            if (entry.getStatus().isTerminal()) {
                throw new TerminalStateReachedException(instanceId, entry.getStatus(), "executeTransition");
            }
            if (entry.getStatus() == BizFlowProcessStatus.SUSPENDED) {
                throw InvalidTransitionException.suspended(instanceId, transitionName);
            }
            ProcessDefinition definition = entry.getDefinition();
            TransitionDefinition transition = definition.findTransition(transitionName)
                    .filter(candidate -> candidate.getFromStateIndex() == entry.getCurrentStateIndex())
                    .orElseThrow(() -> InvalidTransitionException.notFromCurrentState(
                            instanceId, transitionName, entry.currentStateName()));
            String actingRole = actor != null ? actor.role() : null;
            if (!transitionAuthorizer.authorize(definition, transition, actingRole)) {
                String requiredRole = definition.roleName(transition.getRoleIndex());
                log.warn("Transition [{}] on instance {} denied: role [{}] is not [{}] or its supervisor",
                        transitionName, instanceId, actingRole, requiredRole);
                throw BizFlowAuthorizationException.roleMismatch(transitionName, actingRole, requiredRole);
            }
            moveAlong(mutation, transition, actor, "transition " + transitionName);
            return mutation.commit();
        });
    }

    public ProcessInstanceModel terminate(String instanceId, String reason) {
        return changeStatus(instanceId, BizFlowActor.system(), endWith(instanceId, "terminate",
                BizFlowProcessStatus.TERMINATED, reason, BizFlowSideEffectType.INSTANCE_TERMINATED));
    }

    public ProcessInstanceModel fail(String instanceId, String reason) {
        return changeStatus(instanceId, BizFlowActor.system(), endWith(instanceId, "fail",
                BizFlowProcessStatus.ERROR, reason, BizFlowSideEffectType.INSTANCE_FAILED));
    }

    /**
     * Applies the status change decided by {@code rule} under the instance lock. Moving to a terminal
     * status ends the instance; moving back to RUNNING resumes scheduling.
     */
    public ProcessInstanceModel changeStatus(String instanceId, BizFlowActor actor, IStatusChangeRule rule) {
        ProcessInstanceEntry entry = requireInstance(instanceId);
        return mutate(entry, mutation -> {
            Optional<StatusChange> change = rule.evaluate(entry.getSnapshot());
            if (change.isEmpty()) {
                log.debug("Status of instance {} left at {}", instanceId, entry.getStatus());
                return entry.getSnapshot();
            }
            applyStatusChange(mutation, change.get(), actor);
            return mutation.commit();
        });
    }

    // ========================================================================
    // TASK LIFECYCLE
    // ========================================================================

    /**
     * Assigns the task to the user. The first claim wins; a repeated claim by the holder is a no-op.
     */
    public TaskInstanceModel claimTask(String taskId, String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be empty");
        }
        TaskInstanceEntry task = requireTask(taskId);
        ProcessInstanceEntry entry = requireInstance(task.getInstanceId());
        return mutate(entry, mutation -> {
            if (task.getStatus().isTerminal()) {
                throw new InvalidTaskStateException(taskId, task.getStatus(), "claimTask");
            }
            if (entry.getStatus().isTerminal()) {
                throw new TerminalStateReachedException(entry.getInstanceId(), entry.getStatus(), "claimTask");
            }
            if (!task.tryAssign(userId) && !userId.equals(task.currentAssignee())) {
                log.warn("Claim of task {} by {} rejected, held by {}", taskId, userId, task.currentAssignee());
                throw BizFlowAuthorizationException.claimedByAnother(taskId, userId, task.currentAssignee());
            }
            if (task.getStatus() == BizFlowTaskStatus.PENDING) {
                task.setStatus(BizFlowTaskStatus.IN_PROGRESS);
                task.setClaimedAt(mutation.now());
                mutation.taskEffect(BizFlowSideEffectType.TASK_CLAIMED, task, BizFlowActor.user(userId));
                log.info("Task {} ({}) claimed by {}", taskId, task.getStepName(), userId);
            }
            mutation.commit();
            return task.getSnapshot();
        });
    }

    /**
     * Completes an open task, merges {@code output} into its data, follows the step's
     * {@code onComplete} branches and schedules the steps it unblocks.
     */
    public TaskInstanceModel completeTask(String taskId, BizFlowActor actor, Map<String, Object> output) {
        TaskInstanceEntry task = requireTask(taskId);
        ProcessInstanceEntry entry = requireInstance(task.getInstanceId());
        Map<String, Object> taskOutput = output == null ? Map.of() : output;
        return mutate(entry, mutation -> {
            checkCanFinish(entry, task, actor, "completeTask");
            task.getData().putAll(taskOutput);
            task.finish(BizFlowTaskStatus.COMPLETED, actor.displayName(), mutation.now());
            mutation.taskEffect(BizFlowSideEffectType.TASK_COMPLETED, task, actor);
            log.info("Task {} ({}) completed by {}", taskId, task.getStepName(), actor.displayName());
            applyBranches(mutation, task, taskOutput);
            schedule(mutation);
            mutation.commit();
            return task.getSnapshot();
        });
    }

    /**
     * Closes an open task without doing it. Dependents are unblocked as on completion;
     * {@code onComplete} branches are not followed.
     */
    public TaskInstanceModel skipTask(String taskId, BizFlowActor actor, String reason) {
        TaskInstanceEntry task = requireTask(taskId);
        ProcessInstanceEntry entry = requireInstance(task.getInstanceId());
        return mutate(entry, mutation -> {
            checkCanFinish(entry, task, actor, "skipTask");
            if (reason != null) {
                task.getData().put(SKIP_REASON_KEY, reason);
            }
            task.finish(BizFlowTaskStatus.SKIPPED, actor.displayName(), mutation.now());
            mutation.taskEffect(BizFlowSideEffectType.TASK_SKIPPED, task, actor);
            log.info("Task {} ({}) skipped by {}: {}", taskId, task.getStepName(), actor.displayName(), reason);
            schedule(mutation);
            mutation.commit();
            return task.getSnapshot();
        });
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    public ProcessInstanceModel getInstance(String instanceId) {
        return requireInstance(instanceId).getSnapshot();
    }

    public List<ProcessInstanceModel> listInstances() {
        return listInstances(instance -> true);
    }

    public List<ProcessInstanceModel> listInstancesByStatus(BizFlowProcessStatus status) {
        return listInstances(instance -> instance.getStatus() == status);
    }

    public List<ProcessInstanceModel> listInstancesByDefinition(String definitionName) {
        return listInstances(instance -> instance.getDefinitionName().equals(definitionName));
    }

    public TaskInstanceModel getTask(String taskId) {
        return requireTask(taskId).getSnapshot();
    }

    public List<TaskInstanceModel> listTasksByInstance(String instanceId) {
        return requireInstance(instanceId).getSnapshot().getTaskIds().stream()
                .map(tasks::get)
                .map(TaskInstanceEntry::getSnapshot)
                .collect(Collectors.toList());
    }

    /**
     * Open tasks of the definition's instances assigned to {@code role} or to a role it supervises.
     * Roles are resolved against each instance's pinned definition.
     */
    public List<TaskInstanceModel> listTasksByRole(String definitionName, String role) {
        return listTasks(task -> isVisibleToRole(task, definitionName, role));
    }

    /**
     * Open tasks claimed by the user.
     */
    public List<TaskInstanceModel> listTasksByUser(String userId) {
        return listTasks(task -> task.getAssignedUser().filter(userId::equals).isPresent());
    }

    public List<BizFlowSideEffectWarning> getWarnings(String instanceId) {
        requireInstance(instanceId);
        return warningRecorder.getWarnings(instanceId);
    }

    // ========================================================================
    // MUTATION SUPPORT
    // ========================================================================

    private <T> T mutate(ProcessInstanceEntry entry, Function<InstanceMutation, T> operation) {
        InstanceMutation mutation = new InstanceMutation(entry);
        T result = lockService.executeWithLock(entry.getInstanceId(), config.getLockTimeout(), () -> {
            T value = operation.apply(mutation);
            mutation.commit();
            return value;
        });
        dispatcher.dispatch(mutation.sideEffects());
        return result;
    }

    private void moveAlong(InstanceMutation mutation, TransitionDefinition transition, BizFlowActor actor, String reason) {
        ProcessInstanceEntry entry = mutation.entry();
        ProcessDefinition definition = entry.getDefinition();
        BizFlowProcessStatus previousStatus = entry.getStatus();
        int previousState = entry.getCurrentStateIndex();
        StateDefinition destination = definition.getState(transition.getToStateIndex());

        entry.setCurrentStateIndex(destination.getIndex());
        if (destination.isTerminal()) {
            entry.setStatus(BizFlowProcessStatus.COMPLETED);
            entry.setCompletedAt(mutation.now());
        }
        entry.recordChange(previousStatus, previousState, actor, reason, mutation.now());
        mutation.instanceEffect(BizFlowSideEffectType.TRANSITION_EXECUTED, actor);
        log.info("Instance {} moved [{}] -> [{}] via {} by {}", entry.getInstanceId(),
                definition.getState(previousState).getName(), destination.getName(), transition.getName(),
                actor != null ? actor.displayName() : null);

        if (destination.isTerminal()) {
            mutation.instanceEffect(BizFlowSideEffectType.INSTANCE_COMPLETED, actor);
            cancelOpenTasks(mutation);
            log.info("Instance {} completed at state [{}]", entry.getInstanceId(), destination.getName());
        }
    }

    private void applyStatusChange(InstanceMutation mutation, StatusChange change, BizFlowActor actor) {
        ProcessInstanceEntry entry = mutation.entry();
        BizFlowProcessStatus previousStatus = entry.getStatus();
        BizFlowProcessStatus newStatus = change.newStatus();

        entry.setStatus(newStatus);
        if (newStatus == BizFlowProcessStatus.SUSPENDED) {
            entry.setSuspendedAt(mutation.now());
            entry.setSuspensionReason(change.reason());
        } else if (previousStatus == BizFlowProcessStatus.SUSPENDED) {
            entry.setSuspendedAt(null);
            entry.setSuspensionReason(null);
        }
        if (newStatus.isTerminal()) {
            entry.setEndReason(change.reason());
            entry.setCompletedAt(mutation.now());
        }
        entry.recordChange(previousStatus, entry.getCurrentStateIndex(), actor, change.reason(), mutation.now());
        mutation.instanceEffect(change.effectType(), actor);
        log.info("Instance {} status {} -> {} ({})", entry.getInstanceId(), previousStatus, newStatus, change.reason());

        if (newStatus.isTerminal()) {
            cancelOpenTasks(mutation);
        } else if (newStatus == BizFlowProcessStatus.RUNNING) {
            schedule(mutation);
        }
    }

    private void cancelOpenTasks(InstanceMutation mutation) {
        if (!config.isCancelOpenTasksOnTerminal()) {
            return;
        }
        BizFlowActor system = BizFlowActor.system();
        for (TaskInstanceEntry task : mutation.entry().openTasks()) {
            task.finish(BizFlowTaskStatus.CANCELLED, system.displayName(), mutation.now());
            mutation.taskEffect(BizFlowSideEffectType.TASK_CANCELLED, task, system);
            log.debug("Cancelled open task {} ({})", task.getTaskId(), task.getStepName());
        }
    }

    // ========================================================================
    // SCHEDULING
    // ========================================================================

    private void schedule(InstanceMutation mutation) {
        ProcessInstanceEntry entry = mutation.entry();
        ProcessDefinition definition = entry.getDefinition();
        boolean progressed = true;
        while (progressed && entry.getStatus() == BizFlowProcessStatus.RUNNING) {
            progressed = false;
            List<StepDefinition> eligible = taskScheduler.eligibleSteps(definition, entry.satisfiedSteps(),
                    entry.materializedSteps(), entry.getActivatedSteps());
            for (StepDefinition step : eligible) {
                if (entry.getStatus() != BizFlowProcessStatus.RUNNING) {
                    break;
                }
                if (entry.hasTaskFor(step.getIndex())) {
                    continue;
                }
                TaskInstanceEntry task = createTask(mutation, step);
                if (step.isAuto()) {
                    BizFlowActor system = BizFlowActor.system();
                    task.finish(BizFlowTaskStatus.COMPLETED, system.displayName(), mutation.now());
                    mutation.taskEffect(BizFlowSideEffectType.AUTO_STEP_EXECUTED, task, system);
                    log.debug("Auto step {} executed for instance {}", step.getName(), entry.getInstanceId());
                    applyBranches(mutation, task, Map.of());
                    progressed = true;
                } else {
                    mutation.taskEffect(BizFlowSideEffectType.TASK_CREATED, task, BizFlowActor.system());
                }
            }
        }
    }

    private TaskInstanceEntry createTask(InstanceMutation mutation, StepDefinition step) {
        ProcessInstanceEntry entry = mutation.entry();
        String taskId = config.getTaskIdPrefix() + taskIdCounter.incrementAndGet();
        TaskInstanceEntry task = new TaskInstanceEntry(taskId, entry.getInstanceId(), step.getIndex(), step.getName(),
                entry.getDefinition().roleName(step.getRoleIndex()), step.isAuto(), BizFlowTaskStatus.PENDING,
                mutation.now());
        entry.addTask(task);
        tasks.put(taskId, task);
        log.debug("Created task {} for step {} of instance {}", taskId, step.getName(), entry.getInstanceId());
        return task;
    }

    // ========================================================================
    // BRANCHES
    // ========================================================================

    /**
     * Follows the first branch whose condition holds. A condition that cannot be evaluated counts
     * as not holding and is reported as a warning.
     */
    private void applyBranches(InstanceMutation mutation, TaskInstanceEntry task, Map<String, Object> output) {
        ProcessInstanceEntry entry = mutation.entry();
        ProcessDefinition definition = entry.getDefinition();
        StepDefinition step = definition.getStep(task.getStepIndex());
        for (StepBranchDefinition branch : step.getBranches()) {
            if (!matches(entry, task, branch, output)) {
                continue;
            }
            if (branch.getTargetKind() == StepBranchDefinition.TargetKind.TRANSITION) {
                TransitionDefinition transition = definition.getTransition(branch.getTargetIndex());
                if (entry.getStatus() == BizFlowProcessStatus.RUNNING
                        && transition.getFromStateIndex() == entry.getCurrentStateIndex()) {
                    moveAlong(mutation, transition, BizFlowActor.system(), "onComplete of step " + step.getName());
                } else {
                    warningRecorder.record(entry.getInstanceId(), task.getTaskId(), BRANCH_SOURCE,
                            "Transition [" + transition.getName() + "] not applied: instance is " + entry.getStatus()
                                    + " at state [" + entry.currentStateName() + "]");
                }
            } else {
                entry.getActivatedSteps().add(branch.getTargetIndex());
                log.debug("Step {} activated by completion of {} in instance {}",
                        definition.getStep(branch.getTargetIndex()).getName(), step.getName(), entry.getInstanceId());
            }
            return;
        }
    }

    private boolean matches(ProcessInstanceEntry entry, TaskInstanceEntry task, StepBranchDefinition branch,
                            Map<String, Object> output) {
        try {
            return conditionEvaluator.evaluate(branch.getCondition(), output, entry.getVariables(), task.attributes());
        } catch (BizFlowRuntimeException e) {
            String cause = e.getCause() != null ? e.getCause().getMessage() : e.getMessage();
            warningRecorder.record(entry.getInstanceId(), task.getTaskId(), BRANCH_SOURCE,
                    "Condition [" + branch.getCondition() + "] could not be evaluated: " + cause);
            return false;
        }
    }

    // ========================================================================
    // HELPERS
    // ========================================================================

    private void checkCanFinish(ProcessInstanceEntry entry, TaskInstanceEntry task, BizFlowActor actor, String operation) {
        if (!task.getStatus().isOpen()) {
            throw new InvalidTaskStateException(task.getTaskId(), task.getStatus(), operation);
        }
        if (entry.getStatus().isTerminal()) {
            throw new TerminalStateReachedException(entry.getInstanceId(), entry.getStatus(), operation);
        }
        String assignee = task.currentAssignee();
        if (!taskAuthorizer.canAct(entry.getDefinition(), task.getAssignedRole(), assignee, actor)) {
            log.warn("{} on task {} denied for {}", operation, task.getTaskId(), actor);
            if (assignee != null) {
                throw BizFlowAuthorizationException.notAssignee(task.getTaskId(),
                        actor != null ? actor.userId() : null, assignee);
            }
            throw BizFlowAuthorizationException.roleMismatch(task.getStepName(),
                    actor != null ? actor.role() : null, task.getAssignedRole());
        }
    }

    private IStatusChangeRule endWith(String instanceId, String operation, BizFlowProcessStatus status, String reason,
                                      BizFlowSideEffectType effectType) {
        return current -> {
            if (current.getStatus().isTerminal()) {
                throw new TerminalStateReachedException(instanceId, current.getStatus(), operation);
            }
            return Optional.of(new StatusChange(status, reason, effectType));
        };
    }

    private boolean isVisibleToRole(TaskInstanceModel task, String definitionName, String role) {
        ProcessInstanceEntry entry = instances.get(task.getInstanceId());
        if (entry == null || !entry.getDefinitionName().equals(definitionName) || task.getAssignedRole().isEmpty()) {
            return false;
        }
        ProcessDefinition definition = entry.getDefinition();
        Optional<RoleDefinition> acting = definition.findRole(role);
        Optional<RoleDefinition> assigned = definition.findRole(task.getAssignedRole().get());
        return acting.isPresent() && assigned.isPresent()
                && definition.getRoleHierarchy().visibleRoles(acting.get().getIndex()).contains(assigned.get().getIndex());
    }

    private List<ProcessInstanceModel> listInstances(Predicate<ProcessInstanceModel> filter) {
        return instances.values().stream()
                .map(ProcessInstanceEntry::getSnapshot)
                .filter(filter)
                .sorted(INSTANCE_ORDER)
                .collect(Collectors.toList());
    }

    private List<TaskInstanceModel> listTasks(Predicate<TaskInstanceModel> filter) {
        return tasks.values().stream()
                .map(TaskInstanceEntry::getSnapshot)
                .filter(task -> task.getStatus().isOpen())
                .filter(filter)
                .sorted(TASK_ORDER)
                .collect(Collectors.toList());
    }

    private static int resolveInitialState(ProcessDefinition definition, String initialState) {
        if (initialState == null) {
            return definition.getInitialStateIndex();
        }
        return definition.findState(initialState)
                .map(StateDefinition::getIndex)
                .orElseThrow(() -> new ProcessStateNotFound(definition.getName(), initialState));
    }

    private ProcessInstanceEntry requireInstance(String instanceId) {
        ProcessInstanceEntry entry = instanceId == null ? null : instances.get(instanceId);
        if (entry == null) {
            throw new ProcessInstanceNotFound(instanceId);
        }
        return entry;
    }

    private TaskInstanceEntry requireTask(String taskId) {
        TaskInstanceEntry task = taskId == null ? null : tasks.get(taskId);
        if (task == null) {
            throw new TaskInstanceNotFound(taskId);
        }
        return task;
    }
}
