package com.bizflow.process.core.engine.validation;

import com.bizflow.process.core.engine.validation.checks.InitialStates;
import com.bizflow.process.integration.enumerations.BizFlowFieldType;
import com.bizflow.process.integration.models.definition.EntityDefinition;
import com.bizflow.process.integration.models.definition.EntityFieldDefinition;
import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.definition.RoleDefinition;
import com.bizflow.process.integration.models.definition.StateDefinition;
import com.bizflow.process.integration.models.definition.StepBranchDefinition;
import com.bizflow.process.integration.models.definition.StepDefinition;
import com.bizflow.process.integration.models.definition.TransitionDefinition;
import com.bizflow.process.integration.models.source.BranchSource;
import com.bizflow.process.integration.models.source.EntityFieldSource;
import com.bizflow.process.integration.models.source.EntitySource;
import com.bizflow.process.integration.models.source.ProjectInfoSource;
import com.bizflow.process.integration.models.source.RoleSource;
import com.bizflow.process.integration.models.source.StateSource;
import com.bizflow.process.integration.models.source.StepSource;
import com.bizflow.process.integration.models.source.TransitionSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Turns a process block that passed every check into its immutable, index-based form.
 * Calling it on a block with violations is a programming error.
 */
final class ProcessDefinitionAssembler {

    private ProcessDefinitionAssembler() {
    }

    static ProcessDefinition assemble(ProjectInfoSource project, ProcessSourceView process) {
        List<TransitionDefinition> transitions = transitions(process);
        int initialStateIndex = resolve(process.stateIndex(InitialStates.resolve(process)));
        List<Integer> flow = flow(process);

        return ProcessDefinition.builder()
                .name(process.getName())
                .projectName(project.getName())
                .description(project.getDescription())
                .version(project.getVersion())
                .author(project.getAuthor())
                .entities(entities(process))
                .roles(roles(process))
                .states(states(process, transitions, initialStateIndex))
                .steps(steps(process, flow))
                .transitions(transitions)
                .flow(flow)
                .initialStateIndex(initialStateIndex)
                .build();
    }

    private static List<EntityDefinition> entities(ProcessSourceView process) {
        List<EntityDefinition> entities = new ArrayList<>();
        for (int index = 0; index < process.getEntities().size(); index++) {
            EntitySource entity = process.getEntities().get(index);
            List<EntityFieldDefinition> fields = new ArrayList<>();
            for (EntityFieldSource field : ProcessSourceView.fieldsOf(entity)) {
                fields.add(EntityFieldDefinition.builder()
                        .name(field.getName())
                        .type(BizFlowFieldType.fromKeyword(field.getType()).orElseThrow())
                        .variants(List.copyOf(ProcessSourceView.nullSafe(field.getVariants())))
                        .build());
            }
            entities.add(EntityDefinition.builder()
                    .index(index)
                    .name(entity.getName())
                    .fields(List.copyOf(fields))
                    .build());
        }
        return entities;
    }

    private static List<RoleDefinition> roles(ProcessSourceView process) {
        List<RoleSource> sources = process.getRoles();
        int[] supervisors = new int[sources.size()];
        Arrays.fill(supervisors, ProcessDefinition.NO_REFERENCE);
        for (int supervisor = 0; supervisor < sources.size(); supervisor++) {
            for (String supervised : ProcessSourceView.supervisedBy(sources.get(supervisor))) {
                supervisors[resolve(process.roleIndex(supervised))] = supervisor;
            }
        }
        List<RoleDefinition> roles = new ArrayList<>();
        for (int index = 0; index < sources.size(); index++) {
            roles.add(RoleDefinition.builder()
                    .index(index)
                    .name(sources.get(index).getName())
                    .supervisorIndex(supervisors[index])
                    .build());
        }
        return roles;
    }

    private static List<TransitionDefinition> transitions(ProcessSourceView process) {
        List<TransitionDefinition> transitions = new ArrayList<>();
        for (int index = 0; index < process.getTransitions().size(); index++) {
            TransitionSource transition = process.getTransitions().get(index);
            transitions.add(TransitionDefinition.builder()
                    .index(index)
                    .name(transition.getName())
                    .fromStateIndex(resolve(process.stateIndex(transition.getFrom())))
                    .toStateIndex(resolve(process.stateIndex(transition.getTo())))
                    .roleIndex(resolve(process.roleIndex(transition.getBy())))
                    .build());
        }
        return transitions;
    }

    private static List<StateDefinition> states(ProcessSourceView process, List<TransitionDefinition> transitions,
                                                int initialStateIndex) {
        Set<Integer> withOutgoing = new HashSet<>();
        transitions.forEach(transition -> withOutgoing.add(transition.getFromStateIndex()));
        List<StateDefinition> states = new ArrayList<>();
        for (int index = 0; index < process.getStates().size(); index++) {
            StateSource state = process.getStates().get(index);
            states.add(StateDefinition.builder()
                    .index(index)
                    .name(state.getName())
                    .initial(index == initialStateIndex)
                    .terminal(!withOutgoing.contains(index))
                    .build());
        }
        return states;
    }

    /**
     * Flow as step indexes. Without a declared flow every step is scheduled, in declaration
     * order except that a step never precedes its dependencies.
     */
    /**
     * The declared flow, or else a dependency order that always takes the lowest-indexed ready step next.
     */
    private static List<Integer> flow(ProcessSourceView process) {
        List<Integer> flow = new ArrayList<>();
        if (process.getFlow().isEmpty()) {
            List<StepSource> steps = process.getSteps();
            int[] unplacedDependencies = new int[steps.size()];
            List<List<Integer>> dependents = new ArrayList<>(steps.size());
            for (int index = 0; index < steps.size(); index++) {
                dependents.add(new ArrayList<>());
            }
            for (int index = 0; index < steps.size(); index++) {
                Set<Integer> dependencies = new LinkedHashSet<>();
                for (String dependency : ProcessSourceView.dependenciesOf(steps.get(index))) {
                    dependencies.add(resolve(process.stepIndex(dependency)));
                }
                unplacedDependencies[index] = dependencies.size();
                for (int dependency : dependencies) {
                    dependents.get(dependency).add(index);
                }
            }
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int index = 0; index < steps.size(); index++) {
                if (unplacedDependencies[index] == 0) {
                    ready.add(index);
                }
            }
            while (!ready.isEmpty()) {
                int next = ready.poll();
                flow.add(next);
                for (int dependent : dependents.get(next)) {
                    if (--unplacedDependencies[dependent] == 0) {
                        ready.add(dependent);
                    }
                }
            }
            return flow;
        }
        for (String entry : process.getFlow()) {
            flow.add(resolve(process.stepIndex(entry)));
        }
        return flow;
    }

    private static List<StepDefinition> steps(ProcessSourceView process, List<Integer> flow) {
        List<StepDefinition> steps = new ArrayList<>();
        int[] flowPositions = new int[process.getSteps().size()];
        Arrays.fill(flowPositions, ProcessDefinition.NO_REFERENCE);
        for (int position = 0; position < flow.size(); position++) {
            flowPositions[flow.get(position)] = position;
        }
        for (int index = 0; index < process.getSteps().size(); index++) {
            StepSource step = process.getSteps().get(index);
            List<Integer> dependsOn = new ArrayList<>();
            for (String dependency : ProcessSourceView.dependenciesOf(step)) {
                dependsOn.add(resolve(process.stepIndex(dependency)));
            }
            List<StepBranchDefinition> branches = new ArrayList<>();
            for (BranchSource branch : ProcessSourceView.branchesOf(step)) {
                branches.add(branch(process, branch));
            }
            steps.add(StepDefinition.builder()
                    .index(index)
                    .name(step.getName())
                    .roleIndex(optional(process, step.getRole(), true))
                    .entityIndex(optional(process, step.getEntity(), false))
                    .dependsOn(List.copyOf(dependsOn))
                    .auto(step.isAuto())
                    .branches(List.copyOf(branches))
                    .flowPosition(flowPositions[index])
                    .build());
        }
        return steps;
    }

    private static StepBranchDefinition branch(ProcessSourceView process, BranchSource branch) {
        boolean targetsTransition = !ProcessSourceView.isBlank(branch.getTransition());
        return StepBranchDefinition.builder()
                .condition(ProcessSourceView.isBlank(branch.getCondition()) ? null : branch.getCondition())
                .targetKind(targetsTransition ? StepBranchDefinition.TargetKind.TRANSITION : StepBranchDefinition.TargetKind.STEP)
                .targetIndex(targetsTransition
                        ? resolve(process.transitionIndex(branch.getTransition()))
                        : resolve(process.stepIndex(branch.getStep())))
                .build();
    }

    private static int optional(ProcessSourceView process, String name, boolean role) {
        if (ProcessSourceView.isBlank(name)) {
            return ProcessDefinition.NO_REFERENCE;
        }
        return resolve(role ? process.roleIndex(name) : process.entityIndex(name));
    }

    private static int resolve(Optional<Integer> index) {
        return index.orElseThrow(() -> new IllegalStateException("Unresolved reference in a validated process"));
    }
}
