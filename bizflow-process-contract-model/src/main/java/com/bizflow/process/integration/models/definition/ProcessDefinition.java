package com.bizflow.process.integration.models.definition;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Validated, immutable process definition.
 *
 * <p>Elements of each kind live in their own list and refer to each other by list index.
 * Names are only used at the boundary, when a caller names a transition, role, state or step;
 * they are resolved through the lookup tables built here once.</p>
 */
@Getter
@ToString(of = {"name", "version"})
public final class ProcessDefinition {

    public static final int NO_REFERENCE = -1;

    private final String name;
    private final String projectName;
    private final String description;
    private final String version;
    private final String author;
    private final List<EntityDefinition> entities;
    private final List<RoleDefinition> roles;
    private final List<StateDefinition> states;
    private final List<StepDefinition> steps;
    private final List<TransitionDefinition> transitions;
    /** Step indexes in flow order. */
    private final List<Integer> flow;
    private final int initialStateIndex;
    private final RoleHierarchy roleHierarchy;

    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> roleIndexByName;
    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> stateIndexByName;
    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> stepIndexByName;
    @Getter(AccessLevel.NONE)
    private final Map<String, Integer> transitionIndexByName;

    @Builder
    private ProcessDefinition(String name, String projectName, String description, String version, String author,
                              List<EntityDefinition> entities, List<RoleDefinition> roles,
                              List<StateDefinition> states, List<StepDefinition> steps,
                              List<TransitionDefinition> transitions, List<Integer> flow,
                              int initialStateIndex) {
        this.name = name;
        this.projectName = projectName;
        this.description = description;
        this.version = version;
        this.author = author;
        this.entities = immutable(entities);
        this.roles = immutable(roles);
        this.states = immutable(states);
        this.steps = immutable(steps);
        this.transitions = immutable(transitions);
        this.flow = immutable(flow);
        this.initialStateIndex = initialStateIndex;
        this.roleHierarchy = RoleHierarchy.of(this.roles);
        this.roleIndexByName = indexByName(this.roles, RoleDefinition::getName, RoleDefinition::getIndex);
        this.stateIndexByName = indexByName(this.states, StateDefinition::getName, StateDefinition::getIndex);
        this.stepIndexByName = indexByName(this.steps, StepDefinition::getName, StepDefinition::getIndex);
        this.transitionIndexByName = indexByName(this.transitions, TransitionDefinition::getName, TransitionDefinition::getIndex);
    }

    // ========================================================================
    // NAME LOOKUPS
    // ========================================================================

    public Optional<RoleDefinition> findRole(String roleName) {
        return lookup(roleIndexByName, roleName).map(roles::get);
    }

    public Optional<StateDefinition> findState(String stateName) {
        return lookup(stateIndexByName, stateName).map(states::get);
    }

    public Optional<StepDefinition> findStep(String stepName) {
        return lookup(stepIndexByName, stepName).map(steps::get);
    }

    public Optional<TransitionDefinition> findTransition(String transitionName) {
        return lookup(transitionIndexByName, transitionName).map(transitions::get);
    }

    // ========================================================================
    // INDEX ACCESS
    // ========================================================================

    public RoleDefinition getRole(int index) {
        return roles.get(index);
    }

    public StateDefinition getState(int index) {
        return states.get(index);
    }

    public StepDefinition getStep(int index) {
        return steps.get(index);
    }

    public TransitionDefinition getTransition(int index) {
        return transitions.get(index);
    }

    public StateDefinition getInitialState() {
        return states.get(initialStateIndex);
    }

    /**
     * Name of the role at {@code index}, or null for {@link #NO_REFERENCE}.
     */
    public String roleName(int index) {
        return index == NO_REFERENCE ? null : roles.get(index).getName();
    }

    public List<TransitionDefinition> transitionsFrom(int stateIndex) {
        return transitions.stream()
                .filter(transition -> transition.getFromStateIndex() == stateIndex)
                .collect(Collectors.toUnmodifiableList());
    }

    public List<StepDefinition> flowSteps() {
        return flow.stream().map(steps::get).collect(Collectors.toUnmodifiableList());
    }

    private static Optional<Integer> lookup(Map<String, Integer> indexByName, String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(indexByName.get(name));
    }

    private static <T> List<T> immutable(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    private static <T> Map<String, Integer> indexByName(List<T> elements,
                                                        Function<T, String> nameOf,
                                                        ToIntFunction<T> indexOf) {
        Map<String, Integer> map = new HashMap<>();
        for (T element : elements) {
            map.putIfAbsent(nameOf.apply(element), indexOf.applyAsInt(element));
        }
        return Collections.unmodifiableMap(map);
    }
}
