package com.bizflow.process.core.engine.validation;

import com.bizflow.process.integration.models.source.BranchSource;
import com.bizflow.process.integration.models.source.EntityFieldSource;
import com.bizflow.process.integration.models.source.EntitySource;
import com.bizflow.process.integration.models.source.ProcessSource;
import com.bizflow.process.integration.models.source.RoleSource;
import com.bizflow.process.integration.models.source.StateSource;
import com.bizflow.process.integration.models.source.StepSource;
import com.bizflow.process.integration.models.source.TransitionSource;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only view of a {@link ProcessSource} with null-free element lists and
 * first-occurrence name lookups per element kind.
 */
public final class ProcessSourceView {

    private final ProcessSource source;
    private final List<EntitySource> entities;
    private final List<RoleSource> roles;
    private final List<StateSource> states;
    private final List<StepSource> steps;
    private final List<TransitionSource> transitions;
    private final List<String> flow;

    private final Map<String, Integer> entityIndex;
    private final Map<String, Integer> roleIndex;
    private final Map<String, Integer> stateIndex;
    private final Map<String, Integer> stepIndex;
    private final Map<String, Integer> transitionIndex;

    public ProcessSourceView(ProcessSource source) {
        this.source = source;
        this.entities = withoutNulls(source.getEntities());
        this.roles = withoutNulls(source.getRoles());
        this.states = withoutNulls(source.getStates());
        this.steps = withoutNulls(source.getSteps());
        this.transitions = withoutNulls(source.getTransitions());
        this.flow = nullSafe(source.getFlow());
        this.entityIndex = firstIndexByName(entities, EntitySource::getName);
        this.roleIndex = firstIndexByName(roles, RoleSource::getName);
        this.stateIndex = firstIndexByName(states, StateSource::getName);
        this.stepIndex = firstIndexByName(steps, StepSource::getName);
        this.transitionIndex = firstIndexByName(transitions, TransitionSource::getName);
    }

    public String getName() {
        return source.getName();
    }

    public String getInitialState() {
        return source.getInitialState();
    }

    public List<EntitySource> getEntities() {
        return entities;
    }

    public List<RoleSource> getRoles() {
        return roles;
    }

    public List<StateSource> getStates() {
        return states;
    }

    public List<StepSource> getSteps() {
        return steps;
    }

    public List<TransitionSource> getTransitions() {
        return transitions;
    }

    public List<String> getFlow() {
        return flow;
    }

    public Optional<Integer> entityIndex(String name) {
        return lookup(entityIndex, name);
    }

    public Optional<Integer> roleIndex(String name) {
        return lookup(roleIndex, name);
    }

    public Optional<Integer> stateIndex(String name) {
        return lookup(stateIndex, name);
    }

    public Optional<Integer> stepIndex(String name) {
        return lookup(stepIndex, name);
    }

    public Optional<Integer> transitionIndex(String name) {
        return lookup(transitionIndex, name);
    }

    public static List<EntityFieldSource> fieldsOf(EntitySource entity) {
        return withoutNulls(entity.getFields());
    }

    public static List<String> dependenciesOf(StepSource step) {
        return nullSafe(step.getDependsOn());
    }

    public static List<BranchSource> branchesOf(StepSource step) {
        return withoutNulls(step.getOnComplete());
    }

    public static List<String> supervisedBy(RoleSource role) {
        return nullSafe(role.getSupervises());
    }

    public static <T> List<T> nullSafe(List<T> list) {
        return list == null ? List.of() : list;
    }

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> List<T> withoutNulls(List<T> list) {
        if (list == null) {
            return List.of();
        }
        return list.stream().filter(Objects::nonNull).collect(Collectors.toUnmodifiableList());
    }

    private static Optional<Integer> lookup(Map<String, Integer> index, String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(index.get(name));
    }

    private static <T> Map<String, Integer> firstIndexByName(List<T> elements, Function<T, String> nameOf) {
        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < elements.size(); i++) {
            String name = nameOf.apply(elements.get(i));
            if (!isBlank(name)) {
                index.putIfAbsent(name, i);
            }
        }
        return Collections.unmodifiableMap(index);
    }
}
