package com.bizflow.process.integration.models.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One process block. Every reference inside it is by name and is resolved during validation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessSource {
    private String name;
    /** Optional explicit start state; when absent the unique state without incoming transitions is used. */
    private String initialState;
    private List<EntitySource> entities;
    private List<RoleSource> roles;
    private List<StateSource> states;
    private List<StepSource> steps;
    private List<TransitionSource> transitions;
    private List<String> flow;
}
