package com.bizflow.process.integration.models.definition;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A unit of work inside a process. All references are indexes into the owning
 * {@link ProcessDefinition}'s arenas.
 */
@Data
@Builder
public class StepDefinition {
    private final int index;
    private final String name;
    private final int roleIndex;
    private final int entityIndex;
    private final List<Integer> dependsOn;
    private final boolean auto;
    private final List<StepBranchDefinition> branches;
    /**
     * Position in the flow, or {@link ProcessDefinition#NO_REFERENCE} for a step that is only
     * scheduled after a branch activates it.
     */
    private final int flowPosition;

    public boolean hasRole() {
        return roleIndex != ProcessDefinition.NO_REFERENCE;
    }

    public boolean hasEntity() {
        return entityIndex != ProcessDefinition.NO_REFERENCE;
    }

    public boolean isInFlow() {
        return flowPosition != ProcessDefinition.NO_REFERENCE;
    }
}
