package com.bizflow.process.integration.models.definition;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RoleDefinition {
    private final int index;
    private final String name;
    /** Index of the supervising role, or {@link ProcessDefinition#NO_REFERENCE}. */
    private final int supervisorIndex;

    public boolean hasSupervisor() {
        return supervisorIndex != ProcessDefinition.NO_REFERENCE;
    }
}
