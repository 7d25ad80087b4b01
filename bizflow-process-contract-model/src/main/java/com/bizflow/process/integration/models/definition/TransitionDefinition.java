package com.bizflow.process.integration.models.definition;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TransitionDefinition {
    private final int index;
    private final String name;
    private final int fromStateIndex;
    private final int toStateIndex;
    /** The role authorized to execute this transition. */
    private final int roleIndex;
}
