package com.bizflow.process.integration.models.definition;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class StateDefinition {
    private final int index;
    private final String name;
    private final boolean initial;
    /** A state with no outgoing transitions. Reaching it completes the instance. */
    private final boolean terminal;
}
