package com.bizflow.process.integration.models.definition;

import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class EntityDefinition {
    private final int index;
    private final String name;
    private final List<EntityFieldDefinition> fields;
}
