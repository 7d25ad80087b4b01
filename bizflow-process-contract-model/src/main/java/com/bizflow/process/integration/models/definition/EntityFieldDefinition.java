package com.bizflow.process.integration.models.definition;

import com.bizflow.process.integration.enumerations.BizFlowFieldType;
import lombok.Builder;
import lombok.Data;

import java.util.List;

@Data
@Builder
public class EntityFieldDefinition {
    private final String name;
    private final BizFlowFieldType type;
    /** Empty unless the type is {@link BizFlowFieldType#ENUM}. */
    private final List<String> variants;
}
