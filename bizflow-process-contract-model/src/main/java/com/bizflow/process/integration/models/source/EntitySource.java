package com.bizflow.process.integration.models.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EntitySource {
    private String name;
    private List<EntityFieldSource> fields;
}
