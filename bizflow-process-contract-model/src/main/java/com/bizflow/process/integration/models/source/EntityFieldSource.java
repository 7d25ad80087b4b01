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
public class EntityFieldSource {
    private String name;
    /** One of string, int, float, boolean or enum. */
    private String type;
    /** Allowed values when the type is enum. */
    private List<String> variants;
}
