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
public class StepSource {
    private String name;
    private String role;
    private String entity;
    private List<String> dependsOn;
    private boolean auto;
    private List<BranchSource> onComplete;
}
