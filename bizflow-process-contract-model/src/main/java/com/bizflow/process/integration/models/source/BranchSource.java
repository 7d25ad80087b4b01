package com.bizflow.process.integration.models.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A conditional follow-up of a completed step. Exactly one of {@code transition} or {@code step} is set.
 * A missing condition always matches.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BranchSource {
    private String condition;
    private String transition;
    private String step;
}
