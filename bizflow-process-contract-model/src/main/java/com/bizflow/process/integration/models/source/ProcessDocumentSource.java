package com.bizflow.process.integration.models.source;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Root of a definition document as produced by the definition language front end
 * or read from its YAML/JSON form.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ProcessDocumentSource {
    private ProjectInfoSource project;
    private List<ProcessSource> processes;
}
