package com.bizflow.process.core.engine.validation;

import com.bizflow.process.core.engine.expression.BranchConditionEvaluator;
import com.bizflow.process.core.engine.validation.checks.BranchCheck;
import com.bizflow.process.core.engine.validation.checks.ElementNameCheck;
import com.bizflow.process.core.engine.validation.checks.EntityFieldTypeCheck;
import com.bizflow.process.core.engine.validation.checks.FlowCheck;
import com.bizflow.process.core.engine.validation.checks.InitialStateCheck;
import com.bizflow.process.core.engine.validation.checks.ProcessNameCheck;
import com.bizflow.process.core.engine.validation.checks.ProjectNameCheck;
import com.bizflow.process.core.engine.validation.checks.RoleSupervisionCheck;
import com.bizflow.process.core.engine.validation.checks.StepDependencyCheck;
import com.bizflow.process.core.engine.validation.checks.StepReferenceCheck;
import com.bizflow.process.core.engine.validation.checks.TransitionCheck;
import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.source.ProcessDocumentSource;
import com.bizflow.process.integration.models.source.ProcessSource;
import com.bizflow.process.integration.models.source.ProjectInfoSource;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Runs every integrity check over a definition document and resolves the processes that pass
 * into {@link ProcessDefinition}s.
 *
 * <p>All checks always run, so the result lists every violation at once. A process with at least
 * one violation yields no definition; a document-level violation (missing project name, unnamed
 * process) rejects every process of the document.</p>
 */
@Slf4j
public class ProcessDefinitionValidator {

    private final List<IProcessDefinitionCheck> checks;

    public ProcessDefinitionValidator() {
        this(defaultChecks(new BranchConditionEvaluator()));
    }

    public ProcessDefinitionValidator(List<IProcessDefinitionCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public static List<IProcessDefinitionCheck> defaultChecks(BranchConditionEvaluator conditionEvaluator) {
        return List.of(
                new ProjectNameCheck(),
                new ProcessNameCheck(),
                new ElementNameCheck(),
                new EntityFieldTypeCheck(),
                new StepReferenceCheck(),
                new StepDependencyCheck(),
                new FlowCheck(),
                new TransitionCheck(),
                new RoleSupervisionCheck(),
                new InitialStateCheck(),
                new BranchCheck(conditionEvaluator)
        );
    }

    public List<IProcessDefinitionCheck> getChecks() {
        return checks;
    }

    public ValidationResult validate(ProcessDocumentSource document) {
        if (document == null) {
            throw new IllegalArgumentException("Definition document cannot be null");
        }
        List<ValidationError> errors = new ArrayList<>();
        for (IProcessDefinitionCheck check : checks) {
            List<ValidationError> found = check.check(document);
            if (!found.isEmpty()) {
                log.debug("Check [{}] reported {} error(s)", check.getName(), found.size());
            }
            errors.addAll(found);
        }

        List<ProcessDefinition> definitions = new ArrayList<>();
        boolean documentRejected = errors.stream().anyMatch(ValidationError::isDocumentLevel);
        if (!documentRejected) {
            Set<String> rejected = new HashSet<>();
            errors.forEach(error -> rejected.add(error.getProcessName()));
            ProjectInfoSource project = document.getProject();
            for (ProcessSource process : ProcessSourceView.nullSafe(document.getProcesses())) {
                if (!rejected.contains(process.getName())) {
                    definitions.add(ProcessDefinitionAssembler.assemble(project, new ProcessSourceView(process)));
                }
            }
        }

        if (errors.isEmpty()) {
            log.info("Validated definition document with {} process(es)", definitions.size());
        } else {
            log.warn("Definition document has {} validation error(s); {} process(es) accepted",
                    errors.size(), definitions.size());
        }
        return new ValidationResult(definitions, errors);
    }
}
