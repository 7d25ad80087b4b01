package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.StepSource;

import java.util.List;

/**
 * Step role and entity references resolve; a human step must name the role that performs it.
 */
public class StepReferenceCheck extends AbstractProcessCheck {

    @Override
    public String getName() {
        return "step-references";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        for (StepSource step : process.getSteps()) {
            if (ProcessSourceView.isBlank(step.getRole())) {
                if (!step.isAuto()) {
                    errors.add(error(ValidationErrorKind.MISSING_STEP_ROLE, process, ValidationElementKind.STEP,
                            step.getName(), "Step [" + step.getName() + "] is not automatic and has no role"));
                }
            } else if (process.roleIndex(step.getRole()).isEmpty()) {
                errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.STEP,
                        step.getName(), "Step [" + step.getName() + "] references unknown role [" + step.getRole() + "]"));
            }
            if (!ProcessSourceView.isBlank(step.getEntity()) && process.entityIndex(step.getEntity()).isEmpty()) {
                errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.STEP,
                        step.getName(), "Step [" + step.getName() + "] references unknown entity [" + step.getEntity() + "]"));
            }
        }
    }
}
