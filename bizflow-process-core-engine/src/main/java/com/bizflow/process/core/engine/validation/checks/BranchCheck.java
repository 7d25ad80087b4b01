package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.expression.BranchConditionEvaluator;
import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.BranchSource;
import com.bizflow.process.integration.models.source.StepSource;

import java.util.List;
import java.util.Optional;

/**
 * {@code onComplete} branches target exactly one declared transition or step, and their
 * conditions parse.
 */
public class BranchCheck extends AbstractProcessCheck {

    private final BranchConditionEvaluator conditionEvaluator;

    public BranchCheck(BranchConditionEvaluator conditionEvaluator) {
        this.conditionEvaluator = conditionEvaluator;
    }

    @Override
    public String getName() {
        return "on-complete-branches";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        for (StepSource step : process.getSteps()) {
            List<BranchSource> branches = ProcessSourceView.branchesOf(step);
            for (int position = 0; position < branches.size(); position++) {
                checkBranch(process, step, position, branches.get(position), errors);
            }
        }
    }

    private void checkBranch(ProcessSourceView process, StepSource step, int position, BranchSource branch,
                             List<ValidationError> errors) {
        String label = step.getName() + "#" + position;
        boolean hasTransition = !ProcessSourceView.isBlank(branch.getTransition());
        boolean hasStep = !ProcessSourceView.isBlank(branch.getStep());
        if (hasTransition == hasStep) {
            errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.BRANCH, label,
                    "Branch [" + label + "] must target exactly one transition or step"));
        } else if (hasTransition && process.transitionIndex(branch.getTransition()).isEmpty()) {
            errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.BRANCH, label,
                    "Branch [" + label + "] targets unknown transition [" + branch.getTransition() + "]"));
        } else if (hasStep && process.stepIndex(branch.getStep()).isEmpty()) {
            errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.BRANCH, label,
                    "Branch [" + label + "] targets unknown step [" + branch.getStep() + "]"));
        }
        if (!ProcessSourceView.isBlank(branch.getCondition())) {
            Optional<String> problem = conditionEvaluator.syntaxError(branch.getCondition());
            problem.ifPresent(message -> errors.add(error(ValidationErrorKind.INVALID_CONDITION, process,
                    ValidationElementKind.BRANCH, label, "Branch [" + label + "] condition ["
                            + branch.getCondition() + "] does not parse: " + message)));
        }
    }
}
