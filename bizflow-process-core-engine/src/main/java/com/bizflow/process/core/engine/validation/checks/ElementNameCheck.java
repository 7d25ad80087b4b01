package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.source.EntityFieldSource;
import com.bizflow.process.integration.models.source.EntitySource;
import com.bizflow.process.integration.models.source.RoleSource;
import com.bizflow.process.integration.models.source.StateSource;
import com.bizflow.process.integration.models.source.StepSource;
import com.bizflow.process.integration.models.source.TransitionSource;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Every entity, field, role, state, step and transition is named, and names are unique per kind.
 */
public class ElementNameCheck extends AbstractProcessCheck {

    @Override
    public String getName() {
        return "element-names";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        checkNames(process, process.getEntities(), EntitySource::getName, ValidationElementKind.ENTITY, null, errors);
        for (EntitySource entity : process.getEntities()) {
            checkNames(process, ProcessSourceView.fieldsOf(entity), EntityFieldSource::getName,
                    ValidationElementKind.ENTITY_FIELD, entity.getName(), errors);
        }
        checkNames(process, process.getRoles(), RoleSource::getName, ValidationElementKind.ROLE, null, errors);
        checkNames(process, process.getStates(), StateSource::getName, ValidationElementKind.STATE, null, errors);
        checkNames(process, process.getSteps(), StepSource::getName, ValidationElementKind.STEP, null, errors);
        checkNames(process, process.getTransitions(), TransitionSource::getName, ValidationElementKind.TRANSITION, null, errors);
    }

    private static <T> void checkNames(ProcessSourceView process, List<T> elements, Function<T, String> nameOf,
                                       ValidationElementKind kind, String owner, List<ValidationError> errors) {
        String scope = owner == null ? "" : " of [" + owner + "]";
        Set<String> seen = new HashSet<>();
        Set<String> reported = new HashSet<>();
        for (int position = 0; position < elements.size(); position++) {
            String name = nameOf.apply(elements.get(position));
            if (ProcessSourceView.isBlank(name)) {
                errors.add(error(ValidationErrorKind.MISSING_NAME, process, kind, null,
                        kind + " at position " + position + scope + " has no name"));
            } else if (!seen.add(name) && reported.add(name)) {
                errors.add(error(ValidationErrorKind.DUPLICATE_NAME, process, kind, name,
                        kind + " [" + name + "]" + scope + " is declared more than once"));
            }
        }
    }
}
