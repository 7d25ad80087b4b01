package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.enumerations.BizFlowFieldType;
import com.bizflow.process.integration.models.source.EntityFieldSource;
import com.bizflow.process.integration.models.source.EntitySource;

import java.util.List;

public class EntityFieldTypeCheck extends AbstractProcessCheck {

    @Override
    public String getName() {
        return "entity-field-types";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        for (EntitySource entity : process.getEntities()) {
            for (EntityFieldSource field : ProcessSourceView.fieldsOf(entity)) {
                if (BizFlowFieldType.fromKeyword(field.getType()).isEmpty()) {
                    errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.ENTITY_FIELD,
                            field.getName(), "Field [" + entity.getName() + "." + field.getName()
                                    + "] has unknown type [" + field.getType() + "]"));
                }
            }
        }
    }
}
