package com.bizflow.process.core.engine.authorization;

import com.bizflow.process.integration.contract.BizFlowActor;
import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.definition.RoleDefinition;

import java.util.Optional;

/**
 * Decides who may complete or skip a task. A claimed task belongs to its user; an unclaimed
 * task may be handled by its role or any role supervising it. A task without a role is open
 * to every actor.
 */
public class TaskAuthorizer {

    public boolean canAct(ProcessDefinition definition, String assignedRole, String assignedUser, BizFlowActor actor) {
        if (actor == null) {
            return false;
        }
        if (assignedUser != null) {
            return assignedUser.equals(actor.userId());
        }
        if (assignedRole == null) {
            return true;
        }
        Optional<RoleDefinition> acting = definition.findRole(actor.role());
        Optional<RoleDefinition> required = definition.findRole(assignedRole);
        return acting.isPresent() && required.isPresent()
                && definition.getRoleHierarchy().isSameOrSupervisorOf(acting.get().getIndex(), required.get().getIndex());
    }
}
