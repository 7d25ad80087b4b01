package com.bizflow.process.core.engine.authorization;

import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.definition.RoleDefinition;
import com.bizflow.process.integration.models.definition.RoleHierarchy;
import com.bizflow.process.integration.models.definition.TransitionDefinition;

/**
 * Decides whether a role may execute a transition: it must be the transition's role
 * or supervise it, directly or transitively.
 */
public class TransitionAuthorizer {

    public boolean authorize(TransitionDefinition transition, int actingRoleIndex, RoleHierarchy hierarchy) {
        return hierarchy.isSameOrSupervisorOf(actingRoleIndex, transition.getRoleIndex());
    }

    /**
     * Name-based variant for callers at the service boundary. Unknown roles are denied.
     */
    public boolean authorize(ProcessDefinition definition, TransitionDefinition transition, String actingRole) {
        return definition.findRole(actingRole)
                .map(RoleDefinition::getIndex)
                .map(roleIndex -> authorize(transition, roleIndex, definition.getRoleHierarchy()))
                .orElse(false);
    }
}
