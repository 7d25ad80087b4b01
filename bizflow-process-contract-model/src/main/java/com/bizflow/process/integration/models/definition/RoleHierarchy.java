package com.bizflow.process.integration.models.definition;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Supervision forest over role indexes. Each role points to at most one supervisor;
 * lookups walk upwards and stop after as many hops as there are roles.
 */
public final class RoleHierarchy {

    private final int[] supervisors;

    private RoleHierarchy(int[] supervisors) {
        this.supervisors = supervisors;
    }

    public static RoleHierarchy of(List<RoleDefinition> roles) {
        int[] supervisors = new int[roles.size()];
        for (RoleDefinition role : roles) {
            supervisors[role.getIndex()] = role.getSupervisorIndex();
        }
        return new RoleHierarchy(supervisors);
    }

    public int size() {
        return supervisors.length;
    }

    public int supervisorOf(int roleIndex) {
        return isKnown(roleIndex) ? supervisors[roleIndex] : ProcessDefinition.NO_REFERENCE;
    }

    /**
     * True when {@code actingRole} is {@code targetRole} or one of its direct or transitive supervisors.
     * Unknown indexes are never authorized.
     */
    public boolean isSameOrSupervisorOf(int actingRole, int targetRole) {
        if (!isKnown(actingRole) || !isKnown(targetRole)) {
            return false;
        }
        int current = targetRole;
        for (int hops = 0; hops <= supervisors.length && current != ProcessDefinition.NO_REFERENCE; hops++) {
            if (current == actingRole) {
                return true;
            }
            current = supervisors[current];
        }
        return false;
    }

    /**
     * The acting role followed by every role it supervises, in index order.
     */
    public Set<Integer> visibleRoles(int actingRole) {
        Set<Integer> visible = new LinkedHashSet<>();
        if (!isKnown(actingRole)) {
            return visible;
        }
        visible.add(actingRole);
        for (int role = 0; role < supervisors.length; role++) {
            if (isSameOrSupervisorOf(actingRole, role)) {
                visible.add(role);
            }
        }
        return visible;
    }

    private boolean isKnown(int roleIndex) {
        return roleIndex >= 0 && roleIndex < supervisors.length;
    }

    @Override
    public String toString() {
        return "RoleHierarchy" + Arrays.toString(supervisors);
    }
}
