package com.bizflow.process.core.engine.validation.checks;

import com.bizflow.process.core.engine.validation.AbstractProcessCheck;
import com.bizflow.process.core.engine.validation.ProcessSourceView;
import com.bizflow.process.core.engine.validation.ValidationElementKind;
import com.bizflow.process.core.engine.validation.ValidationError;
import com.bizflow.process.core.engine.validation.ValidationErrorKind;
import com.bizflow.process.integration.models.definition.ProcessDefinition;
import com.bizflow.process.integration.models.source.RoleSource;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Supervision must form a forest: references resolve, each role has one supervisor at most,
 * and no role ends up supervising itself.
 */
public class RoleSupervisionCheck extends AbstractProcessCheck {

    @Override
    public String getName() {
        return "role-supervision";
    }

    @Override
    protected void checkProcess(ProcessSourceView process, List<ValidationError> errors) {
        List<RoleSource> roles = process.getRoles();
        int[] supervisors = new int[roles.size()];
        Arrays.fill(supervisors, ProcessDefinition.NO_REFERENCE);

        for (int supervisor = 0; supervisor < roles.size(); supervisor++) {
            RoleSource role = roles.get(supervisor);
            for (String supervised : ProcessSourceView.supervisedBy(role)) {
                Optional<Integer> target = process.roleIndex(supervised);
                if (target.isEmpty()) {
                    errors.add(error(ValidationErrorKind.UNKNOWN_REFERENCE, process, ValidationElementKind.ROLE,
                            role.getName(), "Role [" + role.getName() + "] supervises unknown role [" + supervised + "]"));
                    continue;
                }
                int current = supervisors[target.get()];
                if (current == ProcessDefinition.NO_REFERENCE) {
                    supervisors[target.get()] = supervisor;
                } else if (current != supervisor) {
                    errors.add(error(ValidationErrorKind.CONFLICTING_SUPERVISOR, process, ValidationElementKind.ROLE,
                            supervised, "Role [" + supervised + "] is supervised by both [" + roles.get(current).getName()
                                    + "] and [" + role.getName() + "]"));
                }
            }
        }

        Set<Integer> reported = new HashSet<>();
        for (int start = 0; start < roles.size(); start++) {
            List<Integer> cycle = cycleThrough(start, supervisors);
            if (!cycle.isEmpty() && reported.add(cycle.stream().min(Integer::compare).orElseThrow())) {
                List<String> names = new ArrayList<>();
                cycle.forEach(index -> names.add(roles.get(index).getName()));
                errors.add(error(ValidationErrorKind.CYCLIC_DEPENDENCY, process, ValidationElementKind.ROLE,
                        roles.get(start).getName(), "Roles supervise each other in a cycle: " + String.join(" -> ", names)));
            }
        }
    }

    /**
     * Roles on the supervision cycle that contains {@code start}, or an empty list.
     */
    private static List<Integer> cycleThrough(int start, int[] supervisors) {
        List<Integer> walked = new ArrayList<>();
        int current = start;
        for (int hops = 0; hops <= supervisors.length && current != ProcessDefinition.NO_REFERENCE; hops++) {
            walked.add(current);
            current = supervisors[current];
            if (current == start) {
                return walked;
            }
        }
        return List.of();
    }
}
