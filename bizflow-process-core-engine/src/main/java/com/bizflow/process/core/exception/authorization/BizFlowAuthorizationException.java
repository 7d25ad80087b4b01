package com.bizflow.process.core.exception.authorization;

import com.bizflow.process.core.exception.BizFlowRuntimeException;
import com.bizflow.process.core.exception.codes.BizFlowErrorCodes;
import lombok.Getter;

@Getter
public class BizFlowAuthorizationException extends BizFlowRuntimeException {

    private final String actor;
    private final String requiredRole;

    private BizFlowAuthorizationException(BizFlowErrorCodes code, String message, String actor, String requiredRole) {
        super(code, message);
        this.actor = actor;
        this.requiredRole = requiredRole;
    }

    public static BizFlowAuthorizationException roleMismatch(String subject, String actingRole, String requiredRole) {
        return new BizFlowAuthorizationException(
                BizFlowErrorCodes.ROLE_MISMATCH,
                "Role mismatch on [" + subject + "]. Acting role: [" + actingRole + "], required role: [" + requiredRole + "]",
                actingRole,
                requiredRole);
    }

    public static BizFlowAuthorizationException notAssignee(String taskId, String userId, String assignedUser) {
        return new BizFlowAuthorizationException(
                BizFlowErrorCodes.ROLE_MISMATCH,
                "Task [" + taskId + "] is assigned to [" + assignedUser + "], not [" + userId + "]",
                userId,
                null);
    }

    public static BizFlowAuthorizationException claimedByAnother(String taskId, String userId, String holder) {
        return new BizFlowAuthorizationException(
                BizFlowErrorCodes.TASK_CLAIMED_BY_ANOTHER_USER,
                "Task [" + taskId + "] is already claimed by [" + holder + "]. Claim by [" + userId + "] rejected",
                userId,
                null);
    }
}
