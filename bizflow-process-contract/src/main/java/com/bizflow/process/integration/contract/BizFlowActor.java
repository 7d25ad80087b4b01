package com.bizflow.process.integration.contract;

/**
 * The party performing an operation: a user, the role they act in, or both.
 *
 * @param userId the acting user, may be null when only the role is known
 * @param role   the role the user acts in, may be null for user-only actions
 */
public record BizFlowActor(String userId, String role) {

    public static final String SYSTEM_USER = "system";

    public static BizFlowActor of(String userId, String role) {
        return new BizFlowActor(userId, role);
    }

    public static BizFlowActor user(String userId) {
        return new BizFlowActor(userId, null);
    }

    public static BizFlowActor role(String role) {
        return new BizFlowActor(null, role);
    }

    public static BizFlowActor system() {
        return new BizFlowActor(SYSTEM_USER, null);
    }

    public boolean isSystem() {
        return SYSTEM_USER.equals(userId) && role == null;
    }

    /**
     * Label used for history entries and completed-by fields.
     */
    public String displayName() {
        if (userId != null) {
            return userId;
        }
        return role != null ? "role:" + role : "anonymous";
    }
}
