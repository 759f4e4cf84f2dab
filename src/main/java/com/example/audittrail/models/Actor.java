package com.example.audittrail.models;

/**
 * Principal performing an audited action.
 */
public record Actor(String userId, String userName, String userEmail, String userRole) {

    public static final Actor SYSTEM = new Actor("system", "System", null, "system");

    public Actor {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId must be non-blank");
        }
    }

    public static Actor of(String userId, String userName, String userEmail) {
        return new Actor(userId, userName, userEmail, null);
    }
}
