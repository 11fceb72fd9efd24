package com.estimationplatform.common.model;

/** Roles in the recommended team composition. */
public enum TeamRole {
    FRONTEND_DEVELOPER("Frontend Developer"),
    BACKEND_DEVELOPER("Backend Developer"),
    QA_ENGINEER("QA Engineer"),
    PROJECT_MANAGER("Project Manager");

    private final String displayName;

    TeamRole(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
