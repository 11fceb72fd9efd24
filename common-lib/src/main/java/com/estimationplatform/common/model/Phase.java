package com.estimationplatform.common.model;

/** Delivery phases the planner splits total hours across. */
public enum Phase {
    FRONTEND("frontend"),
    BACKEND("backend"),
    QA("qa"),
    PM_BA("pm_ba");

    private final String key;

    Phase(String key) {
        this.key = key;
    }

    /** Stable lower-case key used in configuration and JSON payloads. */
    public String key() {
        return key;
    }
}
