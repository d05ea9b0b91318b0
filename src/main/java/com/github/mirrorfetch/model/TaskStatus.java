package com.github.mirrorfetch.model;

public enum TaskStatus {
    PENDING("Pending"),
    IN_FLIGHT("In flight"),
    PAUSED("Paused"),
    COMPLETED("Completed"),
    FAILED("Failed");

    private final String displayName;

    TaskStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
