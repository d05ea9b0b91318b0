package com.github.mirrorfetch.model;

public enum FailureSeverity {
    MINOR,
    MODERATE,
    /**
     * Mirror could not be reached at all.
     */
    SEVERE
}
