package com.github.mirrorfetch.model;

public enum OutcomeType {
    COMPLETED,
    PARTIAL,
    NOT_FOUND,
    TRANSIENT,
    RATE_LIMITED,
    INTEGRITY_MISMATCH,
    FATAL,
    CANCELLED
}
