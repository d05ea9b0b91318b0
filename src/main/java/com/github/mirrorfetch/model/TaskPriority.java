package com.github.mirrorfetch.model;

/**
 * Dispatch priority of a task within a batch. Declaration order is dispatch order.
 */
public enum TaskPriority {
    HIGH,
    NORMAL,
    LOW
}
