package com.github.mirrorfetch.model;

/**
 * What is known about one identifier on one mirror.
 */
public enum Availability {
    UNKNOWN,
    PRESENT,
    ABSENT
}
