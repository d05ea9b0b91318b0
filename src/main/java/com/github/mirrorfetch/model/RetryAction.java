package com.github.mirrorfetch.model;

public enum RetryAction {
    COMPLETE,
    RETRY_SAME_MIRROR,
    RETRY_DIFFERENT_MIRROR,
    PAUSE_FOR_RESUME,
    FATAL
}
