package com.mimecast.mailroom.runner;

/**
 * Runner lifecycle states.
 */
public enum RunnerState {
    STARTING,
    POLLING,
    PROCESSING,
    STOPPING,
    STOPPED
}
