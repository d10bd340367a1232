package com.phillippitts.geminibridge.service.cli.conflict;

/**
 * Lifecycle state of a sandbox container as reported by the container runtime.
 */
public enum ContainerState {
    RUNNING,
    STOPPED,
    NOT_FOUND,
    /** The runtime could not be queried (daemon down, command timed out, unparsable output). */
    UNKNOWN;

    /**
     * Whether the container no longer holds its name in a way that blocks a new sandbox.
     */
    public boolean isReleased() {
        return this == STOPPED || this == NOT_FOUND;
    }
}
