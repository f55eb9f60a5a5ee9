package com.eyelevel.videosynthesis.model;

/**
 * Normalized status of a remote generation task. Each service family maps its own vocabulary onto
 * this set; strings it does not recognize become {@link #UNKNOWN}.
 */
public enum TaskStatus {
    QUEUED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    UNKNOWN;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED;
    }
}
