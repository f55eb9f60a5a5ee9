package com.eyelevel.videosynthesis.model;

import java.util.Objects;

/**
 * Reference to a submitted job: either a remote task id still to be polled, or a result the
 * service already returned synchronously. Exactly one of the two is set.
 *
 * @param taskId remote task id, set on the asynchronous path
 * @param result resolved result (artifact URL or subject id), set on the synchronous path
 */
public record TaskHandle(String taskId, String result) {

    public static TaskHandle pending(String taskId) {
        return new TaskHandle(Objects.requireNonNull(taskId, "taskId must not be null"), null);
    }

    public static TaskHandle resolved(String result) {
        return new TaskHandle(null, Objects.requireNonNull(result, "result must not be null"));
    }

    public boolean isResolved() {
        return result != null;
    }
}
