package com.eyelevel.videosynthesis.service.polling;

import com.eyelevel.videosynthesis.model.TaskStatus;
import lombok.Getter;

import java.io.Serial;

/**
 * Signals the retry loop that the task has not reached a terminal status yet.
 */
@Getter
class TaskPendingException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 5204184907340326113L;

    private final TaskStatus status;

    TaskPendingException(TaskStatus status) {
        super("Task is still " + status, null, false, false);
        this.status = status;
    }
}
