package com.eyelevel.videosynthesis.exception;

import java.io.Serial;

/**
 * Raised when a job-creation request fails or its response carries neither a task id nor a
 * resolved result. Submissions are not retried.
 */
public class SubmissionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 8253180774912646590L;

    public SubmissionException(String message) {
        super(message);
    }

    public SubmissionException(String message, Throwable cause) {
        super(message, cause);
    }
}
