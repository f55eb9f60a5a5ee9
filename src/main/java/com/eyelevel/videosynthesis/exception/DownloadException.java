package com.eyelevel.videosynthesis.exception;

import java.io.Serial;

/**
 * Raised while streaming a result artifact to disk.
 */
public class DownloadException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 2290581476318447735L;

    public DownloadException(String message) {
        super(message);
    }

    public DownloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
