package com.eyelevel.videosynthesis.exception;

import java.io.Serial;

/**
 * A single status check failed at the transport or HTTP level. The poll loop logs it and moves on
 * to the next attempt.
 */
public class TransientPollException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -3064873342216157529L;

    public TransientPollException(String message, Throwable cause) {
        super(message, cause);
    }
}
