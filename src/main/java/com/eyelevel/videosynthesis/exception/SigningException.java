package com.eyelevel.videosynthesis.exception;

import java.io.Serial;

/**
 * Raised when a request cannot be signed. The request must not be sent.
 */
public class SigningException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -6170931529458342105L;

    public SigningException(String message) {
        super(message);
    }

    public SigningException(String message, Throwable cause) {
        super(message, cause);
    }
}
