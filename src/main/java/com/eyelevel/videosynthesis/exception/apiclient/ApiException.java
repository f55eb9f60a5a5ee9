package com.eyelevel.videosynthesis.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors raised while calling a remote generation service.
 *
 * <p>Carries the HTTP status code reported by the remote side, or a synthetic 5xx code when the
 * failure happened before a response was received.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    /**
     * Constructs a new ApiException with the specified message and status code.
     *
     * @param message    A descriptive message about the exception.
     * @param statusCode The HTTP status code associated with the exception.
     */
    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }
}
