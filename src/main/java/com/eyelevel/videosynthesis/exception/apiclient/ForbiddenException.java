package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The credentials are valid but lack access to the requested action (HTTP 403).
 */
public class ForbiddenException extends ApiException {

    @Serial
    private static final long serialVersionUID = -1822694715539720164L;

    public ForbiddenException(String message) {
        super(message, 403);
    }
}
