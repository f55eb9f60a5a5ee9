package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The requested resource does not exist (HTTP 404).
 */
public class NotFoundException extends ApiException {

    @Serial
    private static final long serialVersionUID = 6023311569172214518L;

    public NotFoundException(String message) {
        super(message, 404);
    }
}
