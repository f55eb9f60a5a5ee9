package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The remote service failed while handling the request (HTTP 500).
 */
public class InternalServerException extends ApiException {

    @Serial
    private static final long serialVersionUID = -7382094468271055190L;

    public InternalServerException(String message) {
        super(message, 500);
    }
}
