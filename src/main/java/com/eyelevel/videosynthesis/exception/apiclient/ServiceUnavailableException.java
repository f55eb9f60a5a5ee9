package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The remote service could not be reached or is unavailable (HTTP 503).
 */
public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = 5741933058107206843L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
