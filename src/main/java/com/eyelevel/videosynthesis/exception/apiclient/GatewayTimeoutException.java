package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The request did not complete within the client timeout (HTTP 504).
 */
public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2493019471765128836L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
