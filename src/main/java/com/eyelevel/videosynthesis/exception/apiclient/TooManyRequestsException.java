package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The remote service is throttling this account (HTTP 429).
 */
public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 3319056627830514077L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
