package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The remote service rejected the credentials or signature (HTTP 401).
 */
public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2716409374416285731L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
