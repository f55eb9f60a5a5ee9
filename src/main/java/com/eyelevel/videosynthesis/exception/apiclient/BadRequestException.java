package com.eyelevel.videosynthesis.exception.apiclient;

import java.io.Serial;

/**
 * The remote service rejected the request payload (HTTP 400).
 */
public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4414516763190851688L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
