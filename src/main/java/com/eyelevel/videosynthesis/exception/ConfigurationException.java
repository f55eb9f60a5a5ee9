package com.eyelevel.videosynthesis.exception;

import java.io.Serial;

/**
 * Raised when a required credential or endpoint setting is missing or malformed. Fatal for the
 * operation that needed it; never retried.
 */
public class ConfigurationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 1942375605513062917L;

    public ConfigurationException(String message) {
        super(message);
    }
}
