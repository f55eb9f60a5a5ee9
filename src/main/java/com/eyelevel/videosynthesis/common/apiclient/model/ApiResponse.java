package com.eyelevel.videosynthesis.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * Represents the response from an external API call: the raw body plus the content type,
 * headers, status code and receipt timestamp.
 */
@Builder
@Getter
public class ApiResponse {

    /**
     * The response body. Empty, never null, for a 2xx response without content.
     */
    private final byte[] data;

    @Nullable
    private final MediaType acceptType;

    @Nullable
    private final HttpHeaders headers;

    private final int statusCode;

    /**
     * The timestamp when the response was received.
     */
    private final Instant timestamp;
}
