package com.eyelevel.videosynthesis.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * Represents a request to an external API.
 *
 * <p>This class encapsulates everything needed to construct, authenticate and send an API
 * request: the HTTP method, path, query parameters, headers and request body.
 */
@Builder
@Data
public class ApiRequest {

    /**
     * The HTTP method for the API request.
     */
    private final HttpMethod method;

    /**
     * Path appended to the client's base URL. May contain {@code {name}} placeholders resolved
     * from {@link #pathVariables}. Null or empty leaves the base URL path untouched.
     */
    @Nullable
    private final String path;

    /**
     * Optional query parameters. Their order does not matter to the signed family, which sorts
     * them during canonicalization.
     */
    @Nullable
    private final Map<String, Object> queryParams;

    @Nullable
    private final Map<String, Object> pathVariables;

    /**
     * Caller-supplied headers. Authentication adds to this set before the request is sent.
     */
    private final Map<String, String> headers = new HashMap<>();

    /**
     * The body of the API request. A {@code byte[]} or {@code String} is sent as is; anything
     * else is serialized to JSON.
     */
    @Nullable
    private final Object body;

    @Nullable
    private final MediaType acceptMediaType;

    /**
     * The content type of the request body. Defaults to JSON when a body is present.
     */
    @Nullable
    private final MediaType contentType;
}
