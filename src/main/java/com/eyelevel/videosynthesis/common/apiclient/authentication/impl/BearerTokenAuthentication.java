package com.eyelevel.videosynthesis.common.apiclient.authentication.impl;

import com.eyelevel.videosynthesis.common.apiclient.authentication.Authentication;
import com.eyelevel.videosynthesis.common.signing.SignableRequest;
import com.eyelevel.videosynthesis.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;

/**
 * An implementation of {@link Authentication} that attaches a static bearer token to every
 * request.
 */
@Slf4j
public record BearerTokenAuthentication(String token) implements Authentication {

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Adds {@code Authorization: Bearer <token>} to the request.
     *
     * @param request the outgoing request.
     * @throws ConfigurationException if no token is configured.
     */
    @Override
    public void applyAuthentication(SignableRequest request) {
        if (!StringUtils.hasText(token)) {
            log.error("Bearer token is not configured; refusing to send {} {}", request.getMethod(), request.getUri());
            throw new ConfigurationException("API key is not configured. Set ARK_API_KEY.");
        }
        request.putHeader(HttpHeaders.AUTHORIZATION, BEARER_PREFIX + token);
        log.trace("Applied bearer token. Current header names: {}", request.getHeaders().keySet());
    }

    @Override
    public String toString() {
        return "BearerTokenAuthentication[token=****]";
    }
}
