package com.eyelevel.videosynthesis.common.apiclient;

import com.eyelevel.videosynthesis.common.apiclient.authentication.Authentication;
import com.eyelevel.videosynthesis.common.apiclient.model.ApiRequest;
import com.eyelevel.videosynthesis.common.apiclient.model.ApiResponse;
import com.eyelevel.videosynthesis.common.json.JsonSerializer;
import com.eyelevel.videosynthesis.common.signing.SignableRequest;
import com.eyelevel.videosynthesis.exception.apiclient.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.lang.NonNull;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.*;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Objects;
import java.util.Optional;

/**
 * Abstract base class for API clients, providing the common path for resolving, authenticating
 * and sending a request, handling the response and mapping exceptions.
 *
 * <p>The request is fully materialized (absolute URI, body bytes, headers) before the
 * {@link Authentication} is applied, so that signature-based schemes hash exactly what goes on the
 * wire. Subclasses supply the {@link WebClient}, the {@link Authentication} and the base URL.
 */
@RequiredArgsConstructor
@Slf4j
public abstract class ApiClient {

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final Authentication authentication;
    protected final JsonSerializer jsonSerializer;
    protected final String baseUrl;

    /**
     * Executes an API call based on the provided {@link ApiRequest}.
     *
     * @param apiRequest The API request to execute. Must not be null.
     *
     * @return The API response.
     *
     * @throws ApiException If the remote side answers with a non-2xx status or cannot be reached.
     * @throws com.eyelevel.videosynthesis.exception.ConfigurationException If the credentials needed
     *                                                                       by the authentication are missing.
     * @throws com.eyelevel.videosynthesis.exception.SigningException        If the request cannot be signed.
     */
    protected ApiResponse call(@NonNull ApiRequest apiRequest) {
        Objects.requireNonNull(apiRequest, "apiRequest must not be null");
        log.info("Calling API with method: {} and path: {}", apiRequest.getMethod(), apiRequest.getPath());

        // Credential and signing failures surface unchanged: the request is never sent.
        SignableRequest signableRequest = prepareRequest(apiRequest);
        authentication.applyAuthentication(signableRequest);
        log.debug("Authentication applied, header names: {}", signableRequest.getHeaders().keySet());

        try {
            WebClient.RequestBodySpec requestBodySpec = webClient.method(apiRequest.getMethod())
                                                                 .uri(signableRequest.getUri());
            requestBodySpec.headers(httpHeaders -> signableRequest.getHeaders().forEach(httpHeaders::set));
            Optional.ofNullable(apiRequest.getAcceptMediaType()).ifPresent(requestBodySpec::accept);
            if (signableRequest.getBody().length > 0) {
                requestBodySpec.bodyValue(signableRequest.getBody());
            }

            ApiResponse apiResponse = requestBodySpec.exchangeToMono(this::handleResponse).timeout(DEFAULT_TIMEOUT)
                                                     .onErrorMap(this::mapException).block();
            log.debug("Received apiResponse with status: {}",
                      apiResponse == null ? null : apiResponse.getStatusCode());
            return apiResponse;

        } catch (ApiException e) {
            log.warn("API call to {} failed with status {}: {}", signableRequest.getUri().getHost(),
                     e.getStatusCode(), e.getMessage());
            throw e;
        } catch (Exception e) {
            log.error("Exception during API call", e);
            throw mapException(e);
        }
    }

    /**
     * Resolves the absolute URI, applies the content type and serializes the body, producing the
     * exact request that will be authenticated and sent.
     */
    private SignableRequest prepareRequest(ApiRequest apiRequest) {
        UriComponentsBuilder uriBuilder = UriComponentsBuilder.fromUriString(baseUrl);
        if (StringUtils.hasLength(apiRequest.getPath())) {
            uriBuilder.path(apiRequest.getPath());
        }
        Optional.ofNullable(apiRequest.getQueryParams())
                .ifPresent(params -> params.forEach(uriBuilder::queryParam));
        URI uri = uriBuilder.buildAndExpand(Optional.ofNullable(apiRequest.getPathVariables())
                                                    .orElse(Collections.emptyMap()))
                            .encode()
                            .toUri();
        log.trace("Resolved request URI: {}", uri);

        byte[] body = serializeBody(apiRequest.getBody());
        SignableRequest signableRequest = new SignableRequest(apiRequest.getMethod().name(), uri,
                                                              apiRequest.getHeaders(), body);
        if (body.length > 0) {
            MediaType contentType = Optional.ofNullable(apiRequest.getContentType()).orElse(MediaType.APPLICATION_JSON);
            signableRequest.putHeader(HttpHeaders.CONTENT_TYPE, contentType.toString());
        }
        return signableRequest;
    }

    private byte[] serializeBody(Object body) {
        if (body == null) {
            log.debug("There is no body here");
            return new byte[0];
        }
        if (body instanceof byte[] bytes) {
            return bytes;
        }
        if (body instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
        return jsonSerializer.serialize(body).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Maps exceptions to specific custom exceptions based on the type of exception and, for {@link
     * WebClientResponseException}, the HTTP status code. An {@link ApiException} is returned as is.
     *
     * @param error The throwable error.
     *
     * @return A specific {@link ApiException} representing the error.
     */
    private ApiException mapException(Throwable error) {
        if (error instanceof ApiException apiException) {
            return apiException;
        }
        log.warn("Mapping exception: {}", error.getMessage());
        if (error instanceof WebClientResponseException webClientError) {
            return createException(webClientError.getResponseBodyAsString(), webClientError.getStatusCode().value());

        } else if (error instanceof WebClientRequestException || error instanceof ConnectException ||
                   error instanceof java.net.UnknownHostException) {
            return new ServiceUnavailableException("Failed to connect to external service: " + error.getMessage());

        } else if (error instanceof java.util.concurrent.TimeoutException) {
            return new GatewayTimeoutException("Request timed out: " + error.getMessage());

        } else if (error instanceof WebClientException) {
            return new ApiException("Unexpected WebClient error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());

        } else {
            return new ApiException("Internal API client error: " + error.getMessage(),
                                    HttpStatus.INTERNAL_SERVER_ERROR.value());
        }
    }

    /**
     * Handles the {@link ClientResponse}: a 2xx body becomes an {@link ApiResponse}, anything else
     * an {@link ApiException} carrying the response body.
     */
    private Mono<ApiResponse> handleResponse(ClientResponse response) {
        int statusCode = response.statusCode().value();
        if (response.statusCode().is2xxSuccessful()) {
            log.debug("Response was successful, statusCode {}", statusCode);
            return handleSuccessResponse(response, statusCode);
        }
        log.warn("Response was NOT successful, statusCode {}", statusCode);
        return handleErrorResponse(response, statusCode);
    }

    private Mono<ApiResponse> handleSuccessResponse(ClientResponse response, int statusCode) {
        Instant timestamp = Instant.now();
        HttpHeaders headers = response.headers().asHttpHeaders();
        return response.bodyToMono(byte[].class)
                       .defaultIfEmpty(new byte[0])
                       .map(data -> ApiResponse.builder().data(data).acceptType(headers.getContentType())
                                               .headers(headers).statusCode(statusCode).timestamp(timestamp).build())
                       .onErrorMap(error -> {
                           log.error("Error processing successful response body", error);
                           return new ApiException("Error processing response: " + error.getMessage(), statusCode);
                       });
    }

    private Mono<ApiResponse> handleErrorResponse(ClientResponse response, int statusCode) {
        return response.bodyToMono(String.class).defaultIfEmpty("").flatMap(body -> {
            log.warn("Error response body: {}", body);
            return Mono.error(createException(body, statusCode));
        });
    }

    /**
     * Creates an appropriate {@link ApiException} based on the provided HTTP status code and error
     * message.
     */
    private ApiException createException(String body, int statusCode) {
        String message = StringUtils.hasText(body) ? body : "HTTP " + statusCode;
        return switch (statusCode) {
            case 400 -> new BadRequestException(message);
            case 401 -> new UnauthorizedException(message);
            case 403 -> new ForbiddenException(message);
            case 404 -> new NotFoundException(message);
            case 429 -> new TooManyRequestsException(message);
            case 500 -> new InternalServerException(message);
            case 503 -> new ServiceUnavailableException(message);
            case 504 -> new GatewayTimeoutException(message);
            default -> new ApiException(message, statusCode);
        };
    }
}
