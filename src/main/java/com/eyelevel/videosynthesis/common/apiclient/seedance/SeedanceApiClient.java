package com.eyelevel.videosynthesis.common.apiclient.seedance;

import com.eyelevel.videosynthesis.common.apiclient.ApiClient;
import com.eyelevel.videosynthesis.common.apiclient.authentication.Authentication;
import com.eyelevel.videosynthesis.common.apiclient.model.ApiRequest;
import com.eyelevel.videosynthesis.common.apiclient.model.ApiResponse;
import com.eyelevel.videosynthesis.common.json.JsonParser;
import com.eyelevel.videosynthesis.common.json.JsonSerializer;
import com.eyelevel.videosynthesis.dto.seedance.request.SeedanceCreateTaskRequest;
import com.eyelevel.videosynthesis.exception.apiclient.ApiException;
import com.eyelevel.videosynthesis.exception.json.JsonParsingException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

/**
 * Client for the bearer-token protected content generation task API.
 */
@Slf4j
@Service("seedanceApiClient")
public class SeedanceApiClient extends ApiClient {

    private final JsonParser jsonParser;
    private final String tasksPath;

    public SeedanceApiClient(
            @Qualifier("seedanceWebClient") final WebClient webClient,
            @Qualifier("seedanceAuthentication") final Authentication authentication,
            @Qualifier("jacksonJsonSerializer") final JsonSerializer jsonSerializer,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.seedance-client.base-url}") final String baseUrl,
            @Value("${app.seedance-client.tasks-path}") final String tasksPath
    ) {
        super(webClient, authentication, jsonSerializer, baseUrl);
        this.jsonParser = jsonParser;
        this.tasksPath = tasksPath;
    }

    /**
     * Creates a generation task.
     *
     * @throws ApiException if the API answers with a non-2xx status or an unreadable body.
     */
    public JsonNode createTask(final SeedanceCreateTaskRequest request) {
        log.info("Creating generation task with model '{}'", request.model());
        final ApiRequest apiRequest = ApiRequest.builder()
                .method(HttpMethod.POST)
                .path(tasksPath)
                .body(request)
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
        return readTree(call(apiRequest), "create");
    }

    /**
     * Fetches a task by id.
     *
     * @throws ApiException if the API answers with a non-2xx status or an unreadable body.
     */
    public JsonNode fetchTask(final String taskId) {
        log.debug("Fetching task {}", taskId);
        final ApiRequest apiRequest = ApiRequest.builder()
                .method(HttpMethod.GET)
                .path(tasksPath + "/{taskId}")
                .pathVariables(Map.of("taskId", taskId))
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
        return readTree(call(apiRequest), "status");
    }

    private JsonNode readTree(final ApiResponse apiResponse, final String operation) {
        try {
            return jsonParser.parseObject(apiResponse.getData(), JsonNode.class);
        } catch (final JsonParsingException e) {
            log.warn("Unreadable {} response from the task API", operation, e);
            throw new ApiException("Unreadable " + operation + " response: " + e.getMessage(),
                                   HttpStatus.BAD_GATEWAY.value());
        }
    }
}
