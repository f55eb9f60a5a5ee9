package com.eyelevel.videosynthesis.common.apiclient.omnihuman;

import com.eyelevel.videosynthesis.common.apiclient.ApiClient;
import com.eyelevel.videosynthesis.common.apiclient.authentication.Authentication;
import com.eyelevel.videosynthesis.common.apiclient.model.ApiRequest;
import com.eyelevel.videosynthesis.common.apiclient.model.ApiResponse;
import com.eyelevel.videosynthesis.common.json.JsonParser;
import com.eyelevel.videosynthesis.common.json.JsonSerializer;
import com.eyelevel.videosynthesis.dto.omnihuman.request.OmniHumanSubmitTaskRequest;
import com.eyelevel.videosynthesis.dto.omnihuman.request.OmniHumanTaskResultRequest;
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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Client for the signature-protected visual generation API. Every call, status checks included,
 * is signed with a fresh timestamp.
 */
@Slf4j
@Service("omniHumanApiClient")
public class OmniHumanApiClient extends ApiClient {

    private final JsonParser jsonParser;
    private final String submitAction;
    private final String resultAction;
    private final String version;

    public OmniHumanApiClient(
            @Qualifier("omniHumanWebClient") final WebClient webClient,
            @Qualifier("omniHumanAuthentication") final Authentication authentication,
            @Qualifier("jacksonJsonSerializer") final JsonSerializer jsonSerializer,
            @Qualifier("jacksonJsonParser") final JsonParser jsonParser,
            @Value("${app.omnihuman-client.base-url}") final String baseUrl,
            @Value("${app.omnihuman-client.submit-action}") final String submitAction,
            @Value("${app.omnihuman-client.result-action}") final String resultAction,
            @Value("${app.omnihuman-client.version}") final String version
    ) {
        super(webClient, authentication, jsonSerializer, baseUrl);
        this.jsonParser = jsonParser;
        this.submitAction = submitAction;
        this.resultAction = resultAction;
        this.version = version;
    }

    /**
     * Creates a generation task.
     *
     * @param request the job-creation body.
     * @return the raw response document.
     * @throws ApiException if the API answers with a non-2xx status or an unreadable body.
     */
    public JsonNode submitTask(final OmniHumanSubmitTaskRequest request) {
        log.info("Submitting task with request key '{}'", request.reqKey());
        final ApiResponse apiResponse = call(actionRequest(submitAction, request));
        return readTree(apiResponse, "submit");
    }

    /**
     * Fetches the current state of a task.
     *
     * @param reqKey the request key the task was created with.
     * @param taskId the remote task id.
     * @return the raw response document.
     * @throws ApiException if the API answers with a non-2xx status or an unreadable body.
     */
    public JsonNode fetchTaskResult(final String reqKey, final String taskId) {
        log.debug("Fetching result for task {} with request key '{}'", taskId, reqKey);
        final ApiResponse apiResponse = call(actionRequest(resultAction, new OmniHumanTaskResultRequest(reqKey, taskId)));
        return readTree(apiResponse, "result");
    }

    private ApiRequest actionRequest(final String action, final Object body) {
        final Map<String, Object> queryParams = new LinkedHashMap<>();
        queryParams.put("Action", action);
        queryParams.put("Version", version);
        return ApiRequest.builder()
                .method(HttpMethod.POST)
                .queryParams(queryParams)
                .body(body)
                .contentType(MediaType.APPLICATION_JSON)
                .acceptMediaType(MediaType.APPLICATION_JSON)
                .build();
    }

    private JsonNode readTree(final ApiResponse apiResponse, final String operation) {
        try {
            return jsonParser.parseObject(apiResponse.getData(), JsonNode.class);
        } catch (final JsonParsingException e) {
            log.warn("Unreadable {} response from the visual API", operation, e);
            throw new ApiException("Unreadable " + operation + " response: " + e.getMessage(),
                                   HttpStatus.BAD_GATEWAY.value());
        }
    }
}
