package com.eyelevel.videosynthesis.service.submission;

import com.eyelevel.videosynthesis.common.apiclient.omnihuman.OmniHumanApiClient;
import com.eyelevel.videosynthesis.dto.omnihuman.request.OmniHumanSubmitTaskRequest;
import com.eyelevel.videosynthesis.exception.SubmissionException;
import com.eyelevel.videosynthesis.exception.apiclient.ApiException;
import com.eyelevel.videosynthesis.model.GenerationJobType;
import com.eyelevel.videosynthesis.model.ServiceFamily;
import com.eyelevel.videosynthesis.model.TaskHandle;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Submits signed-family jobs. The response may carry the task id at the top level or under
 * {@code data}; a deployment that finishes synchronously returns {@code video_url} or
 * {@code subject_id} instead.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OmniHumanTaskSubmitter implements TaskSubmitter<OmniHumanTaskRequest> {

    static final int SUCCESS_CODE = 10000;

    private final OmniHumanApiClient omniHumanApiClient;

    @Override
    public TaskHandle submit(OmniHumanTaskRequest request) {
        GenerationJobType jobType = request.jobType();
        if (jobType == null || jobType.getFamily() != ServiceFamily.OMNIHUMAN) {
            throw new IllegalArgumentException("Not a signed-family job type: " + jobType);
        }
        if (!StringUtils.hasText(request.imageUrl())) {
            throw new IllegalArgumentException("An image URL is required");
        }
        if (jobType == GenerationJobType.OMNIHUMAN_VIDEO && !StringUtils.hasText(request.audioUrl())) {
            throw new IllegalArgumentException("An audio URL is required for video generation");
        }

        String audioUrl = jobType == GenerationJobType.OMNIHUMAN_VIDEO ? request.audioUrl() : null;
        JsonNode response;
        try {
            response = omniHumanApiClient.submitTask(
                    new OmniHumanSubmitTaskRequest(jobType.getReqKey(), request.imageUrl(), audioUrl));
        } catch (ApiException e) {
            throw new SubmissionException("Submission rejected with HTTP " + e.getStatusCode() + ": " + e.getMessage(), e);
        }

        JsonNode code = response.path("code");
        if (code.isNumber() && code.asInt() != SUCCESS_CODE) {
            throw new SubmissionException("Submission rejected with code " + code.asInt() + ": "
                                          + response.path("message").asText(""));
        }

        String taskId = firstText(response, "task_id");
        if (taskId != null) {
            log.info("{} task created with id {}", jobType, taskId);
            return TaskHandle.pending(taskId);
        }
        String resolved = firstText(response, jobType == GenerationJobType.OMNIHUMAN_SUBJECT ? "subject_id" : "video_url");
        if (resolved != null) {
            log.info("{} resolved synchronously", jobType);
            return TaskHandle.resolved(resolved);
        }
        throw new SubmissionException("Submission response carries neither a task id nor a result");
    }

    private static String firstText(JsonNode response, String field) {
        String value = response.path(field).asText(null);
        if (!StringUtils.hasText(value)) {
            value = response.path("data").path(field).asText(null);
        }
        return StringUtils.hasText(value) ? value : null;
    }
}
