package com.eyelevel.videosynthesis.service.polling;

import com.eyelevel.videosynthesis.common.json.JsonParser;
import com.eyelevel.videosynthesis.exception.json.JsonParsingException;
import com.eyelevel.videosynthesis.model.GenerationJobType;
import com.eyelevel.videosynthesis.model.OmniHumanTaskStatus;
import com.eyelevel.videosynthesis.model.SeedanceTaskStatus;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The {@link PollingProfile} of each job type.
 *
 * <ul>
 *     <li>Signed family: status at {@code data.status}, video at {@code data.video_url}. Subject
 *     identification succeeds only when {@code data.resp_data}, itself a JSON string, reports
 *     {@code status == 1}; the task id then doubles as the subject id.</li>
 *     <li>Token family: status at {@code status}, video at {@code content.video_url}, failure
 *     details in {@code error} and {@code failure_reason}.</li>
 * </ul>
 */
@Slf4j
@Component
public class PollingProfiles {

    static final int SUBJECT_FOUND = 1;

    private final PollingProfile omniHumanSubject;
    private final PollingProfile omniHumanVideo;
    private final PollingProfile seedanceVideo;

    public PollingProfiles(@Qualifier("jacksonJsonParser") JsonParser jsonParser) {
        JsonPointer signedStatus = JsonPointer.compile("/data/status");
        this.omniHumanSubject = new PollingProfile("subject identification", signedStatus,
                OmniHumanTaskStatus::normalize,
                (taskId, response) -> extractSubjectId(jsonParser, taskId, response),
                "No human subject found in the image",
                PollingProfiles::describeSignedFailure, null);
        this.omniHumanVideo = new PollingProfile("portrait video", signedStatus,
                OmniHumanTaskStatus::normalize,
                (taskId, response) -> text(response.at("/data/video_url")),
                "Task succeeded but returned no video URL",
                PollingProfiles::describeSignedFailure, null);
        this.seedanceVideo = new PollingProfile("image-to-video", JsonPointer.compile("/status"),
                SeedanceTaskStatus::normalize,
                (taskId, response) -> text(response.at("/content/video_url")),
                "Task succeeded but returned no video URL",
                PollingProfiles::describeTokenFailure, JsonPointer.compile("/progress"));
    }

    public PollingProfile forJobType(GenerationJobType jobType) {
        return switch (jobType) {
            case OMNIHUMAN_SUBJECT -> omniHumanSubject;
            case OMNIHUMAN_VIDEO -> omniHumanVideo;
            case SEEDANCE_VIDEO -> seedanceVideo;
        };
    }

    private static Optional<String> extractSubjectId(JsonParser jsonParser, String taskId, JsonNode response) {
        JsonNode respData = response.at("/data/resp_data");
        JsonNode parsed;
        if (respData.isTextual()) {
            if (!StringUtils.hasText(respData.asText())) {
                return Optional.empty();
            }
            try {
                parsed = jsonParser.parseObject(respData.asText(), JsonNode.class);
            } catch (JsonParsingException e) {
                log.warn("Unreadable resp_data for subject task {}", taskId, e);
                return Optional.empty();
            }
        } else {
            parsed = respData;
        }
        return parsed.path("status").asInt(-1) == SUBJECT_FOUND ? Optional.of(taskId) : Optional.empty();
    }

    private static String describeSignedFailure(JsonNode response) {
        String message = response.path("message").asText("");
        String dataMessage = response.path("data").path("message").asText("");
        String detail = StringUtils.hasText(dataMessage) ? dataMessage : message;
        return StringUtils.hasText(detail) ? "Task failed: " + detail : "Task failed";
    }

    private static String describeTokenFailure(JsonNode response) {
        List<String> details = new ArrayList<>();
        JsonNode error = response.path("error");
        if (error.isObject()) {
            String code = error.path("code").asText("");
            String message = error.path("message").asText("");
            details.add(StringUtils.hasText(code) ? code + ": " + message : message);
        } else if (error.isValueNode() && !error.isNull()) {
            details.add(error.asText());
        }
        String reason = response.path("failure_reason").asText("");
        if (StringUtils.hasText(reason)) {
            details.add("reason: " + reason);
        }
        details.removeIf(detail -> !StringUtils.hasText(detail));
        return details.isEmpty() ? "Task failed" : "Task failed: " + String.join(", ", details);
    }

    private static Optional<String> text(JsonNode node) {
        return node.isValueNode() && !node.isNull() && StringUtils.hasText(node.asText()) ? Optional.of(node.asText()) : Optional.empty();
    }
}
