package com.eyelevel.videosynthesis.dto.omnihuman.request;

import com.fasterxml.jackson.annotation.JsonProperty;

public record OmniHumanTaskResultRequest(
        @JsonProperty("req_key") String reqKey,
        @JsonProperty("task_id") String taskId
) {
}
