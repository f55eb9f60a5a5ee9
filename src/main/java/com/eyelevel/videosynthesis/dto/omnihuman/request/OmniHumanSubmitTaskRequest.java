package com.eyelevel.videosynthesis.dto.omnihuman.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Job-creation body for the signed family. {@code audio_url} is omitted for subject
 * identification.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OmniHumanSubmitTaskRequest(
        @JsonProperty("req_key") String reqKey,
        @JsonProperty("image_url") String imageUrl,
        @JsonProperty("audio_url") String audioUrl
) {
}
