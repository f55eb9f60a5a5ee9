package com.eyelevel.videosynthesis.service.submission;

import com.eyelevel.videosynthesis.model.GenerationJobType;

/**
 * A signed-family job: subject identification ({@code audioUrl} null) or portrait video.
 */
public record OmniHumanTaskRequest(GenerationJobType jobType, String imageUrl, String audioUrl) {

    public static OmniHumanTaskRequest subject(String imageUrl) {
        return new OmniHumanTaskRequest(GenerationJobType.OMNIHUMAN_SUBJECT, imageUrl, null);
    }

    public static OmniHumanTaskRequest video(String imageUrl, String audioUrl) {
        return new OmniHumanTaskRequest(GenerationJobType.OMNIHUMAN_VIDEO, imageUrl, audioUrl);
    }
}
