package com.eyelevel.videosynthesis.dto.seedance.request;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Job-creation body for the token family: a model id plus an ordered list of content items, the
 * prompt text first and the frame images after it.
 */
public record SeedanceCreateTaskRequest(String model, List<ContentItem> content) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ContentItem(
            String type,
            String text,
            @JsonProperty("image_url") ImageUrl imageUrl,
            String role
    ) {

        public static ContentItem text(String text) {
            return new ContentItem("text", text, null, null);
        }

        public static ContentItem image(String url, String role) {
            return new ContentItem("image_url", null, new ImageUrl(url), role);
        }
    }

    public record ImageUrl(String url) {
    }
}
