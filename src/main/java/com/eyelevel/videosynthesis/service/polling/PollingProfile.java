package com.eyelevel.videosynthesis.service.polling;

import com.eyelevel.videosynthesis.model.TaskStatus;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.function.Function;

/**
 * Describes how to read one service family's status responses: where the status lives, how its
 * vocabulary maps to {@link TaskStatus}, and how to pull out a result or a failure reason.
 *
 * @param name                 label used in log lines
 * @param statusPointer        location of the raw status string
 * @param statusMapper         raw status to normalized status; must return UNKNOWN, never null
 * @param resultExtractor      result reference from a succeeded response
 * @param missingResultMessage failure message when a succeeded response yields no result
 * @param failureDescriber     reason text from a failed response
 * @param progressPointer      location of a progress value, or null when the family reports none
 */
public record PollingProfile(
        String name,
        JsonPointer statusPointer,
        Function<String, TaskStatus> statusMapper,
        ResultExtractor resultExtractor,
        String missingResultMessage,
        FailureDescriber failureDescriber,
        JsonPointer progressPointer
) {

    @FunctionalInterface
    public interface ResultExtractor {
        Optional<String> extract(String taskId, JsonNode response);
    }

    @FunctionalInterface
    public interface FailureDescriber {
        String describe(JsonNode response);
    }

    public String rawStatus(JsonNode response) {
        JsonNode status = response.at(statusPointer);
        return status.isValueNode() ? status.asText() : null;
    }

    public TaskStatus resolveStatus(JsonNode response) {
        return statusMapper.apply(rawStatus(response));
    }

    public String progress(JsonNode response) {
        if (progressPointer == null) {
            return null;
        }
        JsonNode progress = response.at(progressPointer);
        return progress.isValueNode() ? progress.asText() : null;
    }
}
