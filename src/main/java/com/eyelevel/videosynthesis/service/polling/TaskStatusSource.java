package com.eyelevel.videosynthesis.service.polling;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Issues one status request for a task and returns the raw response document. Implementations
 * that sign requests must sign each call afresh.
 */
@FunctionalInterface
public interface TaskStatusSource {

    JsonNode fetchStatus(String taskId);
}
