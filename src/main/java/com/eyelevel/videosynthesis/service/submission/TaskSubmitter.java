package com.eyelevel.videosynthesis.service.submission;

import com.eyelevel.videosynthesis.model.TaskHandle;

/**
 * Issues an authenticated job-creation request and turns the response into a {@link TaskHandle}.
 * Submissions are never retried here.
 *
 * @param <R> the job request type the service family accepts
 */
public interface TaskSubmitter<R> {

    /**
     * @throws com.eyelevel.videosynthesis.exception.SubmissionException    on a non-2xx response or a
     *                                                                       body carrying neither a task
     *                                                                       id nor a result
     * @throws com.eyelevel.videosynthesis.exception.ConfigurationException if credentials are missing
     * @throws com.eyelevel.videosynthesis.exception.SigningException       if the request cannot be signed
     */
    TaskHandle submit(R request);
}
