package com.eyelevel.videosynthesis.service.polling;

import com.eyelevel.videosynthesis.config.VideoSynthesisConfig;
import com.eyelevel.videosynthesis.exception.ConfigurationException;
import com.eyelevel.videosynthesis.exception.SigningException;
import com.eyelevel.videosynthesis.exception.TransientPollException;
import com.eyelevel.videosynthesis.model.TaskStatus;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls a remote task until it reaches a terminal status, the attempt budget runs out, or the
 * job is cancelled.
 *
 * <p>Each attempt issues exactly one status request. Transport and HTTP failures are logged and
 * count as a used attempt; they never end the loop early. Statuses outside the family's
 * vocabulary are treated like {@code Running}. Running out of attempts is reported as
 * {@link PollOutcome.State#TIMED_OUT}, not thrown. Only configuration and signing errors escape,
 * since every further request would fail the same way.
 *
 * <p>The loop runs on a {@link RetryTemplate}: a non-terminal status is signalled as a retryable
 * exception and the fixed back-off between attempts waits on the {@link CancellationToken}, so
 * cancellation takes effect without sitting out the delay.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskPoller {

    private static final String PREVIOUS_STATUS = "poll.previousStatus";

    private final VideoSynthesisConfig videoSynthesisConfig;
    private final PollRetryListener pollRetryListener;

    public PollOutcome poll(String taskId, TaskStatusSource statusSource, PollingProfile profile,
                            CancellationToken cancellationToken) {
        VideoSynthesisConfig.Polling polling = videoSynthesisConfig.getPolling();
        return poll(taskId, statusSource, profile, cancellationToken, polling.getMaxAttempts(), polling.getDelayMs());
    }

    /**
     * @param maxAttempts upper bound on status requests; at least 1
     * @param delayMs     pause between attempts, none after the last one
     */
    public PollOutcome poll(String taskId, TaskStatusSource statusSource, PollingProfile profile,
                            CancellationToken cancellationToken, int maxAttempts, long delayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (delayMs < 0) {
            throw new IllegalArgumentException("delayMs must not be negative, was " + delayMs);
        }
        log.info("Polling {} task {}: up to {} attempts every {} ms", profile.name(), taskId, maxAttempts, delayMs);

        AtomicInteger requests = new AtomicInteger();
        RetryTemplate retryTemplate = buildRetryTemplate(maxAttempts, delayMs, cancellationToken);
        try {
            return retryTemplate.execute(
                    context -> attempt(taskId, statusSource, profile, cancellationToken, requests, context),
                    context -> recover(taskId, profile, requests.get(), context));
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Polling of task {} interrupted after {} attempts", taskId, requests.get());
            return PollOutcome.cancelled(requests.get());
        }
    }

    private RetryTemplate buildRetryTemplate(int maxAttempts, long delayMs, CancellationToken cancellationToken) {
        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(maxAttempts,
                Map.of(TaskPendingException.class, true, TransientPollException.class, true));

        FixedBackOffPolicy backOffPolicy = new FixedBackOffPolicy();
        backOffPolicy.setBackOffPeriod(delayMs);
        // Returns early when cancelled; the next attempt then stops the loop.
        backOffPolicy.setSleeper(period -> cancellationToken.awaitCancellation(Duration.ofMillis(period)));

        RetryTemplate retryTemplate = new RetryTemplate();
        retryTemplate.setRetryPolicy(retryPolicy);
        retryTemplate.setBackOffPolicy(backOffPolicy);
        retryTemplate.registerListener(pollRetryListener);
        return retryTemplate;
    }

    private PollOutcome attempt(String taskId, TaskStatusSource statusSource, PollingProfile profile,
                                CancellationToken cancellationToken, AtomicInteger requests, RetryContext context) {
        if (cancellationToken.isCancellationRequested()) {
            throw new PollCancelledException(taskId);
        }
        int attempt = requests.incrementAndGet();

        JsonNode response;
        TaskStatus status;
        try {
            response = statusSource.fetchStatus(taskId);
            status = profile.resolveStatus(response);
        } catch (ConfigurationException | SigningException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new TransientPollException("Status check " + attempt + " for task " + taskId + " failed", e);
        }

        logStatus(taskId, profile, response, status, attempt, context);

        return switch (status) {
            case SUCCEEDED -> succeeded(taskId, profile, response, attempt);
            case FAILED -> failed(taskId, profile, response, attempt);
            default -> throw new TaskPendingException(status);
        };
    }

    private static PollOutcome succeeded(String taskId, PollingProfile profile, JsonNode response, int attempt) {
        Optional<String> result = profile.resultExtractor().extract(taskId, response);
        if (result.isPresent()) {
            log.info("Task {} succeeded after {} attempts", taskId, attempt);
            return PollOutcome.succeeded(result.get(), attempt);
        }
        log.error("Task {} succeeded without a usable result: {}", taskId, profile.missingResultMessage());
        return PollOutcome.failed(profile.missingResultMessage(), attempt);
    }

    private static PollOutcome failed(String taskId, PollingProfile profile, JsonNode response, int attempt) {
        String reason = profile.failureDescriber().describe(response);
        log.error("Task {} failed after {} attempts. {}", taskId, attempt, reason);
        return PollOutcome.failed(reason, attempt);
    }

    private void logStatus(String taskId, PollingProfile profile, JsonNode response, TaskStatus status,
                           int attempt, RetryContext context) {
        String rawStatus = profile.rawStatus(response);
        String progress = profile.progress(response);
        String progressText = progress == null ? "" : ", progress " + progress + "%";
        String label = rawStatus == null ? "<none>" : rawStatus;
        Object previous = context.getAttribute(PREVIOUS_STATUS);
        context.setAttribute(PREVIOUS_STATUS, label);

        if (!label.equals(previous)) {
            if (status == TaskStatus.UNKNOWN) {
                log.info("Task {} attempt {}: unrecognized status '{}'{}", taskId, attempt, rawStatus, progressText);
            } else {
                log.info("Task {} attempt {}: status {} ({}){}", taskId, attempt, status, rawStatus, progressText);
            }
        } else {
            log.debug("Task {} attempt {}: status unchanged ({}){}", taskId, attempt, rawStatus, progressText);
        }
    }

    private PollOutcome recover(String taskId, PollingProfile profile, int attempts, RetryContext context) {
        Throwable last = context.getLastThrowable();
        if (last instanceof PollCancelledException) {
            log.info("Polling of {} task {} cancelled after {} attempts", profile.name(), taskId, attempts);
            return PollOutcome.cancelled(attempts);
        }
        if (last instanceof ConfigurationException configurationException) {
            throw configurationException;
        }
        if (last instanceof SigningException signingException) {
            throw signingException;
        }
        if (last instanceof TaskPendingException || last instanceof TransientPollException) {
            log.error("Task {} did not reach a terminal status within {} attempts", taskId, attempts);
            return PollOutcome.timedOut(attempts);
        }
        log.error("Polling of task {} aborted by an unexpected error", taskId, last);
        return PollOutcome.failed("Polling aborted: " + (last == null ? "unknown error" : last.getMessage()), attempts);
    }
}
