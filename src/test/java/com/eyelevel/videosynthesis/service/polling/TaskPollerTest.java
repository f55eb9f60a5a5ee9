package com.eyelevel.videosynthesis.service.polling;

import com.eyelevel.videosynthesis.common.json.jackson.JacksonJsonParser;
import com.eyelevel.videosynthesis.config.VideoSynthesisConfig;
import com.eyelevel.videosynthesis.exception.ConfigurationException;
import com.eyelevel.videosynthesis.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.videosynthesis.model.GenerationJobType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class TaskPollerTest {

    private static final String TASK_ID = "cgt-1";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final VideoSynthesisConfig config = new VideoSynthesisConfig();
    private final TaskPoller poller = new TaskPoller(config, new PollRetryListener());
    private final PollingProfile profile =
            new PollingProfiles(new JacksonJsonParser(objectMapper)).forJobType(GenerationJobType.SEEDANCE_VIDEO);

    @Test
    void pollsUntilSucceeded() {
        ScriptedSource source = new ScriptedSource()
                .status("queued")
                .status("running")
                .respond("{\"status\":\"succeeded\",\"content\":{\"video_url\":\"https://cdn.example.com/v.mp4\"}}");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken(), 10, 0);

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.SUCCEEDED);
        assertThat(outcome.result()).isEqualTo("https://cdn.example.com/v.mp4");
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(source.calls.get()).isEqualTo(3);
    }

    @Test
    void timesOutAfterExactlyMaxAttempts() {
        ScriptedSource source = new ScriptedSource().repeat("{\"status\":\"queued\"}");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken(), 4, 0);

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.TIMED_OUT);
        assertThat(outcome.message()).isEqualTo("Task timed out after 4 attempts");
        assertThat(outcome.attempts()).isEqualTo(4);
        assertThat(source.calls.get()).isEqualTo(4);
    }

    @Test
    void unrecognizedStatusKeepsPolling() {
        ScriptedSource source = new ScriptedSource()
                .status("warming_up")
                .respond("{\"status\":\"succeeded\",\"content\":{\"video_url\":\"https://cdn.example.com/v.mp4\"}}");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken(), 5, 0);

        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(2);
    }

    @Test
    void failedStatusStopsWithDetails() {
        ScriptedSource source = new ScriptedSource()
                .status("running")
                .respond("{\"status\":\"failed\",\"error\":{\"code\":\"InvalidParameter\",\"message\":\"bad image\"}}");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken(), 5, 0);

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.FAILED);
        assertThat(outcome.message()).isEqualTo("Task failed: InvalidParameter: bad image");
        assertThat(source.calls.get()).isEqualTo(2);
    }

    @Test
    void succeededWithoutResultIsAFailure() {
        ScriptedSource source = new ScriptedSource().status("succeeded");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken(), 5, 0);

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.FAILED);
        assertThat(outcome.message()).isEqualTo("Task succeeded but returned no video URL");
    }

    @Test
    void transientErrorsUseAnAttemptAndContinue() {
        ScriptedSource source = new ScriptedSource()
                .fail(new ServiceUnavailableException("connection reset"))
                .fail(new UncheckedIOException(new IOException("broken pipe")))
                .respond("{\"status\":\"succeeded\",\"content\":{\"video_url\":\"https://cdn.example.com/v.mp4\"}}");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken(), 5, 0);

        assertThat(outcome.isSuccessful()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
    }

    @Test
    void onlyTransientErrorsEndInTimeout() {
        ScriptedSource source = new ScriptedSource().repeatFailure(new ServiceUnavailableException("down"));

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken(), 3, 0);

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.TIMED_OUT);
        assertThat(source.calls.get()).isEqualTo(3);
    }

    @Test
    void cancelledBeforeStartIssuesNoRequest() {
        CancellationToken token = new CancellationToken();
        token.cancel();
        ScriptedSource source = new ScriptedSource().repeat("{\"status\":\"queued\"}");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, token, 5, 0);

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.CANCELLED);
        assertThat(outcome.attempts()).isZero();
        assertThat(source.calls.get()).isZero();
    }

    @Test
    void cancellationInterruptsTheDelay() {
        CancellationToken token = new CancellationToken();
        AtomicInteger calls = new AtomicInteger();
        TaskStatusSource source = taskId -> {
            calls.incrementAndGet();
            token.cancel();
            return json("{\"status\":\"running\"}");
        };

        PollOutcome outcome = assertTimeoutPreemptively(Duration.ofSeconds(5),
                () -> poller.poll(TASK_ID, source, profile, token, 5, 60_000));

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.CANCELLED);
        assertThat(outcome.attempts()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    void configurationErrorPropagatesImmediately() {
        ScriptedSource source = new ScriptedSource().repeatFailure(new ConfigurationException("no credentials"));

        assertThatThrownBy(() -> poller.poll(TASK_ID, source, profile, new CancellationToken(), 5, 0))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("no credentials");
        assertThat(source.calls.get()).isEqualTo(1);
    }

    @Test
    void usesConfiguredBudgetByDefault() {
        config.getPolling().setMaxAttempts(2);
        config.getPolling().setDelayMs(0);
        ScriptedSource source = new ScriptedSource().repeat("{\"status\":\"running\"}");

        PollOutcome outcome = poller.poll(TASK_ID, source, profile, new CancellationToken());

        assertThat(outcome.state()).isEqualTo(PollOutcome.State.TIMED_OUT);
        assertThat(source.calls.get()).isEqualTo(2);
    }

    @Test
    void rejectsInvalidBudget() {
        ScriptedSource source = new ScriptedSource();

        assertThatThrownBy(() -> poller.poll(TASK_ID, source, profile, new CancellationToken(), 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> poller.poll(TASK_ID, source, profile, new CancellationToken(), 1, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private JsonNode json(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Replays scripted responses in order; the last step repeats once the script runs out.
     */
    private final class ScriptedSource implements TaskStatusSource {

        private final Deque<Step> steps = new ArrayDeque<>();
        private final AtomicInteger calls = new AtomicInteger();

        ScriptedSource status(String status) {
            return respond("{\"status\":\"" + status + "\"}");
        }

        ScriptedSource respond(String body) {
            JsonNode node = json(body);
            steps.add(() -> node);
            return this;
        }

        ScriptedSource fail(RuntimeException error) {
            steps.add(() -> {
                throw error;
            });
            return this;
        }

        ScriptedSource repeat(String body) {
            return respond(body);
        }

        ScriptedSource repeatFailure(RuntimeException error) {
            return fail(error);
        }

        @Override
        public JsonNode fetchStatus(String taskId) {
            calls.incrementAndGet();
            Step step = steps.size() > 1 ? steps.poll() : steps.peek();
            if (step == null) {
                throw new IllegalStateException("No scripted response");
            }
            return step.run();
        }
    }

    @FunctionalInterface
    private interface Step {
        JsonNode run();
    }
}
