package com.eyelevel.videosynthesis.service.polling;

/**
 * Terminal result of a poll loop. Only {@link State#SUCCEEDED} carries a result.
 *
 * @param state    how the loop ended
 * @param result   the extracted result reference, when successful
 * @param message  human-readable description
 * @param attempts number of status requests issued
 */
public record PollOutcome(State state, String result, String message, int attempts) {

    public enum State {
        SUCCEEDED,
        FAILED,
        TIMED_OUT,
        CANCELLED
    }

    public static PollOutcome succeeded(String result, int attempts) {
        return new PollOutcome(State.SUCCEEDED, result, "Task succeeded", attempts);
    }

    public static PollOutcome failed(String message, int attempts) {
        return new PollOutcome(State.FAILED, null, message, attempts);
    }

    public static PollOutcome timedOut(int attempts) {
        return new PollOutcome(State.TIMED_OUT, null, "Task timed out after " + attempts + " attempts", attempts);
    }

    public static PollOutcome cancelled(int attempts) {
        return new PollOutcome(State.CANCELLED, null, "Polling cancelled after " + attempts + " attempts", attempts);
    }

    public boolean isSuccessful() {
        return state == State.SUCCEEDED;
    }
}
