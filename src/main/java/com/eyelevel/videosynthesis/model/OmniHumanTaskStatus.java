package com.eyelevel.videosynthesis.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Task states reported by the signed visual API, found at {@code data.status}.
 */
@Getter
@AllArgsConstructor
public enum OmniHumanTaskStatus {
    IN_QUEUE("in_queue", TaskStatus.QUEUED),
    GENERATING("generating", TaskStatus.RUNNING),
    DONE("done", TaskStatus.SUCCEEDED),
    FAILED("failed", TaskStatus.FAILED),
    NOT_FOUND("not_found", TaskStatus.FAILED),
    EXPIRED("expired", TaskStatus.FAILED);

    private static final Map<String, OmniHumanTaskStatus> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(OmniHumanTaskStatus::getValue, Function.identity()));
    private final String value;
    private final TaskStatus taskStatus;

    /**
     * Maps a raw status string to the normalized status.
     *
     * @param value the raw status, possibly null.
     * @return the normalized status, or {@link TaskStatus#UNKNOWN} for anything unrecognized.
     */
    public static TaskStatus normalize(String value) {
        OmniHumanTaskStatus status = value == null ? null : VALUE_MAP.get(value);
        return status == null ? TaskStatus.UNKNOWN : status.getTaskStatus();
    }
}
