package com.eyelevel.videosynthesis.model;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Task states reported by the bearer-token task API, found at the top-level {@code status}.
 */
@Getter
@AllArgsConstructor
public enum SeedanceTaskStatus {
    QUEUED("queued", TaskStatus.QUEUED),
    PENDING("pending", TaskStatus.QUEUED),
    RUNNING("running", TaskStatus.RUNNING),
    PROCESSING("processing", TaskStatus.RUNNING),
    SUCCEEDED("succeeded", TaskStatus.SUCCEEDED),
    FAILED("failed", TaskStatus.FAILED),
    CANCELLED("cancelled", TaskStatus.FAILED);

    private static final Map<String, SeedanceTaskStatus> VALUE_MAP = Stream.of(values()).collect(
            Collectors.toMap(SeedanceTaskStatus::getValue, Function.identity()));
    private final String value;
    private final TaskStatus taskStatus;

    public static TaskStatus normalize(String value) {
        SeedanceTaskStatus status = value == null ? null : VALUE_MAP.get(value);
        return status == null ? TaskStatus.UNKNOWN : status.getTaskStatus();
    }
}
