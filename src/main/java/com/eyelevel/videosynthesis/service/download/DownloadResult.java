package com.eyelevel.videosynthesis.service.download;

import java.nio.file.Path;

/**
 * Outcome of an artifact download. A failed download leaves no partial file next to {@code path}.
 */
public record DownloadResult(boolean successful, Path path, long bytesWritten, String failureReason) {

    public static DownloadResult success(Path path, long bytesWritten) {
        return new DownloadResult(true, path, bytesWritten, null);
    }

    public static DownloadResult failure(Path path, String failureReason) {
        return new DownloadResult(false, path, 0, failureReason);
    }
}
