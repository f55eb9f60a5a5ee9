package com.eyelevel.videosynthesis.service.download;

import com.eyelevel.videosynthesis.config.VideoSynthesisConfig;
import com.eyelevel.videosynthesis.exception.DownloadException;
import com.eyelevel.videosynthesis.service.polling.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Iterator;
import java.util.OptionalLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Streams a result artifact to disk without holding it in memory.
 *
 * <p>The body is written in fixed-size chunks to {@code <target>.part}, checked against the
 * declared {@code Content-Length} when there is one, and only then moved onto the target. A
 * failed download leaves neither the target nor the partial file behind.
 */
@Slf4j
@Service
public class ArtifactDownloader {

    static final String PARTIAL_SUFFIX = ".part";

    private final WebClient downloadWebClient;
    private final VideoSynthesisConfig videoSynthesisConfig;

    public ArtifactDownloader(@Qualifier("downloadWebClient") WebClient downloadWebClient,
                              VideoSynthesisConfig videoSynthesisConfig) {
        this.downloadWebClient = downloadWebClient;
        this.videoSynthesisConfig = videoSynthesisConfig;
    }

    public DownloadResult download(String url, Path target) {
        return download(url, target, new CancellationToken());
    }

    /**
     * Downloads {@code url} to {@code target}, replacing any existing file.
     *
     * @param cancellationToken checked between chunks
     * @return the outcome. Failures are reported, not thrown.
     */
    public DownloadResult download(String url, Path target, CancellationToken cancellationToken) {
        Path partial = target.resolveSibling(target.getFileName() + PARTIAL_SUFFIX);
        log.info("Downloading artifact to {}", target);
        try {
            long written = streamToFile(url, partial, cancellationToken);
            moveIntoPlace(partial, target);
            log.info("Artifact saved to {} ({} bytes)", target, written);
            return DownloadResult.success(target, written);
        } catch (DownloadException | IOException e) {
            log.error("Download to {} failed: {}", target, e.getMessage(), e);
            deletePartial(partial);
            return DownloadResult.failure(target, "Download failed: " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Download to {} failed", target, e);
            deletePartial(partial);
            return DownloadResult.failure(target, "Download failed: "
                    + (e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()));
        }
    }

    private long streamToFile(String url, Path partial, CancellationToken cancellationToken) throws IOException {
        VideoSynthesisConfig.Download settings = videoSynthesisConfig.getDownload();
        AtomicReference<OptionalLong> declaredLength = new AtomicReference<>(OptionalLong.empty());

        Flux<DataBuffer> body = downloadWebClient.get()
                .uri(URI.create(url))
                .exchangeToFlux(response -> {
                    if (!response.statusCode().is2xxSuccessful()) {
                        int status = response.statusCode().value();
                        return response.releaseBody()
                                .thenMany(Flux.<DataBuffer>error(new DownloadException("HTTP " + status + " from artifact host")));
                    }
                    declaredLength.set(response.headers().contentLength());
                    return response.bodyToFlux(DataBuffer.class);
                })
                .timeout(Duration.ofSeconds(settings.getTimeoutSeconds()))
                .doOnDiscard(DataBuffer.class, DataBufferUtils::release);

        Path directory = partial.toAbsolutePath().getParent();
        if (directory != null) {
            Files.createDirectories(directory);
        }

        long written = 0;
        // Closing the stream cancels the exchange if the loop exits early.
        try (Stream<DataBuffer> buffers = body.toStream(); OutputStream out = Files.newOutputStream(partial)) {
            Iterator<DataBuffer> iterator = buffers.iterator();
            while (iterator.hasNext()) {
                try (InputStream in = iterator.next().asInputStream(true)) {
                    if (cancellationToken.isCancellationRequested()) {
                        throw new DownloadException("cancelled");
                    }
                    written += IOUtils.copy(in, out, settings.getChunkSize());
                }
                log.trace("Wrote {} bytes so far to {}", written, partial);
            }
        }

        OptionalLong expected = declaredLength.get();
        if (expected.isPresent() && expected.getAsLong() != written) {
            throw new DownloadException("expected " + expected.getAsLong() + " bytes but received " + written);
        }
        return written;
    }

    private static void moveIntoPlace(Path partial, Path target) throws IOException {
        try {
            Files.move(partial, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to a plain move", target);
            Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deletePartial(Path partial) {
        try {
            if (Files.deleteIfExists(partial)) {
                log.debug("Removed partial download {}", partial);
            }
        } catch (IOException e) {
            log.warn("Could not remove partial download {}", partial, e);
        }
    }
}
