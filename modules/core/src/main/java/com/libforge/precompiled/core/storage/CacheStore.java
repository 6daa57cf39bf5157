package com.libforge.precompiled.core.storage;

import com.libforge.precompiled.core.config.ResolverSettings;
import com.libforge.precompiled.types.FailureKind;
import com.libforge.precompiled.types.Reporter;
import com.libforge.precompiled.types.ResolutionException;
import com.libforge.precompiled.types.Stage;
import com.libforge.precompiled.util.AtomicFiles;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local file cache in front of the release host.
 *
 * <p>A cached file is trusted until a verification step evicts it; eviction is the
 * caller's job. Downloads are retried with exponential backoff on transient failures
 * only and land on disk through an atomic rename, so concurrent processes sharing the
 * cache see either the whole file or nothing.
 */
public class CacheStore {

    private final HttpTransport transport;
    private final RetryConfig retryConfig;

    public CacheStore(HttpTransport transport, ResolverSettings settings) {
        this.transport = transport;
        this.retryConfig = RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoff().toMillis(), settings.backoffMultiplier()))
                .retryOnException(e -> e instanceof IOException)
                .build();
    }

    /**
     * Returns the bytes at {@code localPath}, downloading them from {@code uri} first
     * when the file is not cached.
     *
     * @throws RemoteNotFoundException on HTTP 404
     * @throws NetworkException        on any other failed download
     */
    public byte[] getOrFetch(Path localPath, URI uri, Stage stage, Reporter reporter) {
        if (Files.isRegularFile(localPath)) {
            reporter.debugf("Using cached %s", localPath);
            try {
                return Files.readAllBytes(localPath);
            } catch (IOException e) {
                throw new ResolutionException(FailureKind.IO_ERROR, stage, "Failed to read " + localPath, e);
            }
        }

        reporter.debugf("Downloading %s", uri);
        byte[] body = download(uri, stage, reporter);
        try {
            AtomicFiles.write(localPath, body);
        } catch (IOException e) {
            throw new ResolutionException(FailureKind.IO_ERROR, stage, "Failed to write " + localPath, e);
        }
        return body;
    }

    /**
     * Deletes the given cache files. Missing files are ignored.
     */
    public void evict(Stage stage, Path... paths) {
        try {
            AtomicFiles.deleteAll(paths);
        } catch (IOException e) {
            throw new ResolutionException(FailureKind.IO_ERROR, stage, "Failed to evict cached files", e);
        }
    }

    private byte[] download(URI uri, Stage stage, Reporter reporter) {
        Retry retry = Retry.of("download", retryConfig);
        retry.getEventPublisher().onRetry(event -> reporter.infof(
                "Retrying %s in %d ms (attempt %d): %s", uri, event.getWaitInterval().toMillis(),
                event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage()));
        try {
            return retry.executeCheckedSupplier(() -> fetchOnce(uri, stage));
        } catch (ResolutionException | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new NetworkException(stage, uri, "download failed for " + uri + ": " + e.getMessage(), e);
        }
    }

    private byte[] fetchOnce(URI uri, Stage stage) throws IOException {
        HttpTransport.Response response = transport.get(uri);
        int status = response.status();
        if (response.isSuccess()) {
            return response.body();
        }
        if (status == 404) {
            throw new RemoteNotFoundException(stage, uri);
        }
        if (TransientStatusException.isTransient(status)) {
            throw new TransientStatusException(status);
        }
        throw new NetworkException(stage, uri, "HTTP " + status + " for " + uri, null);
    }
}
