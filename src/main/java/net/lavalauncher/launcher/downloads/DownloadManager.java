package net.lavalauncher.launcher.downloads;

import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.FileUtil;
import net.lavalauncher.launcher.utils.FilenameUtil;
import net.lavalauncher.launcher.utils.HashingUtil;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.NamedThreadFactory;
import org.jetbrains.annotations.Nullable;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Downloads files over HTTP (or copies them from {@code file:} URIs) while limiting the number of
 * transfers that are active at the same time.
 * <p>
 * Content is written to a uniquely named {@code .tmp} sibling of the destination first and only moved into place
 * once it has been verified, so the destination never contains a partial download.
 */
public class DownloadManager implements AutoCloseable {
    private static final Logger LOG = Logger.create();

    public static final int DEFAULT_CONCURRENT_DOWNLOADS = 10;

    static final String USER_AGENT = "LavaLauncher/" + Objects.requireNonNullElse(
            DownloadManager.class.getPackage().getImplementationVersion(), "dev");

    private static final int MAX_ATTEMPTS = 5;
    private static final int BUFFER_SIZE = 81920;
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(15);
    private static final long MAX_RETRY_AFTER_SECONDS = 300;

    private final ExecutorService executor = Executors.newCachedThreadPool(new NamedThreadFactory("download"));

    private final HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_2)
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(CONNECT_TIMEOUT)
            .executor(executor)
            .build();

    private final int maxConcurrentDownloads;
    private final Semaphore admission;
    private volatile Duration retryDelay = Duration.ofSeconds(2);

    public DownloadManager() {
        this(DEFAULT_CONCURRENT_DOWNLOADS);
    }

    public DownloadManager(int maxConcurrentDownloads) {
        if (maxConcurrentDownloads < 1) {
            throw new IllegalArgumentException("Cannot set concurrent downloads to less than 1: " + maxConcurrentDownloads);
        }
        this.maxConcurrentDownloads = maxConcurrentDownloads;
        this.admission = new Semaphore(maxConcurrentDownloads, true);
    }

    @Override
    public void close() throws Exception {
        executor.shutdownNow();
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
            LOG.warn("Failed to wait for background downloads to finish.");
        }
    }

    public int getMaxConcurrentDownloads() {
        return maxConcurrentDownloads;
    }

    /**
     * Delay between retries when the server does not send a {@code Retry-After} header.
     */
    public void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    public void download(URI uri, Path finalLocation) throws IOException {
        download(DownloadSpec.of(uri), finalLocation);
    }

    public boolean download(DownloadSpec spec, Path finalLocation) throws IOException {
        return download(spec, finalLocation, DownloadProgressListener.NONE, CancellationToken.NONE);
    }

    /**
     * Downloads into {@code directory}, naming the file after the last path segment of the URI.
     *
     * @return the downloaded file
     */
    public Path downloadToDirectory(DownloadSpec spec,
                                    Path directory,
                                    DownloadProgressListener progressListener,
                                    CancellationToken cancellationToken) throws IOException {
        var destination = directory.resolve(FilenameUtil.getFileName(spec.uri()));
        download(spec, destination, progressListener, cancellationToken);
        return destination;
    }

    /**
     * @return true if the file was transferred, false if a file with the expected checksum was already present
     * @throws FileNotFoundException    if the server responds with 404
     * @throws IntegrityException       if the downloaded content does not match the expected size or checksum twice
     * @throws IllegalArgumentException if the checksum of the spec has an unsupported length
     */
    public boolean download(DownloadSpec spec,
                            Path finalLocation,
                            DownloadProgressListener progressListener,
                            CancellationToken cancellationToken) throws IOException {
        var checksum = spec.checksum();
        var checksumAlgorithm = spec.checksumAlgorithm();

        acquirePermit(cancellationToken);
        try {
            // Don't re-download the file if we can avoid it
            if (checksum != null && Files.isRegularFile(finalLocation)) {
                var currentHash = HashingUtil.hashFile(finalLocation, checksumAlgorithm);
                if (checksum.equalsIgnoreCase(currentHash)) {
                    progressListener.onProgress(1.0);
                    return false;
                }
            }
            LOG.debug("  ↓ " + spec.uri());
            // Concurrent downloads of the same destination each get their own partial file
            var partialFile = finalLocation.resolveSibling(finalLocation.getFileName() + "." + Math.random() + ".tmp");
            Files.createDirectories(partialFile.toAbsolutePath().getParent());

            try {
                for (var attempt = 1; ; attempt++) {
                    transfer(spec.uri(), partialFile, progressListener, cancellationToken);
                    try {
                        verify(spec, partialFile, checksumAlgorithm);
                        break;
                    } catch (IntegrityException e) {
                        if (attempt >= 2) {
                            throw e;
                        }
                        LOG.warn(e.getMessage() + " Downloading " + spec.uri() + " again.");
                    }
                }

                FileUtil.atomicMove(partialFile, finalLocation);
            } catch (IOException | RuntimeException e) {
                deleteIfStale(finalLocation, checksum, checksumAlgorithm, e);
                throw e;
            } finally {
                try {
                    Files.deleteIfExists(partialFile);
                } catch (IOException e) {
                    LOG.warn("Failed to delete temporary download file " + partialFile + ": " + e);
                }
            }
            return true;
        } finally {
            admission.release();
        }
    }

    /**
     * A destination that does not match the expected checksum is removed once its download failed.
     * If another download of the same file has completed in the meantime, its result is kept.
     */
    private static void deleteIfStale(Path finalLocation, @Nullable String checksum, String checksumAlgorithm, Exception failure) {
        if (checksum == null || !Files.isRegularFile(finalLocation)) {
            return;
        }
        try {
            if (!checksum.equalsIgnoreCase(HashingUtil.hashFile(finalLocation, checksumAlgorithm))) {
                Files.deleteIfExists(finalLocation);
            }
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    /**
     * Fetches a small document, such as a JSON API response, into memory.
     */
    public String downloadString(URI uri, CancellationToken cancellationToken) throws IOException {
        if ("file".equals(uri.getScheme())) {
            try {
                return Files.readString(Path.of(uri));
            } catch (NoSuchFileException e) {
                throw new FileNotFoundException(e.getMessage());
            }
        }

        acquirePermit(cancellationToken);
        try {
            return send(uri, HttpResponse.BodyHandlers.ofString(), cancellationToken).body();
        } finally {
            admission.release();
        }
    }

    private void transfer(URI url, Path partialFile, DownloadProgressListener progressListener, CancellationToken cancellationToken) throws IOException {
        if ("file".equals(url.getScheme())) {
            // File system download (e.g. from a local mirror)
            try {
                Files.copy(Path.of(url), partialFile, StandardCopyOption.REPLACE_EXISTING);
            } catch (NoSuchFileException e) {
                // Translate the NIO exception since we handle 404 errors by throwing FileNotFoundException
                // and callers of this method should get the same exception for 404 regardless of protocol.
                throw new FileNotFoundException(e.getMessage());
            }
            progressListener.onProgress(1.0);
            return;
        }

        var response = send(url, HttpResponse.BodyHandlers.ofInputStream(), cancellationToken);
        var contentLength = response.headers().firstValueAsLong("Content-Length").orElse(-1);

        try (InputStream in = response.body();
             var out = Files.newOutputStream(partialFile)) {
            var buffer = new byte[BUFFER_SIZE];
            long totalRead = 0;
            int read;
            while ((read = in.read(buffer)) != -1) {
                cancellationToken.throwIfCancellationRequested();
                out.write(buffer, 0, read);
                totalRead += read;
                if (contentLength > 0) {
                    progressListener.onProgress(Math.min(1.0, (double) totalRead / contentLength));
                }
            }
        }

        if (contentLength <= 0) {
            progressListener.onProgress(1.0);
        }
    }

    private <T> HttpResponse<T> send(URI url, HttpResponse.BodyHandler<T> bodyHandler, CancellationToken cancellationToken) throws IOException {
        var request = HttpRequest.newBuilder(url)
                .header("User-Agent", USER_AGENT)
                .GET()
                .build();

        IOException lastError = null;
        for (var attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            cancellationToken.throwIfCancellationRequested();

            HttpResponse<T> response;
            try {
                response = httpClient.send(request, bodyHandler);
            } catch (IOException e) {
                lastError = e;
                LOG.debug("Attempt " + attempt + " to download " + url + " failed: " + e);
                if (attempt < MAX_ATTEMPTS) {
                    waitForRetry(retryDelay, cancellationToken);
                }
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Download interrupted", e);
            }

            var statusCode = response.statusCode();
            if (statusCode == 200) {
                return response;
            }

            discardBody(response);
            if (statusCode == 404) {
                throw new FileNotFoundException(url.toString());
            }

            lastError = new IOException("Failed to download " + url + ": HTTP Status Code " + statusCode);
            if (!canRetryStatusCode(statusCode)) {
                break;
            }
            if (attempt < MAX_ATTEMPTS) {
                waitForRetry(getRetryAfter(response), cancellationToken);
            }
        }

        throw lastError;
    }

    private static void verify(DownloadSpec spec, Path partialFile, @Nullable String checksumAlgorithm) throws IOException {
        if (spec.size() != -1) {
            var fileSize = Files.size(partialFile);
            if (fileSize != spec.size()) {
                throw new IntegrityException("Downloaded file has unexpected size. (actual: " + fileSize + ", expected: " + spec.size() + ")");
            }
        }

        var checksum = spec.checksum();
        if (checksum != null && checksumAlgorithm != null) {
            var fileChecksum = HashingUtil.hashFile(partialFile, checksumAlgorithm);
            if (!checksum.equalsIgnoreCase(fileChecksum)) {
                throw new IntegrityException("Downloaded file has unexpected checksum. (actual: " + fileChecksum + ", expected: " + checksum + ")");
            }
        }
    }

    private void acquirePermit(CancellationToken cancellationToken) throws IOException {
        cancellationToken.throwIfCancellationRequested();
        try {
            while (!admission.tryAcquire(250, TimeUnit.MILLISECONDS)) {
                cancellationToken.throwIfCancellationRequested();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while waiting for a download slot", e);
        }
    }

    private Duration getRetryAfter(HttpResponse<?> response) {
        // We only support the version of this that specifies the delay in seconds
        var header = response.headers().firstValue("Retry-After");
        if (header.isPresent()) {
            try {
                var seconds = Long.parseLong(header.get().trim());
                // Clamp some unreasonable delays to 5 minutes
                return Duration.ofSeconds(Math.max(0, Math.min(seconds, MAX_RETRY_AFTER_SECONDS)));
            } catch (NumberFormatException e) {
                LOG.debug("Ignoring unsupported Retry-After header: " + header.get());
            }
        }
        return retryDelay;
    }

    private static void waitForRetry(Duration delay, CancellationToken cancellationToken) throws IOException {
        var waitUntil = Instant.now().plus(delay);

        while (Instant.now().isBefore(waitUntil)) {
            cancellationToken.throwIfCancellationRequested();
            try {
                Thread.sleep(Math.min(250L, Math.max(1L, Duration.between(Instant.now(), waitUntil).toMillis())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while waiting for retry.", e);
            }
        }
    }

    private static void discardBody(HttpResponse<?> response) throws IOException {
        if (response.body() instanceof InputStream in) {
            in.close();
        }
    }

    private static boolean canRetryStatusCode(int statusCode) {
        return statusCode == 408 // Request timeout
               || statusCode == 425 // Too early
               || statusCode == 429 // Rate-limit exceeded
               || statusCode == 502
               || statusCode == 503
               || statusCode == 504;
    }
}
