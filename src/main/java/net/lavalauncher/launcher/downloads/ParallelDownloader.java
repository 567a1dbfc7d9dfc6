package net.lavalauncher.launcher.downloads;

import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.NamedThreadFactory;
import net.lavalauncher.launcher.utils.OperationCancelledException;
import net.lavalauncher.launcher.utils.StringUtil;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * This class is capable of download a large number of files concurrently, while observing a maximum
 * concurrent download limit.
 * <p>
 * Progress is reported as the fraction of submitted tasks that have finished, based on the total given
 * to the constructor.
 */
public class ParallelDownloader implements AutoCloseable {
    private static final Logger LOG = Logger.create();

    /**
     * A unit of work, usually one download followed by some post-processing.
     */
    @FunctionalInterface
    public interface DownloadTask {
        void run() throws IOException;
    }

    private final DownloadManager downloadManager;
    @Nullable
    private final ExecutorService executor;
    private final AtomicInteger downloadsDone = new AtomicInteger();
    private final AtomicInteger tasksFinished = new AtomicInteger();
    private final AtomicLong bytesDownloaded = new AtomicLong();
    private final List<Exception> errors = new ArrayList<>();
    private final Path destination;
    private final int estimatedTotal;
    private final DownloadProgressListener progressListener;
    private final CancellationToken cancellationToken;

    public ParallelDownloader(DownloadManager downloadManager,
                              int concurrentDownloads,
                              Path destination,
                              int estimatedTotal,
                              DownloadProgressListener progressListener,
                              CancellationToken cancellationToken) {
        this.downloadManager = downloadManager;
        this.destination = destination;
        this.estimatedTotal = estimatedTotal;
        this.progressListener = progressListener;
        this.cancellationToken = cancellationToken;
        if (concurrentDownloads < 1) {
            throw new IllegalStateException("Cannot set concurrent downloads to less than 1: " + concurrentDownloads);
        } else if (concurrentDownloads == 1) {
            executor = null;
        } else {
            executor = Executors.newFixedThreadPool(concurrentDownloads, new NamedThreadFactory("parallel-download"));
        }

        if (estimatedTotal == 0) {
            progressListener.onProgress(1.0);
        }
    }

    /**
     * Downloads {@code spec} to a path relative to the destination of this downloader.
     */
    public void submitDownload(DownloadSpec spec, String relativeDestination) throws DownloadsFailedException {
        submit(() -> {
            if (downloadManager.download(spec, destination.resolve(relativeDestination), DownloadProgressListener.NONE, cancellationToken)) {
                downloadsDone.incrementAndGet();
                if (spec.size() > 0) {
                    bytesDownloaded.addAndGet(spec.size());
                }
            }
        });
    }

    public void submit(DownloadTask task) throws DownloadsFailedException {
        if (executor != null) {
            executor.execute(() -> {
                try {
                    run(task);
                } catch (Exception e) {
                    synchronized (errors) {
                        errors.add(e);
                    }
                }
            });
        } else {
            // Synchronously download if concurrentDownloads == 1
            try {
                run(task);
            } catch (IOException e) {
                throw new DownloadsFailedException(List.of(e));
            }
        }
    }

    private void run(DownloadTask task) throws IOException {
        try {
            // Tasks still queued when a download is cancelled are skipped
            cancellationToken.throwIfCancellationRequested();
            task.run();
        } finally {
            var finished = tasksFinished.incrementAndGet();
            if (estimatedTotal > 0) {
                progressListener.onProgress(Math.min(1.0, (double) finished / estimatedTotal));
            }
            if (finished % 500 == 0) {
                LOG.debug(finished + "/" + estimatedTotal + " downloads");
            }
        }
    }

    /**
     * Waits for all submitted tasks.
     *
     * @throws OperationCancelledException if the cancellation token was cancelled in the meantime
     * @throws DownloadsFailedException    if any task failed
     */
    @Override
    public void close() throws DownloadsFailedException {
        // Wait for the executor to finish
        if (executor != null) {
            executor.shutdown();
            try {
                while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                    Thread.yield();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
                throw new DownloadsFailedException(List.of(e));
            }
        }

        if (downloadsDone.get() > 0) {
            LOG.println("Downloaded " + downloadsDone.get() + " files with a total size of " + StringUtil.formatBytes(bytesDownloaded.get()));
        }

        cancellationToken.throwIfCancellationRequested();

        if (!errors.isEmpty()) {
            throw new DownloadsFailedException(errors);
        }
    }
}
