package net.lavalauncher.launcher.install;

import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.NamedThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Merges progress reports from concurrent download threads into {@link InstallProgress} snapshots.
 * <p>
 * Reporting threads only enqueue small update messages. A single consumer thread owns the current snapshot,
 * applies each message and hands every resulting snapshot to the observer. Gauges only ever grow, so
 * messages arriving out of order do no harm.
 */
public class InstallProgressReporter implements AutoCloseable {
    private static final Logger LOG = Logger.create();

    private enum Kind {
        START,
        MINECRAFT,
        ASSETS,
        LIBRARIES,
        JAVA,
        FINISHED
    }

    private record Update(Kind kind, int value) {
    }

    private final String instanceId;
    private final Consumer<InstallProgress> observer;
    private final LinkedBlockingQueue<Update> queue = new LinkedBlockingQueue<>();
    private final ExecutorService consumer;
    private final Object publishLock = new Object();
    private volatile InstallProgress current;
    private volatile boolean closed;

    public InstallProgressReporter(String instanceId, Consumer<InstallProgress> observer) {
        this.instanceId = instanceId;
        this.observer = observer;
        this.current = InstallProgress.initial(instanceId);
        this.consumer = Executors.newSingleThreadExecutor(new NamedThreadFactory("install-progress"));
        this.consumer.execute(this::consume);
    }

    public InstallProgress getCurrent() {
        return current;
    }

    public void reportStart() {
        enqueue(Kind.START, 0);
    }

    public void reportFinished() {
        enqueue(Kind.FINISHED, 100);
    }

    public void reportMinecraftProgress(int progress) {
        enqueue(Kind.MINECRAFT, progress);
    }

    public void reportAssetsProgress(int progress) {
        enqueue(Kind.ASSETS, progress);
    }

    public void reportLibrariesProgress(int progress) {
        enqueue(Kind.LIBRARIES, progress);
    }

    public void reportJavaProgress(int progress) {
        enqueue(Kind.JAVA, progress);
    }

    private void enqueue(Kind kind, int value) {
        if (closed) {
            return;
        }
        queue.add(new Update(kind, Math.max(0, Math.min(100, value))));
    }

    private void consume() {
        try {
            while (!closed) {
                var update = queue.take();
                if (closed) {
                    break;
                }
                current = apply(current, update);
                publish(current);
            }
        } catch (InterruptedException e) {
            // Interrupted by close()
            Thread.currentThread().interrupt();
        }
    }

    private InstallProgress apply(InstallProgress progress, Update update) {
        return switch (update.kind()) {
            case START -> InstallProgress.started(instanceId);
            case FINISHED -> InstallProgress.finished(instanceId);
            case MINECRAFT -> progress.withMinecraftProgress(update.value());
            case ASSETS -> progress.withAssetsProgress(update.value());
            case LIBRARIES -> progress.withLibrariesProgress(update.value());
            case JAVA -> progress.withJavaProgress(update.value());
        };
    }

    private void publish(InstallProgress progress) {
        // close() may have started while the update was applied
        synchronized (publishLock) {
            if (closed) {
                return;
            }
            try {
                observer.accept(progress);
            } catch (RuntimeException e) {
                LOG.error("Progress observer for " + instanceId + " failed", e);
            }
        }
    }

    /**
     * Stops the consumer. Updates that are still queued may be dropped. Waits for a snapshot that is being
     * handed to the observer. No snapshot is published once this returns.
     */
    @Override
    public void close() {
        synchronized (publishLock) {
            closed = true;
        }
        consumer.shutdownNow();
        try {
            if (!consumer.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Progress reporter for " + instanceId + " did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
