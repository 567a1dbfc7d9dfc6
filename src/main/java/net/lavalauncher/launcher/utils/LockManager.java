package net.lavalauncher.launcher.utils;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.AccessDeniedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Exclusive locks keyed by an arbitrary string, backed by lock files. They exclude other threads of this
 * process as well as other launcher processes sharing the same home directory.
 */
public class LockManager {
    private static final Logger LOG = Logger.create();

    private final Path lockDirectory;
    private boolean verbose;

    public LockManager(Path lockDirectory) throws IOException {
        Files.createDirectories(lockDirectory);
        this.lockDirectory = lockDirectory;
    }

    private Path getLockFile(String key) {
        return lockDirectory.resolve("_" + HashingUtil.sha1(key) + ".lock");
    }

    /**
     * Blocks until the lock for {@code key} is acquired.
     */
    public Lock lock(String key) {
        var lockFile = getLockFile(key);

        // Opening the same file from two processes does not block, only the lock on the channel does
        FileChannel channel = null;
        int attempt = 0;
        while (channel == null) {
            try {
                attempt++;
                channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            } catch (AccessDeniedException e) {
                // Windows denies access while another process deletes or creates the file
                if (attempt > 5) {
                    throw new UncheckedIOException("Failed to create lock-file " + lockFile + ": " + e.getMessage(), e);
                }
                sleep(key, null);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to create lock-file " + lockFile + ": " + e.getMessage(), e);
            }
        }

        Logger.IndeterminateSpinner spinner = null;
        FileLock fileLock = null;
        while (fileLock == null) {
            try {
                fileLock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                // Another thread of this process holds the lock
                fileLock = null;
            } catch (ClosedByInterruptException e) {
                // The channel has been closed by the interrupt
                if (spinner != null) {
                    spinner.end();
                }
                throw new IllegalStateException("Interrupted while waiting for lock on " + key, e);
            } catch (IOException e) {
                closeQuietly(channel, e);
                throw new UncheckedIOException("Failed to lock " + lockFile + ": " + e.getMessage(), e);
            }

            if (fileLock == null) {
                if (spinner == null) {
                    spinner = LOG.spinner("Waiting for lock on " + key);
                } else {
                    spinner.tick();
                }
                try {
                    sleep(key, spinner);
                } catch (IllegalStateException e) {
                    closeQuietly(channel, e);
                    throw e;
                }
            }
        }
        if (spinner != null) {
            spinner.end();
        }

        if (verbose) {
            LOG.println(AnsiColor.MUTED.paint(" Acquired lock for " + key));
        }
        return new Lock(key, fileLock);
    }

    private static void sleep(String key, @Nullable Logger.IndeterminateSpinner spinner) {
        try {
            Thread.sleep(250L);
        } catch (InterruptedException e) {
            if (spinner != null) {
                spinner.end();
            }
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for lock on " + key, e);
        }
    }

    private static void closeQuietly(FileChannel channel, Exception cause) {
        try {
            channel.close();
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    public static class Lock implements AutoCloseable {
        private final String key;
        private final FileLock fileLock;

        Lock(String key, FileLock fileLock) {
            this.key = key;
            this.fileLock = fileLock;
        }

        @Override
        public void close() {
            try {
                fileLock.release();
            } catch (IOException e) {
                LOG.warn("Failed to release lock on " + key + ": " + e.getMessage());
            }
            try {
                fileLock.channel().close();
            } catch (IOException e) {
                LOG.warn("Failed to close lock file for " + key + ": " + e.getMessage());
            }
        }
    }

    public boolean isVerbose() {
        return verbose;
    }

    public void setVerbose(boolean verbose) {
        this.verbose = verbose;
    }
}
