package net.lavalauncher.launcher.utils;

import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal passed into long-running operations.
 * <p>
 * A token is cancelled at most once; the first {@link Reason} wins. Tokens created through
 * {@link #linked(CancellationToken, Duration)} combine a manually cancelled parent with a timeout
 * and remember which of the two fired, so callers can report a different message for each.
 * <p>
 * A linked token stays registered with its parent until it is cancelled or {@linkplain #close() closed}.
 */
public final class CancellationToken implements AutoCloseable {
    /**
     * A token that is never cancelled.
     */
    public static final CancellationToken NONE = new CancellationToken();

    private static final ScheduledThreadPoolExecutor TIMER = createTimer();

    public enum Reason {
        MANUAL,
        TIMEOUT
    }

    /**
     * Handle for a callback added with {@link #onCancel(Runnable)}. Closing it removes the callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {
        Registration NONE = () -> {
        };

        @Override
        void close();
    }

    private final AtomicReference<Reason> reason = new AtomicReference<>();
    // Both lists are guarded by callbacks
    private final List<Runnable> callbacks = new ArrayList<>();
    private final List<Runnable> detachActions = new ArrayList<>();
    private boolean detached;

    private CancellationToken() {
    }

    public static CancellationToken create() {
        return new CancellationToken();
    }

    /**
     * Creates a token that is cancelled with {@link Reason#TIMEOUT} once {@code timeout} elapses, or with the
     * parent's reason when the parent is cancelled first.
     */
    public static CancellationToken linked(CancellationToken parent, @Nullable Duration timeout) {
        var token = new CancellationToken();
        token.onDetach(parent.onCancel(() -> token.cancel(parent.getReason()))::close);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative() && !token.isCancellationRequested()) {
            var timer = TIMER.schedule(() -> token.cancel(Reason.TIMEOUT), timeout.toMillis(), TimeUnit.MILLISECONDS);
            token.onDetach(() -> timer.cancel(false));
        }
        return token;
    }

    public void cancel() {
        cancel(Reason.MANUAL);
    }

    public void cancel(@Nullable Reason cancelReason) {
        if (this == NONE) {
            throw new IllegalStateException("The NONE token cannot be cancelled");
        }
        if (reason.compareAndSet(null, cancelReason != null ? cancelReason : Reason.MANUAL)) {
            List<Runnable> toRun;
            synchronized (callbacks) {
                toRun = List.copyOf(callbacks);
                callbacks.clear();
            }
            for (var callback : toRun) {
                callback.run();
            }
            detach();
        }
    }

    /**
     * Unlinks this token from its parent and stops its timeout. The token can still be cancelled directly.
     * Callbacks registered on this token are kept.
     */
    @Override
    public void close() {
        detach();
    }

    public boolean isCancellationRequested() {
        return reason.get() != null;
    }

    @Nullable
    public Reason getReason() {
        return reason.get();
    }

    /**
     * Runs the callback when the token is cancelled, or immediately if it already is.
     *
     * @return a handle that removes the callback again, once the guarded operation is over
     */
    public Registration onCancel(Runnable callback) {
        if (this == NONE) {
            return Registration.NONE;
        }
        synchronized (callbacks) {
            if (!isCancellationRequested()) {
                callbacks.add(callback);
                return () -> {
                    synchronized (callbacks) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return Registration.NONE;
    }

    public void throwIfCancellationRequested() {
        var currentReason = reason.get();
        if (currentReason != null) {
            throw new OperationCancelledException(currentReason);
        }
    }

    /**
     * Number of callbacks still waiting for this token to be cancelled.
     */
    public int getCallbackCount() {
        synchronized (callbacks) {
            return callbacks.size();
        }
    }

    private void onDetach(Runnable action) {
        synchronized (callbacks) {
            if (!detached) {
                detachActions.add(action);
                return;
            }
        }
        action.run();
    }

    private void detach() {
        List<Runnable> toRun;
        synchronized (callbacks) {
            if (detached) {
                return;
            }
            detached = true;
            toRun = List.copyOf(detachActions);
            detachActions.clear();
        }
        for (var action : toRun) {
            action.run();
        }
    }

    private static ScheduledThreadPoolExecutor createTimer() {
        var timer = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("cancellation-timer"));
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }
}
