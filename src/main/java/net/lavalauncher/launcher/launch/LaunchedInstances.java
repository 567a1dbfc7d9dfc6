package net.lavalauncher.launcher.launch;

import net.lavalauncher.launcher.utils.Logger;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Instances that are currently running, and their {@link RunState}.
 * States only ever move forward; listeners are told about every change.
 */
public class LaunchedInstances {
    private static final Logger LOG = Logger.create();

    @FunctionalInterface
    public interface Listener {
        /**
         * @param state the new state, or null if the instance stopped
         */
        void onChange(String instanceId, @Nullable RunState state);
    }

    private final ConcurrentHashMap<String, RunState> states = new ConcurrentHashMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /**
     * @return false if the instance is already running
     */
    public boolean register(String instanceId) {
        if (states.putIfAbsent(instanceId, RunState.LAUNCHING) != null) {
            return false;
        }
        notifyListeners(instanceId, RunState.LAUNCHING);
        return true;
    }

    /**
     * Moves the instance to {@code state} unless it already is in that state or a later one.
     *
     * @return whether the state changed
     */
    public boolean advance(String instanceId, RunState state) {
        while (true) {
            var current = states.get(instanceId);
            if (current == null || !state.isAfter(current)) {
                return false;
            }
            if (states.replace(instanceId, current, state)) {
                notifyListeners(instanceId, state);
                return true;
            }
        }
    }

    public void remove(String instanceId) {
        if (states.remove(instanceId) != null) {
            notifyListeners(instanceId, null);
        }
    }

    @Nullable
    public RunState getState(String instanceId) {
        return states.get(instanceId);
    }

    public boolean isRunning(String instanceId) {
        return states.containsKey(instanceId);
    }

    public Map<String, RunState> getAll() {
        return Map.copyOf(states);
    }

    private void notifyListeners(String instanceId, @Nullable RunState state) {
        for (var listener : listeners) {
            try {
                listener.onChange(instanceId, state);
            } catch (RuntimeException e) {
                LOG.error("Run state listener failed for " + instanceId, e);
            }
        }
    }
}
