package net.lavalauncher.launcher.store;

/**
 * Lifecycle of an installation.
 */
public enum InstallState {
    /**
     * Stored state could not be read. Never written.
     */
    UNKNOWN,
    INSTALLING,
    READY
}
