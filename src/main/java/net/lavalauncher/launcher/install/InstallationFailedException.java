package net.lavalauncher.launcher.install;

import java.io.IOException;

/**
 * Thrown when installing an instance failed after its install record was created.
 * The record is left in the {@code INSTALLING} state.
 */
public class InstallationFailedException extends IOException {
    private final String instanceId;

    public InstallationFailedException(String instanceId, Throwable cause) {
        super("Failed to install instance '" + instanceId + "': " + cause.getMessage(), cause);
        this.instanceId = instanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }
}
