package net.lavalauncher.launcher.install;

import java.io.IOException;

public class InstanceAlreadyExistsException extends IOException {
    private final String instanceId;

    public InstanceAlreadyExistsException(String instanceId) {
        this(instanceId, "An instance named '" + instanceId + "' already exists");
    }

    public InstanceAlreadyExistsException(String instanceId, String message) {
        super(message);
        this.instanceId = instanceId;
    }

    public String getInstanceId() {
        return instanceId;
    }
}
