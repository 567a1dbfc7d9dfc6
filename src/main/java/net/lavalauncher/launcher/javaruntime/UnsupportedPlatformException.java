package net.lavalauncher.launcher.javaruntime;

import java.io.IOException;

/**
 * No Java runtime is published for the requested combination of major version, operating system and architecture.
 */
public class UnsupportedPlatformException extends IOException {
    public UnsupportedPlatformException(String message) {
        super(message);
    }

    public UnsupportedPlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
