package net.lavalauncher.launcher.downloads;

import java.io.IOException;

/**
 * Downloaded content did not match its expected size or checksum, even after fetching it a second time.
 */
public class IntegrityException extends IOException {
    public IntegrityException(String message) {
        super(message);
    }
}
