package net.lavalauncher.launcher.launch;

import net.lavalauncher.launcher.utils.FileUtil;
import net.lavalauncher.launcher.utils.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * How the launcher identifies itself to the game.
 *
 * @param clientId random id of this launcher installation, stable across runs
 */
public record LauncherIdentity(String name, String version, String clientId) {
    private static final Logger LOG = Logger.create();

    public static final String LAUNCHER_NAME = "LavaLauncher";

    static final String CLIENT_ID_FILENAME = "client_id.txt";

    /**
     * Reads the client id from the home directory, creating one on first use.
     */
    public static LauncherIdentity load(Path homeDir) throws IOException {
        return new LauncherIdentity(LAUNCHER_NAME, getLauncherVersion(), loadClientId(homeDir.resolve(CLIENT_ID_FILENAME)));
    }

    public static String getLauncherVersion() {
        return Objects.requireNonNullElse(LauncherIdentity.class.getPackage().getImplementationVersion(), "dev");
    }

    private static String loadClientId(Path file) throws IOException {
        if (Files.isRegularFile(file)) {
            var content = Files.readString(file).trim();
            if (isUuid(content)) {
                return content;
            }
            LOG.warn("Replacing invalid client id in " + file);
        }

        var clientId = UUID.randomUUID().toString();
        Files.createDirectories(file.getParent());
        FileUtil.writeStringAtomically(file, clientId);
        return clientId;
    }

    private static boolean isUuid(String text) {
        try {
            return UUID.fromString(text).toString().equalsIgnoreCase(text);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }
}
