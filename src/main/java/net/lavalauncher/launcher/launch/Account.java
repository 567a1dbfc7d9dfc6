package net.lavalauncher.launcher.launch;

import org.jetbrains.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * The player a game is launched for, as handed to us by the authentication flow.
 *
 * @param xuid Xbox user id, absent for offline accounts
 */
public record Account(String username, String uuid, @Nullable String xuid, String accessToken) {
    public Account {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("The username must not be blank");
        }
    }

    /**
     * An account that was not authenticated. Its UUID is derived from the name, like the server does for
     * offline players.
     */
    public static Account offline(String username) {
        var uuid = UUID.nameUUIDFromBytes(("OfflinePlayer:" + username).getBytes(StandardCharsets.UTF_8));
        return new Account(username, uuid.toString().replace("-", ""), null, "0");
    }
}
