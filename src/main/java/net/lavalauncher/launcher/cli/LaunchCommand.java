package net.lavalauncher.launcher.cli;

import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.install.InstallationManager;
import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.launch.Account;
import net.lavalauncher.launcher.launch.LaunchManager;
import net.lavalauncher.launcher.launch.LaunchSettings;
import net.lavalauncher.launcher.launch.LaunchedInstances;
import net.lavalauncher.launcher.launch.LauncherIdentity;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.versions.VersionManager;
import org.jetbrains.annotations.Nullable;
import picocli.CommandLine;

import java.util.Objects;

@CommandLine.Command(name = "launch", description = "Start the game of an installed instance")
public class LaunchCommand extends LauncherCommand {
    private static final Logger LOG = Logger.create();

    @CommandLine.Option(names = "--name", required = true, description = "Name of the instance")
    String name;

    @CommandLine.Option(names = "--username", required = true, description = "Player name")
    String username;

    @CommandLine.Option(names = "--uuid", description = "Player UUID. Without it, the game is started with an offline account.")
    @Nullable
    String uuid;

    @CommandLine.Option(names = "--access-token", description = "Access token from the authentication service")
    @Nullable
    String accessToken;

    @CommandLine.Option(names = "--xuid", description = "Xbox user id")
    @Nullable
    String xuid;

    @CommandLine.Option(names = "--max-memory", description = "Maximum heap size of the game")
    String maxMemory = LaunchSettings.DEFAULT.maxMemory();

    @CommandLine.Option(names = "--min-memory", description = "Initial heap size of the game")
    String minMemory = LaunchSettings.DEFAULT.minMemory();

    @Override
    protected int runLauncherCommand(DownloadManager downloadManager,
                                     VersionManager versionManager,
                                     JavaRuntimeManager javaRuntimeManager,
                                     InstallationManager installationManager) throws Exception {
        var record = installationManager.getInstance(name);
        if (record == null) {
            LOG.error("There is no instance named '" + name + "'");
            return 1;
        }

        var account = uuid == null
                ? Account.offline(username)
                : new Account(username, uuid, xuid, Objects.requireNonNullElse(accessToken, "0"));
        var identity = LauncherIdentity.load(commonOptions.getHomeDir());

        var launchedInstances = new LaunchedInstances();
        launchedInstances.addListener((instanceId, state) -> {
            if (state != null) {
                LOG.println("Instance '" + instanceId + "': " + state);
            }
        });

        try (var launchManager = new LaunchManager(
                commonOptions.getInstancesFolder(),
                versionManager,
                javaRuntimeManager,
                identity,
                launchedInstances,
                new LaunchSettings(maxMemory, minMemory))) {
            var diagnostics = launchManager.launch(record, account, CancellationToken.NONE).join();
            return diagnostics.isEmpty() ? 0 : 1;
        }
    }
}
