package net.lavalauncher.launcher.launch;

import net.lavalauncher.launcher.javaruntime.JavaRuntimeManager;
import net.lavalauncher.launcher.store.InstallRecord;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.Logger;
import net.lavalauncher.launcher.utils.NamedThreadFactory;
import net.lavalauncher.launcher.utils.OsUtil;
import net.lavalauncher.launcher.versions.VersionManager;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Starts installed instances as child processes and watches their output.
 * <p>
 * Launching never fails exceptionally. Everything that went wrong, including lines the game wrote to
 * stderr, is collected and returned once the game has exited. An empty list means the game ended normally.
 */
public class LaunchManager implements AutoCloseable {
    private static final Logger LOG = Logger.create();

    private final Path instancesFolder;
    private final VersionManager versionManager;
    private final JavaRuntimeManager javaRuntimeManager;
    private final LauncherIdentity identity;
    private final LaunchedInstances launchedInstances;
    private final LaunchSettings settings;
    private final ExecutorService executor = Executors.newCachedThreadPool(new NamedThreadFactory("game"));

    public LaunchManager(Path instancesFolder,
                         VersionManager versionManager,
                         JavaRuntimeManager javaRuntimeManager,
                         LauncherIdentity identity,
                         LaunchedInstances launchedInstances,
                         LaunchSettings settings) {
        this.instancesFolder = instancesFolder;
        this.versionManager = versionManager;
        this.javaRuntimeManager = javaRuntimeManager;
        this.identity = identity;
        this.launchedInstances = launchedInstances;
        this.settings = settings;
    }

    public LaunchedInstances getLaunchedInstances() {
        return launchedInstances;
    }

    @Override
    public void close() throws InterruptedException {
        executor.shutdownNow();
        if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
            LOG.warn("Failed to wait for game output readers to stop.");
        }
    }

    /**
     * Starts the game of an instance. Cancelling the token kills the game.
     *
     * @return completes with the collected diagnostics once the game has exited
     */
    public CompletableFuture<List<String>> launch(InstallRecord record, Account account, CancellationToken cancellationToken) {
        var instanceId = record.id();
        if (!launchedInstances.register(instanceId)) {
            return CompletableFuture.completedFuture(List.of("Instance '" + instanceId + "' is already running"));
        }

        var diagnostics = Collections.synchronizedList(new ArrayList<String>());
        var result = new CompletableFuture<List<String>>();
        try {
            executor.execute(() -> {
                try {
                    runGame(record, account, cancellationToken, diagnostics);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    diagnostics.add("Interrupted while waiting for the game to exit");
                } catch (Exception e) {
                    LOG.error("Failed to run instance '" + instanceId + "'", e);
                    diagnostics.add(describe(e));
                } finally {
                    finish(instanceId, diagnostics, result);
                }
            });
        } catch (RuntimeException e) {
            diagnostics.add(describe(e));
            finish(instanceId, diagnostics, result);
        }
        return result;
    }

    private void finish(String instanceId, List<String> diagnostics, CompletableFuture<List<String>> result) {
        launchedInstances.remove(instanceId);
        List<String> collected;
        synchronized (diagnostics) {
            collected = List.copyOf(diagnostics);
        }
        if (!collected.isEmpty()) {
            LOG.warn("Instance '" + instanceId + "' terminated abnormally:");
            collected.forEach(line -> LOG.warn("  " + line));
        }
        result.complete(collected);
    }

    private void runGame(InstallRecord record,
                         Account account,
                         CancellationToken cancellationToken,
                         List<String> diagnostics) throws IOException, InterruptedException {
        var instanceId = record.id();
        if (!record.isReady()) {
            diagnostics.add("Instance '" + instanceId + "' is not ready to launch (state: " + record.state() + ")");
            return;
        }
        var javaExecutable = javaRuntimeManager.getJavaExecutablePath(record.requiredJavaVersion());
        if (javaExecutable == null) {
            diagnostics.add("Java " + record.requiredJavaVersion() + " is missing");
            return;
        }
        cancellationToken.throwIfCancellationRequested();

        var gameDirectory = instancesFolder.resolve(record.folderName());
        Files.createDirectories(gameDirectory);

        var arguments = LaunchArguments.forInstance(
                record,
                account,
                identity,
                gameDirectory,
                versionManager.getAssetsFolder(),
                versionManager.getLibrariesFolder(),
                versionManager.getNativeLibrariesFolder(record.versionId())
        );
        var command = new ArrayList<String>();
        command.add(javaExecutable.toString());
        command.addAll(arguments.build(record, settings, OsUtil.isWindows() && !OsUtil.isWindows10()));

        LOG.println("▶ Launching '" + instanceId + "' (Minecraft " + record.versionId() + ")");
        LOG.debug(command.stream()
                .map(argument -> argument.equals(account.accessToken()) ? "<access token>" : argument)
                .collect(Collectors.joining(" ")));

        var process = new ProcessBuilder(command)
                .directory(gameDirectory.toFile())
                .start();
        int exitCode;
        try (var destroyOnCancel = cancellationToken.onCancel(process::destroy)) {
            var stdout = CompletableFuture.runAsync(() -> readLines(process.inputReader(), line -> onStdout(instanceId, line, diagnostics)), executor);
            var stderr = CompletableFuture.runAsync(() -> readLines(process.errorReader(), diagnostics::add), executor);

            exitCode = process.waitFor();
            try {
                CompletableFuture.allOf(stdout, stderr).join();
            } catch (CompletionException e) {
                diagnostics.add("Failed to read the output of the game: " + describe(e.getCause()));
            }
        }

        LOG.println("Instance '" + instanceId + "' exited with code " + exitCode);
        if (cancellationToken.isCancellationRequested()) {
            diagnostics.add("The game was stopped by the launcher");
        } else if (exitCode != 0 && diagnostics.isEmpty()) {
            diagnostics.add("Process exited with code " + exitCode);
        }
    }

    private void onStdout(String instanceId, String line, List<String> diagnostics) {
        LOG.debug("[" + instanceId + "] " + line);
        if (LogAnalyzer.isDiagnostic(line)) {
            diagnostics.add(line);
        }
        var current = launchedInstances.getState(instanceId);
        if (current != null) {
            var next = LogAnalyzer.nextState(current, line);
            if (next != current && launchedInstances.advance(instanceId, next)) {
                LOG.debug("Instance '" + instanceId + "' is now " + next);
            }
        }
    }

    private static void readLines(BufferedReader reader, Consumer<String> consumer) {
        try (reader) {
            String line;
            while ((line = reader.readLine()) != null) {
                consumer.accept(line);
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String describe(Throwable e) {
        return e.getMessage() != null ? e.getMessage() : e.toString();
    }
}
