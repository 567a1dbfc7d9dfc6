package net.lavalauncher.launcher.launch;

import net.lavalauncher.launcher.store.InstallRecord;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds the command line of the game from the argument templates of an instance.
 * <p>
 * Templates contain placeholders such as {@code ${auth_player_name}}. Every placeholder must have a value,
 * a template referring to an unknown variable is rejected.
 */
public class LaunchArguments {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([^}]+)}");

    private final Map<String, String> variables = new HashMap<>();

    public LaunchArguments set(String name, String value) {
        variables.put(name, value);
        return this;
    }

    public Map<String, String> getVariables() {
        return Map.copyOf(variables);
    }

    /**
     * Fills in the variables the game expects for the given instance and player.
     */
    public static LaunchArguments forInstance(InstallRecord record,
                                              Account account,
                                              LauncherIdentity identity,
                                              Path gameDirectory,
                                              Path assetsFolder,
                                              Path librariesFolder,
                                              Path nativesFolder) {
        if (record.clientJarPath() == null) {
            throw new IllegalArgumentException("Instance '" + record.id() + "' has no client jar");
        }
        var classPath = buildClassPath(Path.of(record.clientJarPath()), librariesFolder, record.classPath());

        return new LaunchArguments()
                .set("version_name", record.versionId())
                .set("version_type", Objects.requireNonNullElse(record.type(), "release"))
                .set("game_directory", gameDirectory.toAbsolutePath().toString())
                .set("assets_root", assetsFolder.toAbsolutePath().toString())
                .set("game_assets", assetsFolder.toAbsolutePath().toString())
                .set("assets_index_name", Objects.requireNonNullElse(record.assetIndex(), record.versionId()))
                .set("auth_player_name", account.username())
                .set("auth_uuid", account.uuid())
                .set("auth_access_token", account.accessToken())
                .set("auth_session", account.accessToken())
                .set("auth_xuid", Objects.requireNonNullElse(account.xuid(), "0"))
                .set("user_type", "msa")
                .set("user_properties", "{}")
                .set("natives_directory", nativesFolder.toAbsolutePath().toString())
                .set("library_directory", librariesFolder.toAbsolutePath().toString())
                .set("classpath_separator", File.pathSeparator)
                .set("classpath", classPath)
                .set("launcher_name", identity.name())
                .set("launcher_version", identity.version())
                .set("clientid", identity.clientId());
    }

    /**
     * The client jar comes first, followed by the libraries in the order the version declares them.
     */
    public static String buildClassPath(Path clientJar, Path librariesFolder, List<String> libraries) {
        var entries = new ArrayList<String>(libraries.size() + 1);
        entries.add(clientJar.toAbsolutePath().toString());
        for (var library : libraries) {
            entries.add(librariesFolder.resolve(library).toAbsolutePath().toString());
        }
        return String.join(File.pathSeparator, entries);
    }

    /**
     * Arguments following the Java executable: heap sizes, JVM arguments, main class and game arguments.
     *
     * @param stripOsProperties drop {@code -Dos.*} overrides, which break older Windows versions
     * @throws IllegalArgumentException if a template refers to an unknown variable
     */
    public List<String> build(InstallRecord record, LaunchSettings settings, boolean stripOsProperties) {
        if (record.mainClass() == null) {
            throw new IllegalArgumentException("Instance '" + record.id() + "' has no main class");
        }

        var result = new ArrayList<String>();
        result.add("-Xmx" + settings.maxMemory());
        result.add("-Xms" + settings.minMemory());
        for (var argument : record.jvmArguments()) {
            if (stripOsProperties && argument.startsWith("-Dos")) {
                continue;
            }
            result.add(substitute(argument));
        }
        result.add(record.mainClass());
        for (var argument : record.gameArguments()) {
            result.add(substitute(argument));
        }
        return result;
    }

    public String substitute(String template) {
        var matcher = PLACEHOLDER.matcher(template);
        var result = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            var value = variables.get(name);
            if (value == null) {
                throw new IllegalArgumentException("Argument '" + template + "' refers to unknown variable " + name);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(result);
        return result.toString();
    }
}
