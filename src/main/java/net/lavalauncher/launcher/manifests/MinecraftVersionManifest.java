package net.lavalauncher.launcher.manifests;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * The per-version detail document, e.g. {@code versions/1.20.1/1.20.1.json}.
 *
 * @param minecraftArguments Space-separated game arguments, only used by versions that predate {@link #arguments()}.
 */
public record MinecraftVersionManifest(String id,
                                       String type,
                                       String mainClass,
                                       @Nullable Arguments arguments,
                                       @Nullable String minecraftArguments,
                                       AssetIndexReference assetIndex,
                                       @Nullable JavaVersionReference javaVersion,
                                       Map<String, MinecraftDownload> downloads,
                                       List<MinecraftLibrary> libraries,
                                       @Nullable String releaseTime) {
    /**
     * Versions that don't declare a Java version ran on Java 8.
     */
    public static final int DEFAULT_JAVA_MAJOR_VERSION = 8;

    private static final List<String> LEGACY_JVM_ARGUMENTS = List.of(
            "-Djava.library.path=${natives_directory}",
            "-cp",
            "${classpath}"
    );

    public MinecraftVersionManifest {
        downloads = Objects.requireNonNullElseGet(downloads, Map::of);
        libraries = Objects.requireNonNullElseGet(libraries, List::of);
    }

    public static MinecraftVersionManifest from(Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path)) {
            return from(reader, path.toString());
        }
    }

    public static MinecraftVersionManifest from(String json) throws IOException {
        return from(new StringReader(json), "<string>");
    }

    private static MinecraftVersionManifest from(Reader reader, String source) throws IOException {
        MinecraftVersionManifest manifest;
        try {
            manifest = new Gson().fromJson(reader, MinecraftVersionManifest.class);
        } catch (JsonParseException e) {
            throw new IOException("Failed to parse version manifest " + source + ": " + e.getMessage(), e);
        }
        if (manifest == null) {
            throw new IOException("Version manifest " + source + " is empty");
        } else if (manifest.id() == null || manifest.mainClass() == null) {
            throw new IOException("Version manifest " + source + " lacks an id or main class");
        }
        return manifest;
    }

    public int getJavaMajorVersion() {
        return javaVersion != null && javaVersion.majorVersion() > 0 ? javaVersion.majorVersion() : DEFAULT_JAVA_MAJOR_VERSION;
    }

    @Nullable
    public MinecraftDownload getClientDownload() {
        return downloads.get("client");
    }

    public List<String> getGameArguments(RuleContext context) {
        if (arguments != null) {
            return Argument.flatten(arguments.game(), context);
        } else if (minecraftArguments != null && !minecraftArguments.isBlank()) {
            return new ArrayList<>(Arrays.asList(minecraftArguments.trim().split("\\s+")));
        }
        return new ArrayList<>();
    }

    public List<String> getJvmArguments(RuleContext context) {
        if (arguments != null) {
            return Argument.flatten(arguments.jvm(), context);
        }
        return new ArrayList<>(LEGACY_JVM_ARGUMENTS);
    }

    public record Arguments(List<Argument> game, List<Argument> jvm) {
        public Arguments {
            game = Objects.requireNonNullElseGet(game, List::of);
            jvm = Objects.requireNonNullElseGet(jvm, List::of);
        }
    }
}
