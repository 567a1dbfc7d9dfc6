package net.lavalauncher.launcher.manifests;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import net.lavalauncher.launcher.downloads.DownloadSpec;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

/**
 * The version catalog ({@code version_manifest_v2.json}).
 */
public record LauncherManifest(@Nullable Latest latest, List<Version> versions) {
    public LauncherManifest {
        versions = Objects.requireNonNullElseGet(versions, List::of);
    }

    public static LauncherManifest from(Path path) throws IOException {
        try (var reader = Files.newBufferedReader(path)) {
            var manifest = new Gson().fromJson(reader, LauncherManifest.class);
            if (manifest == null) {
                throw new IOException("Version catalog " + path + " is empty");
            }
            return manifest;
        } catch (JsonParseException e) {
            throw new IOException("Failed to parse version catalog " + path + ": " + e.getMessage(), e);
        }
    }

    public record Latest(String release, String snapshot) {
    }

    /**
     * A catalog entry. Downloading it yields the {@link MinecraftVersionManifest} of the version.
     */
    public record Version(String id,
                          String type,
                          @SerializedName("url") URI uri,
                          String time,
                          String releaseTime,
                          @SerializedName("sha1") @Nullable String checksum,
                          int complianceLevel) implements DownloadSpec {
        public boolean isRelease() {
            return "release".equals(type);
        }

        /**
         * @return the parsed release time, or {@link Instant#EPOCH} if it is missing or malformed
         */
        public Instant getReleaseTime() {
            if (releaseTime == null) {
                return Instant.EPOCH;
            }
            try {
                return OffsetDateTime.parse(releaseTime).toInstant();
            } catch (DateTimeParseException e) {
                return Instant.EPOCH;
            }
        }
    }
}
