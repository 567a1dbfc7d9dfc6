package net.lavalauncher.launcher.manifests;

import com.google.gson.annotations.SerializedName;
import net.lavalauncher.launcher.downloads.DownloadSpec;
import org.jetbrains.annotations.Nullable;

import java.net.URI;

public record MinecraftDownload(@SerializedName("sha1") String checksum, long size,
                                @SerializedName("url") URI uri, @Nullable String path) implements DownloadSpec {
}
