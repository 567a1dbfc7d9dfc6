package net.lavalauncher.launcher.manifests;

import com.google.gson.annotations.SerializedName;
import net.lavalauncher.launcher.downloads.DownloadSpec;

import java.net.URI;

public record AssetIndexReference(String id, @SerializedName("sha1") String checksum, long size, long totalSize,
                                  @SerializedName("url") URI uri) implements DownloadSpec {
}
