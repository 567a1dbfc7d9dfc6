package net.lavalauncher.launcher.javaruntime;

import com.google.gson.annotations.SerializedName;
import net.lavalauncher.launcher.downloads.DownloadSpec;
import org.jetbrains.annotations.Nullable;

import java.net.URI;

/**
 * One element of the response of the Adoptium {@code assets/latest} endpoint. Only the fields we use are mapped.
 */
record AdoptiumRelease(@Nullable Binary binary, @SerializedName("release_name") @Nullable String releaseName) {
    record Binary(@SerializedName("image_type") String imageType, @SerializedName("package") @Nullable ReleasePackage archive) {
    }

    /**
     * The archive containing the runtime. The checksum is a SHA-256 hex string.
     */
    record ReleasePackage(String name, @SerializedName("link") URI uri, @Nullable String checksum, long size) implements DownloadSpec {
        @Override
        public long size() {
            return size > 0 ? size : -1;
        }
    }
}
