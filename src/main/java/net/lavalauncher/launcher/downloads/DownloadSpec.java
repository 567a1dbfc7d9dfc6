package net.lavalauncher.launcher.downloads;

import net.lavalauncher.launcher.utils.HashingUtil;
import org.jetbrains.annotations.Nullable;

import java.net.URI;

public interface DownloadSpec {
    /**
     * The URI to download.
     */
    URI uri();

    /**
     * Expected size or -1 if unknown.
     */
    default long size() {
        return -1;
    }

    /**
     * Expected checksum as a hex string, null if no check is to be performed.
     */
    @Nullable
    default String checksum() {
        return null;
    }

    /**
     * The digest algorithm is implied by the length of the {@link #checksum()}.
     *
     * @throws IllegalArgumentException if the checksum has an unsupported length
     */
    @Nullable
    default String checksumAlgorithm() {
        var checksum = checksum();
        return checksum != null ? HashingUtil.algorithmForChecksum(checksum) : null;
    }

    static DownloadSpec of(URI uri) {
        return new SimpleDownloadSpec(uri, null);
    }

    static DownloadSpec of(URI uri, @Nullable String checksum) {
        return new SimpleDownloadSpec(uri, checksum);
    }
}
