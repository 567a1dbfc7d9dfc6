package net.lavalauncher.launcher.versions;

import net.lavalauncher.launcher.downloads.DownloadProgressListener;

/**
 * Progress of the three download streams of {@link VersionManager#downloadVersionFiles}.
 */
public record VersionDownloadListener(DownloadProgressListener clientJar,
                                      DownloadProgressListener assets,
                                      DownloadProgressListener libraries) {
    public static final VersionDownloadListener NONE = new VersionDownloadListener(
            DownloadProgressListener.NONE, DownloadProgressListener.NONE, DownloadProgressListener.NONE);
}
