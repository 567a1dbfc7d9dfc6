package net.lavalauncher.launcher.downloads;

/**
 * Receives the completed fraction of a download or a batch of downloads, between 0.0 and 1.0.
 */
@FunctionalInterface
public interface DownloadProgressListener {
    DownloadProgressListener NONE = fraction -> {
    };

    void onProgress(double fraction);

    /**
     * Maps this listener onto a sub-range, e.g. the download part of a download-and-extract operation.
     */
    default DownloadProgressListener scaled(double from, double to) {
        return fraction -> onProgress(from + (to - from) * fraction);
    }
}
