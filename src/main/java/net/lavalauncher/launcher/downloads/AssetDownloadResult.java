package net.lavalauncher.launcher.downloads;

import java.nio.file.Path;

/**
 * @param assetRoot    Directory containing the {@code indexes} and {@code objects} folders.
 * @param assetIndexId Name of the asset index, which the game receives as {@code --assetIndex}.
 * @param objectCount  Number of distinct objects referenced by the index.
 */
public record AssetDownloadResult(Path assetRoot, String assetIndexId, int objectCount) {
}
