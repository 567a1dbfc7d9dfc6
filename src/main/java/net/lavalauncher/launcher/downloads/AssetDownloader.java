package net.lavalauncher.launcher.downloads;

import net.lavalauncher.launcher.manifests.AssetIndex;
import net.lavalauncher.launcher.manifests.AssetIndexReference;
import net.lavalauncher.launcher.manifests.AssetObject;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.Logger;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HexFormat;
import java.util.LinkedHashMap;

/**
 * Downloads the client-side assets necessary to run Minecraft.
 * Since Minecraft versions reuse various assets, Mojang has organized the assets into a sort of repository,
 * where an asset index maps a relative path to an asset unique identified by its content hash. The same
 * asset can be stored only once on disk and reused many times across Minecraft versions.
 * The assets stored this way are called "objects", while the JSON files describing the mapping of
 * paths to objects are called "asset index".
 * <p>
 * On disk, an asset root is a directory that contains a subfolder containing asset index files ("indexes"),
 * and a subfolder containing the actual objects ("objects").
 * <p>
 * The objects subfolder is further subdivided into 256 subfolders, each representing the first two characters
 * of a file content hash. Each of these subfolders will contain the actual objects whose hash starts with the
 * same characters as the folder name.
 * Example: {@code objects/af/af96f55a90eaf11b327f1b5f8834a051027dc506}, which is one of the Minecraft icon files.
 */
public class AssetDownloader {
    private static final Logger LOG = Logger.create();

    public static final URI DEFAULT_ASSET_REPOSITORY = URI.create("https://resources.download.minecraft.net/");

    private static final String INDEX_FOLDER = "indexes";

    private static final String OBJECT_FOLDER = "objects";

    private final DownloadManager downloadManager;
    private final Path assetRoot;
    private final int concurrentDownloads;

    public AssetDownloader(DownloadManager downloadManager, Path assetRoot, int concurrentDownloads) {
        this.downloadManager = downloadManager;
        this.assetRoot = assetRoot;
        this.concurrentDownloads = concurrentDownloads;
    }

    public AssetDownloadResult downloadAssets(AssetIndexReference assetIndexReference,
                                              URI assetRepository,
                                              DownloadProgressListener progressListener,
                                              CancellationToken cancellationToken) throws IOException, DownloadsFailedException {
        LOG.println("Downloading asset index " + assetIndexReference.id());
        prepareAssetRoot(assetRoot);

        var assetIndex = acquireAssetIndex(assetIndexReference, cancellationToken);

        // The same object can be referenced multiple times under different names
        var uniqueObjects = new LinkedHashMap<String, AssetObject>();
        for (var object : assetIndex.objects().values()) {
            uniqueObjects.putIfAbsent(object.hash(), object);
        }

        var objectsFolder = assetRoot.resolve(OBJECT_FOLDER);
        var objectsToDownload = uniqueObjects.values().stream()
                .filter(obj -> {
                    var f = objectsFolder.resolve(obj.getRelativePath()).toFile();
                    return f.length() != obj.size() || obj.size() == 0 && !f.exists();
                })
                .toList();

        var alreadyPresent = uniqueObjects.size() - objectsToDownload.size();
        if (alreadyPresent > 0) {
            LOG.debug(alreadyPresent + " of " + uniqueObjects.size() + " asset objects are already present");
        }
        var progress = uniqueObjects.isEmpty()
                ? progressListener
                : progressListener.scaled((double) alreadyPresent / uniqueObjects.size(), 1.0);

        try (var downloader = new ParallelDownloader(downloadManager, concurrentDownloads, objectsFolder,
                objectsToDownload.size(), progress, cancellationToken)) {
            for (var object : objectsToDownload) {
                downloader.submitDownload(new AssetDownloadSpec(assetRepository, object), object.getRelativePath());
            }
        }

        return new AssetDownloadResult(assetRoot, assetIndexReference.id(), uniqueObjects.size());
    }

    private AssetIndex acquireAssetIndex(AssetIndexReference assetIndexReference, CancellationToken cancellationToken) throws IOException {
        var assetIndexPath = assetRoot.resolve(INDEX_FOLDER).resolve(assetIndexReference.id() + ".json");
        downloadManager.download(assetIndexReference, assetIndexPath, DownloadProgressListener.NONE, cancellationToken);
        return AssetIndex.from(assetIndexPath);
    }

    private static void prepareAssetRoot(Path assetRoot) throws IOException {
        var indexFolder = assetRoot.resolve(INDEX_FOLDER);
        Files.createDirectories(indexFolder);
        var objectsFolder = assetRoot.resolve(OBJECT_FOLDER);
        Files.createDirectories(objectsFolder);

        // Pre-create all folders
        for (var i = 0; i < 256; i++) {
            var objectSubFolder = objectsFolder.resolve(HexFormat.of().toHexDigits(i, 2));
            Files.createDirectories(objectSubFolder);
        }
    }

    private record AssetDownloadSpec(URI assetsBaseUrl, AssetObject object) implements DownloadSpec {
        @Override
        public URI uri() {
            var base = assetsBaseUrl.toString();
            return URI.create(base.endsWith("/") ? base + object.getRelativePath() : base + "/" + object.getRelativePath());
        }

        @Override
        public long size() {
            return object.size();
        }

        @Override
        public String checksum() {
            return object.hash();
        }
    }
}
