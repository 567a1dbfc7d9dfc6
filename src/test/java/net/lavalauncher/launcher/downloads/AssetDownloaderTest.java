package net.lavalauncher.launcher.downloads;

import com.google.gson.Gson;
import net.lavalauncher.launcher.manifests.AssetIndex;
import net.lavalauncher.launcher.manifests.AssetIndexReference;
import net.lavalauncher.launcher.manifests.AssetObject;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.HashingUtil;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;

@MockitoSettings(strictness = Strictness.LENIENT)
class AssetDownloaderTest {
    private static final String ASSET_INDEX_ID = "1234";
    private static final URI REPOSITORY = URI.create("http://assets.fake/");

    @TempDir
    Path tempDir;
    @Mock
    DownloadManager downloadManager;

    Path assetRoot;
    AssetDownloader downloader;

    // Absolute URI -> Content
    Map<String, byte[]> downloadableContent = new HashMap<>();
    // Actual downloads
    List<String> downloadedUris = Collections.synchronizedList(new ArrayList<>());
    Map<String, AssetObject> indexObjects = new LinkedHashMap<>();

    @BeforeEach
    void setUp() throws IOException {
        assetRoot = tempDir.resolve("assets");
        downloader = new AssetDownloader(downloadManager, assetRoot, 1);

        doAnswer(invocation -> {
            DownloadSpec spec = invocation.getArgument(0);
            Path destination = invocation.getArgument(1);
            var uri = spec.uri().toString();
            var content = downloadableContent.get(uri);
            if (content == null) {
                throw new FileNotFoundException(uri);
            }
            downloadedUris.add(uri);
            Files.createDirectories(destination.getParent());
            Files.write(destination, content);
            return true;
        }).when(downloadManager).download(any(DownloadSpec.class), any(Path.class), any(), any());
    }

    @Test
    void testDownloadsIndexAndObjects() throws Exception {
        var first = addAsset("minecraft/sounds/a.ogg", "sound a");
        var second = addAsset("minecraft/lang/de_de.json", "{}");

        var result = downloader.downloadAssets(publishIndex(), REPOSITORY, DownloadProgressListener.NONE, CancellationToken.NONE);

        assertThat(result.assetRoot()).isEqualTo(assetRoot);
        assertThat(result.assetIndexId()).isEqualTo(ASSET_INDEX_ID);
        assertThat(result.objectCount()).isEqualTo(2);
        assertThat(assetRoot.resolve("indexes/" + ASSET_INDEX_ID + ".json")).exists();
        assertThat(assetRoot.resolve("objects").resolve(first.getRelativePath())).hasContent("sound a");
        assertThat(assetRoot.resolve("objects").resolve(second.getRelativePath())).hasContent("{}");
        assertThat(downloadedUris).contains(
                REPOSITORY + first.getRelativePath(),
                REPOSITORY + second.getRelativePath()
        );
    }

    @Test
    void testSharedObjectsAreOnlyDownloadedOnce() throws Exception {
        var object = addAsset("minecraft/sounds/a.ogg", "same content");
        addAsset("minecraft/sounds/b.ogg", "same content");

        var result = downloader.downloadAssets(publishIndex(), REPOSITORY, DownloadProgressListener.NONE, CancellationToken.NONE);

        assertThat(result.objectCount()).isEqualTo(1);
        assertThat(downloadedUris).containsOnlyOnce(REPOSITORY + object.getRelativePath());
    }

    @Test
    void testObjectsWithExpectedSizeAreNotDownloadedAgain() throws Exception {
        var present = addAsset("minecraft/sounds/a.ogg", "already there");
        var missing = addAsset("minecraft/sounds/b.ogg", "missing");
        var presentFile = assetRoot.resolve("objects").resolve(present.getRelativePath());
        Files.createDirectories(presentFile.getParent());
        Files.writeString(presentFile, "already there");

        var progress = new ArrayList<Double>();
        downloader.downloadAssets(publishIndex(), REPOSITORY, progress::add, CancellationToken.NONE);

        assertThat(downloadedUris).doesNotContain(REPOSITORY + present.getRelativePath());
        assertThat(downloadedUris).contains(REPOSITORY + missing.getRelativePath());
        assertThat(progress).containsExactly(1.0);
    }

    @Test
    void testFailedObjectDownloadsAreReported() throws Exception {
        var object = addAsset("minecraft/sounds/a.ogg", "sound a");
        var indexReference = publishIndex();
        downloadableContent.remove(REPOSITORY + object.getRelativePath());

        var e = assertThrows(DownloadsFailedException.class,
                () -> downloader.downloadAssets(indexReference, REPOSITORY, DownloadProgressListener.NONE, CancellationToken.NONE));
        assertThat(e.getErrors()).hasSize(1);
        assertThat(e.getErrors().get(0)).isInstanceOf(FileNotFoundException.class);
    }

    private AssetObject addAsset(String name, String content) {
        var bytes = content.getBytes(StandardCharsets.UTF_8);
        var object = new AssetObject(HashingUtil.hashBytes(bytes, HashingUtil.SHA1), bytes.length);
        indexObjects.put(name, object);
        downloadableContent.put(REPOSITORY + object.getRelativePath(), bytes);
        return object;
    }

    private AssetIndexReference publishIndex() {
        var json = new Gson().toJson(new AssetIndex(indexObjects)).getBytes(StandardCharsets.UTF_8);
        var uri = URI.create("http://meta.fake/indexes/" + ASSET_INDEX_ID + ".json");
        downloadableContent.put(uri.toString(), json);
        return new AssetIndexReference(ASSET_INDEX_ID, HashingUtil.hashBytes(json, HashingUtil.SHA1), json.length, 0, uri);
    }
}
