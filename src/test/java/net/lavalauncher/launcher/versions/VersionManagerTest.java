package net.lavalauncher.launcher.versions;

import net.lavalauncher.launcher.downloads.DownloadManager;
import net.lavalauncher.launcher.manifests.LauncherManifest;
import net.lavalauncher.launcher.manifests.RuleContext;
import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.HashingUtil;
import net.lavalauncher.launcher.utils.OsType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class VersionManagerTest {
    private static final String ASSET_CONTENT = "sound data";

    @TempDir
    Path tempDir;

    Path mirror;
    Path baseDir;
    DownloadManager downloadManager;

    @BeforeEach
    void setUp() throws IOException {
        mirror = tempDir.resolve("mirror");
        baseDir = tempDir.resolve("home");
        Files.createDirectories(mirror);
        downloadManager = new DownloadManager();
        downloadManager.setRetryDelay(Duration.ofMillis(10));
        writeMirror();
    }

    @AfterEach
    void tearDown() throws Exception {
        downloadManager.close();
    }

    @Test
    void testCatalogFallsBackToNextUri() throws Exception {
        try (var versionManager = createVersionManager(List.of(mirror.resolve("missing.json").toUri(), catalogUri()))) {
            var catalog = versionManager.loadCatalog(false, CancellationToken.NONE);

            assertThat(catalog.versions()).extracting(LauncherManifest.Version::id).containsExactly("23w31a", "1.20.1");
            assertThat(baseDir.resolve("versions/version_manifest_v2.json")).exists();
        }
    }

    @Test
    void testCachedCatalogIsUsedUnlessReloaded() throws Exception {
        try (var versionManager = createVersionManager(List.of(catalogUri()))) {
            versionManager.loadCatalog(false, CancellationToken.NONE);
            Files.delete(mirror.resolve("catalog.json"));

            assertThat(versionManager.loadCatalog(false, CancellationToken.NONE).versions()).hasSize(2);
            assertThrows(IOException.class, () -> versionManager.loadCatalog(true, CancellationToken.NONE));
        }
    }

    @Test
    void testAllCatalogUrisFailing() throws Exception {
        var uris = List.of(mirror.resolve("missing1.json").toUri(), mirror.resolve("missing2.json").toUri());
        try (var versionManager = createVersionManager(uris)) {
            var e = assertThrows(IOException.class, () -> versionManager.loadCatalog(false, CancellationToken.NONE));
            assertThat(e.getSuppressed()).hasSize(2);
            assertThat(baseDir.resolve("versions/version_manifest_v2.json")).doesNotExist();
        }
    }

    @Test
    void testReleaseVersionsOnly() throws Exception {
        try (var versionManager = createVersionManager(List.of(catalogUri()))) {
            assertThat(versionManager.getReleaseVersions(false, CancellationToken.NONE))
                    .extracting(LauncherManifest.Version::id)
                    .containsExactly("1.20.1");
        }
    }

    @Test
    void testResolveVersion() throws Exception {
        try (var versionManager = createVersionManager(List.of(catalogUri()))) {
            var version = versionManager.getReleaseVersions(false, CancellationToken.NONE).get(0);

            var resolved = versionManager.resolveVersion(version, CancellationToken.NONE);

            var descriptor = resolved.descriptor();
            assertThat(descriptor.versionId()).isEqualTo("1.20.1");
            assertThat(descriptor.type()).isEqualTo("release");
            assertThat(descriptor.requiredJavaVersion()).isEqualTo(17);
            assertThat(descriptor.mainClass()).isEqualTo("net.minecraft.client.main.Main");
            assertThat(descriptor.assetIndex()).isEqualTo("5");
            assertThat(descriptor.clientJarPath()).isEqualTo(baseDir.resolve("versions/1.20.1/1.20.1.jar"));
            assertThat(descriptor.classPath()).containsExactly("com/example/lib/1.0/lib-1.0.jar");
            assertThat(descriptor.gameArguments()).containsExactly("--username", "${auth_player_name}");
            assertThat(descriptor.jvmArguments()).containsExactly("-cp", "${classpath}");
            assertThat(baseDir.resolve("versions/1.20.1/1.20.1.json")).exists();

            // Works offline afterwards
            assertThat(versionManager.getCachedVersion("1.20.1").descriptor()).isEqualTo(descriptor);
        }
    }

    @Test
    void testDownloadVersionFiles() throws Exception {
        try (var versionManager = createVersionManager(List.of(catalogUri()))) {
            var version = versionManager.getReleaseVersions(false, CancellationToken.NONE).get(0);
            var resolved = versionManager.resolveVersion(version, CancellationToken.NONE);
            assertThat(versionManager.isVersionInstalled("1.20.1")).isFalse();

            versionManager.downloadVersionFiles(resolved.manifest(), VersionDownloadListener.NONE, CancellationToken.NONE);

            assertThat(versionManager.isVersionInstalled("1.20.1")).isTrue();
            assertThat(versionManager.getClientJarPath("1.20.1")).hasContent("client jar");
            assertThat(baseDir.resolve("libraries/com/example/lib/1.0/lib-1.0.jar")).hasContent("library jar");
            assertThat(baseDir.resolve("assets/indexes/5.json")).exists();
            var hash = HashingUtil.sha1(ASSET_CONTENT);
            assertThat(baseDir.resolve("assets/objects/" + hash.substring(0, 2) + "/" + hash)).hasContent(ASSET_CONTENT);
        }
    }

    @Test
    void testDownloadFailureIsReported() throws Exception {
        try (var versionManager = createVersionManager(List.of(catalogUri()))) {
            var version = versionManager.getReleaseVersions(false, CancellationToken.NONE).get(0);
            var resolved = versionManager.resolveVersion(version, CancellationToken.NONE);
            Files.delete(mirror.resolve("client.jar"));

            assertThrows(IOException.class, () -> versionManager.downloadVersionFiles(resolved.manifest(),
                    VersionDownloadListener.NONE, CancellationToken.NONE));
            assertThat(versionManager.isVersionInstalled("1.20.1")).isFalse();
        }
    }

    private VersionManager createVersionManager(List<URI> catalogUris) {
        return new VersionManager(baseDir, downloadManager, catalogUris, mirror.resolve("objects").toUri(), 2,
                RuleContext.of(OsType.LINUX));
    }

    private URI catalogUri() {
        return mirror.resolve("catalog.json").toUri();
    }

    private void writeMirror() throws IOException {
        var clientJar = write("client.jar", "client jar");
        var libraryJar = write("lib.jar", "library jar");

        var assetHash = HashingUtil.sha1(ASSET_CONTENT);
        write("objects/" + assetHash.substring(0, 2) + "/" + assetHash, ASSET_CONTENT);
        var assetIndex = write("index.json", """
                {"objects": {"minecraft/sounds/a.ogg": {"hash": "%s", "size": %d}}}
                """.formatted(assetHash, ASSET_CONTENT.length()));

        var versionManifest = write("1.20.1.json", """
                {
                  "id": "1.20.1",
                  "type": "release",
                  "mainClass": "net.minecraft.client.main.Main",
                  "javaVersion": {"component": "java-runtime-gamma", "majorVersion": 17},
                  "assetIndex": {"id": "5", "sha1": "%s", "size": %d, "totalSize": 10, "url": "%s"},
                  "downloads": {"client": {"sha1": "%s", "size": %d, "url": "%s"}},
                  "arguments": {"game": ["--username", "${auth_player_name}"], "jvm": ["-cp", "${classpath}"]},
                  "libraries": [
                    {
                      "name": "com.example:lib:1.0",
                      "downloads": {"artifact": {"path": "com/example/lib/1.0/lib-1.0.jar", "sha1": "%s", "size": %d, "url": "%s"}}
                    },
                    {
                      "name": "com.example:mac-only:1.0",
                      "rules": [{"action": "allow", "os": {"name": "osx"}}],
                      "downloads": {"artifact": {"path": "com/example/mac-only/1.0/mac-only-1.0.jar", "url": "%s"}}
                    }
                  ]
                }
                """.formatted(
                HashingUtil.sha1(assetIndex), Files.size(assetIndex), assetIndex.toUri(),
                HashingUtil.sha1(clientJar), Files.size(clientJar), clientJar.toUri(),
                HashingUtil.sha1(libraryJar), Files.size(libraryJar), libraryJar.toUri(),
                mirror.resolve("mac-only.jar").toUri()));

        write("catalog.json", """
                {
                  "latest": {"release": "1.20.1", "snapshot": "23w31a"},
                  "versions": [
                    {"id": "23w31a", "type": "snapshot", "url": "%s", "releaseTime": "2023-08-01T11:00:00+00:00"},
                    {"id": "1.20.1", "type": "release", "url": "%s", "sha1": "%s", "releaseTime": "2023-06-12T13:25:51+00:00"}
                  ]
                }
                """.formatted(mirror.resolve("missing.json").toUri(), versionManifest.toUri(), HashingUtil.sha1(versionManifest)));
    }

    private Path write(String relativePath, String content) throws IOException {
        var path = mirror.resolve(relativePath);
        Files.createDirectories(path.getParent());
        Files.writeString(path, content);
        return path;
    }
}
