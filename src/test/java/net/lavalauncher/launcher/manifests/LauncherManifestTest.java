package net.lavalauncher.launcher.manifests;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class LauncherManifestTest {
    @TempDir
    Path tempDir;

    @Test
    void testParseCatalog() throws IOException {
        var file = tempDir.resolve("version_manifest_v2.json");
        Files.writeString(file, """
                {
                  "latest": {"release": "1.20.1", "snapshot": "23w31a"},
                  "versions": [
                    {"id": "23w31a", "type": "snapshot", "url": "https://example.com/23w31a.json",
                     "time": "2023-08-01T12:00:00+00:00", "releaseTime": "2023-08-01T11:00:00+00:00",
                     "sha1": "1111111111111111111111111111111111111111", "complianceLevel": 1},
                    {"id": "1.20.1", "type": "release", "url": "https://example.com/1.20.1.json",
                     "time": "2023-06-12T13:25:51+00:00", "releaseTime": "2023-06-12T13:25:51+00:00",
                     "sha1": "2222222222222222222222222222222222222222", "complianceLevel": 1}
                  ]
                }
                """);

        var manifest = LauncherManifest.from(file);

        assertThat(manifest.latest()).isNotNull();
        assertThat(manifest.latest().release()).isEqualTo("1.20.1");
        assertThat(manifest.versions()).extracting(LauncherManifest.Version::id).containsExactly("23w31a", "1.20.1");
        var release = manifest.versions().get(1);
        assertThat(release.isRelease()).isTrue();
        assertThat(release.getReleaseTime()).isEqualTo(Instant.parse("2023-06-12T13:25:51Z"));
        assertThat(release.checksum()).isEqualTo("2222222222222222222222222222222222222222");
        assertThat(manifest.versions().get(0).isRelease()).isFalse();
    }

    @Test
    void testMalformedReleaseTime() {
        var version = new LauncherManifest.Version("x", "release", null, null, "yesterday", null, 0);
        assertThat(version.getReleaseTime()).isEqualTo(Instant.EPOCH);
    }

    @Test
    void testEmptyCatalogIsRejected() throws IOException {
        var file = tempDir.resolve("empty.json");
        Files.writeString(file, "");
        assertThrows(IOException.class, () -> LauncherManifest.from(file));
    }

    @Test
    void testCatalogWithoutVersions() throws IOException {
        var file = tempDir.resolve("catalog.json");
        Files.writeString(file, "{}");
        assertThat(LauncherManifest.from(file).versions()).isEmpty();
    }
}
