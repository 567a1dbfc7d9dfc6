package net.lavalauncher.launcher.downloads;

import net.lavalauncher.launcher.utils.CancellationToken;
import net.lavalauncher.launcher.utils.HashingUtil;
import net.lavalauncher.launcher.utils.OperationCancelledException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DownloadManagerTest {
    @TempDir
    Path tempDir;
    @TempDir
    Path remoteWebRoot;
    TestFileServer server;
    DownloadManager downloadManager = new DownloadManager();

    @BeforeEach
    void setUp() throws Exception {
        server = new TestFileServer(remoteWebRoot);
        downloadManager.setRetryDelay(Duration.ofMillis(10));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.close();
        downloadManager.close();
    }

    @Test
    void testSimpleDownload() throws IOException {
        Files.writeString(remoteWebRoot.resolve("testpath.dat"), "hello, world!");
        var destination = tempDir.resolve("test.dat");
        downloadManager.download(server.uri("testpath.dat"), destination);
        assertThat(destination).hasContent("hello, world!");
    }

    /**
     * If only a URI is provided, and no length or checksum, the downloader will always re-download.
     */
    @Test
    void testSimpleDownloadUnconditionallyOverwrites() throws Exception {
        Files.writeString(remoteWebRoot.resolve("testpath.dat"), "hello, world!");
        var destination = tempDir.resolve("test.dat");
        downloadManager.download(server.uri("testpath.dat"), destination);
        downloadManager.download(server.uri("testpath.dat"), destination);
        assertThat(destination).hasContent("hello, world!");
        assertThat(server.getRequests()).containsExactly("/testpath.dat", "/testpath.dat");
    }

    @Test
    void testValidExistingFilesAreNotRedownloaded() throws Exception {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        Files.copy(remoteFile, destination);

        var progress = new ArrayList<Double>();
        assertFalse(downloadManager.download(downloadSpecFor(remoteFile), destination, progress::add, CancellationToken.NONE));
        assertThat(destination).hasContent("hello, world!");
        assertThat(progress).containsExactly(1.0);
        assertThat(server.getRequests()).isEmpty();
    }

    @Test
    void testSecondDownloadOfSameFileDoesNoRequests() throws Exception {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        Files.writeString(remoteFile, "hello, world!");
        var destination = tempDir.resolve("test.dat");

        assertTrue(downloadManager.download(downloadSpecFor(remoteFile), destination));
        assertFalse(downloadManager.download(downloadSpecFor(remoteFile), destination));
        assertThat(server.getRequests()).containsExactly("/testpath.dat");
    }

    @Test
    void testCorruptedLocalFilesAreRedownloaded() throws Exception {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        var downloadSpec = downloadSpecFor(remoteFile);

        Files.writeString(destination, "CORRUPTED!");

        assertTrue(downloadManager.download(downloadSpec, destination));

        assertThat(destination).hasContent("hello, world!");
        assertThat(server.getRequests()).containsExactly("/testpath.dat");
    }

    @Test
    void testCorruptedRemoteFilesAreRejectedBasedOnSize() throws Exception {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        var downloadSpec = new FullDownloadSpec(server.uri("testpath.dat"), Files.size(remoteFile), null);
        Files.writeString(remoteFile, "and now it is corrupted because its size differs!!!");

        var e = assertThrows(IntegrityException.class, () -> downloadManager.download(downloadSpec, destination));
        assertThat(e).hasMessageContaining("Downloaded file has unexpected size. (actual: 51, expected: 13)");
    }

    /**
     * A checksum mismatch is retried once with a fresh download before giving up.
     */
    @Test
    void testCorruptedRemoteFilesAreRejectedBasedOnChecksum() throws Exception {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        var downloadSpec = new FullDownloadSpec(server.uri("testpath.dat"), -1, HashingUtil.sha1(remoteFile));
        Files.writeString(remoteFile, "hello, warld!");

        var e = assertThrows(IntegrityException.class, () -> downloadManager.download(downloadSpec, destination));
        assertThat(e).hasMessageContaining("Downloaded file has unexpected checksum. (actual: decdbe49afb7782c8a07b7750097e77ecf73f437, expected: 1f09d30c707d53f3d16c530dd73d70a6ce7596a9)");
        assertThat(server.getRequests()).containsExactly("/testpath.dat", "/testpath.dat");
    }

    @Test
    void testFailedDownloadDoesNotLeavePartialFiles() throws Exception {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        var downloadSpec = new FullDownloadSpec(server.uri("testpath.dat"), -1, HashingUtil.sha1(remoteFile));
        Files.writeString(remoteFile, "something else entirely");
        Files.writeString(destination, "old content");

        assertThrows(IntegrityException.class, () -> downloadManager.download(downloadSpec, destination));

        assertThat(destination).doesNotExist();
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    void testConcurrentDownloadsOfTheSameFileBothSucceed() throws Exception {
        var remoteFile = remoteWebRoot.resolve("big.bin");
        var content = new byte[8 * 1024 * 1024];
        new Random(1234).nextBytes(content);
        Files.write(remoteFile, content);
        var downloadSpec = downloadSpecFor(remoteFile);

        var pool = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 5; round++) {
                var destination = tempDir.resolve("r" + round).resolve("big.bin");
                Callable<Boolean> task = () -> downloadManager.download(downloadSpec, destination);
                for (var future : pool.invokeAll(List.of(task, task))) {
                    future.get();
                }

                assertThat(destination).hasBinaryContent(content);
                try (var files = Files.list(destination.getParent())) {
                    assertThat(files).containsExactly(destination);
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testSha256Checksums() throws Exception {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        Files.writeString(remoteFile, "hello, world!");
        var destination = tempDir.resolve("test.dat");

        var downloadSpec = DownloadSpec.of(server.uri("testpath.dat"), HashingUtil.sha256(remoteFile));
        assertTrue(downloadManager.download(downloadSpec, destination));
        assertFalse(downloadManager.download(downloadSpec, destination));
        assertThat(destination).hasContent("hello, world!");
    }

    @Test
    void testChecksumsOfUnknownLengthAreRejected() {
        var downloadSpec = DownloadSpec.of(server.uri("testpath.dat"), "abcdef");
        assertThrows(IllegalArgumentException.class, () -> downloadManager.download(downloadSpec, tempDir.resolve("test.dat")));
    }

    @Test
    void testProgressIsReportedUntilComplete() throws Exception {
        var content = new byte[500_000];
        new Random(1234).nextBytes(content);
        Files.write(remoteWebRoot.resolve("big.dat"), content);

        var progress = Collections.synchronizedList(new ArrayList<Double>());
        downloadManager.download(DownloadSpec.of(server.uri("big.dat")), tempDir.resolve("big.dat"), progress::add, CancellationToken.NONE);

        assertThat(progress).isNotEmpty().isSorted();
        assertThat(progress.get(progress.size() - 1)).isEqualTo(1.0);
        assertThat(tempDir.resolve("big.dat")).hasBinaryContent(content);
    }

    @Test
    void testStatusCodeIsRetried() throws Exception {
        server.queueErrors(429);

        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        assertTrue(downloadManager.download(downloadSpecFor(remoteFile), destination));
        assertThat(server.getRequests()).containsExactly("/testpath.dat", "/testpath.dat");
    }

    @Test
    void testRetryAfterHeaderIsHonored() throws Exception {
        server.queueErrors(503);
        server.setRetryAfter("1");

        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        Files.writeString(remoteFile, "hello, world!");
        var start = System.nanoTime();
        assertTrue(downloadManager.download(downloadSpecFor(remoteFile), tempDir.resolve("test.dat")));
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(900));
    }

    @Test
    void testRetryOnStatusCodeStopsAfterFiveTries() throws Exception {
        server.queueErrors(429, 429, 429, 429, 429, 429, 429, 429, 429, 429, 429, 429);

        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        var e = assertThrows(IOException.class, () -> downloadManager.download(downloadSpecFor(remoteFile), destination));
        assertThat(e)
                .hasMessageContaining("Failed to download")
                .hasMessageContaining("HTTP Status Code 429");
        assertThat(server.getRequests()).containsExactly(
                "/testpath.dat",
                "/testpath.dat",
                "/testpath.dat",
                "/testpath.dat",
                "/testpath.dat"
        );
    }

    @Test
    void testFileNotFoundIsNotRetried() throws Exception {
        server.queueErrors(404);

        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        assertThrows(FileNotFoundException.class, () -> downloadManager.download(downloadSpecFor(remoteFile), destination));
        assertThat(server.getRequests()).containsExactly("/testpath.dat");
    }

    @Test
    void testServerErrorsAreNotRetried() throws Exception {
        server.queueErrors(500, 500, 500);

        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        var destination = tempDir.resolve("test.dat");
        Files.writeString(remoteFile, "hello, world!");
        var e = assertThrows(IOException.class, () -> downloadManager.download(downloadSpecFor(remoteFile), destination));
        assertThat(e)
                .hasMessageContaining("Failed to download")
                .hasMessageContaining("HTTP Status Code 500");
        assertThat(server.getRequests()).containsExactly("/testpath.dat");
    }

    @Test
    void testSupportsFileUrlDownloads() throws IOException {
        var remoteFile = remoteWebRoot.resolve("testpath.dat");
        Files.writeString(remoteFile, "hello, world!");
        var destination = tempDir.resolve("test.dat");
        downloadManager.download(remoteFile.toUri(), destination);
        assertThat(destination).hasContent("hello, world!");
    }

    @Test
    void testMissingFileUrlIsNotFound() {
        var missing = remoteWebRoot.resolve("missing.dat").toUri();
        assertThrows(FileNotFoundException.class, () -> downloadManager.download(missing, tempDir.resolve("test.dat")));
    }

    @Test
    void testDownloadToDirectoryUsesLastPathSegment() throws Exception {
        Files.createDirectories(remoteWebRoot.resolve("nested"));
        Files.writeString(remoteWebRoot.resolve("nested/archive.zip"), "zip");

        var result = downloadManager.downloadToDirectory(DownloadSpec.of(server.uri("nested/archive.zip")), tempDir,
                DownloadProgressListener.NONE, CancellationToken.NONE);

        assertThat(result).isEqualTo(tempDir.resolve("archive.zip"));
        assertThat(result).hasContent("zip");
    }

    @Test
    void testDownloadString() throws Exception {
        Files.writeString(remoteWebRoot.resolve("api.json"), "[{\"a\": 1}]");
        assertThat(downloadManager.downloadString(server.uri("api.json"), CancellationToken.NONE)).isEqualTo("[{\"a\": 1}]");
    }

    @Test
    void testCancelledDownloadDoesNotStart() throws Exception {
        Files.writeString(remoteWebRoot.resolve("testpath.dat"), "hello, world!");
        var token = CancellationToken.create();
        token.cancel();

        assertThrows(OperationCancelledException.class, () -> downloadManager.download(DownloadSpec.of(server.uri("testpath.dat")),
                tempDir.resolve("test.dat"), DownloadProgressListener.NONE, token));
        assertThat(server.getRequests()).isEmpty();
    }

    @Test
    void testConcurrentDownloadsAreLimited() throws Exception {
        try (var limitedManager = new DownloadManager(2)) {
            server.setResponseDelayMillis(200);
            var tasks = new ArrayList<Callable<Boolean>>();
            for (int i = 0; i < 6; i++) {
                var name = "file" + i + ".dat";
                Files.writeString(remoteWebRoot.resolve(name), "content " + i);
                tasks.add(() -> limitedManager.download(DownloadSpec.of(server.uri(name)), tempDir.resolve(name)));
            }

            var pool = Executors.newFixedThreadPool(6);
            try {
                for (var future : pool.invokeAll(tasks)) {
                    assertTrue(future.get());
                }
            } finally {
                pool.shutdownNow();
            }

            assertThat(server.getRequests()).hasSize(6);
            assertThat(server.getMaxActiveRequests()).isBetween(1, 2);
        }
    }

    FullDownloadSpec downloadSpecFor(Path path) throws IOException {
        return new FullDownloadSpec(
                server.uri(remoteWebRoot.relativize(path).toString().replace('\\', '/')),
                Files.size(path),
                HashingUtil.sha1(path)
        );
    }

    record FullDownloadSpec(URI uri, long size, String checksum) implements DownloadSpec {
    }
}
