package net.lavalauncher.launcher.utils;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.zip.ZipInputStream;

public final class ArchiveUtil {
    private static final List<String> NATIVE_LIBRARY_EXTENSIONS = List.of(".dll", ".so", ".dylib", ".jnilib");

    private ArchiveUtil() {
    }

    /**
     * Extracts a {@code .zip} or {@code .tar.gz} archive, chosen by file extension.
     */
    public static void extract(Path archive, Path targetDir) throws IOException {
        var extension = FilenameUtil.getExtension(archive.getFileName().toString()).toLowerCase(Locale.ROOT);
        switch (extension) {
            case ".zip" -> extractZip(archive, targetDir);
            case ".tar.gz", ".tgz" -> extractTarGz(archive, targetDir);
            default -> throw new IOException("Unsupported archive format '" + extension + "': " + archive);
        }
    }

    public static void extractZip(Path zipFile, Path targetDir) throws IOException {
        Files.createDirectories(targetDir);
        try (var zis = new ZipInputStream(new BufferedInputStream(Files.newInputStream(zipFile)))) {
            for (var entry = zis.getNextEntry(); entry != null; entry = zis.getNextEntry()) {
                var outPath = resolveEntry(targetDir, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(outPath);
                } else {
                    Files.createDirectories(outPath.getParent());
                    Files.copy(zis, outPath, StandardCopyOption.REPLACE_EXISTING);
                }
            }
        }
    }

    public static void extractTarGz(Path tarGzFile, Path targetDir) throws IOException {
        Files.createDirectories(targetDir);
        try (var tis = new TarArchiveInputStream(new GzipCompressorInputStream(new BufferedInputStream(Files.newInputStream(tarGzFile))))) {
            TarArchiveEntry entry;
            while ((entry = tis.getNextEntry()) != null) {
                var outPath = resolveEntry(targetDir, entry.getName());
                if (entry.isDirectory()) {
                    Files.createDirectories(outPath);
                } else if (entry.isSymbolicLink()) {
                    Files.createDirectories(outPath.getParent());
                    Files.deleteIfExists(outPath);
                    Files.createSymbolicLink(outPath, Path.of(entry.getLinkName()));
                } else {
                    Files.createDirectories(outPath.getParent());
                    Files.copy(tis, outPath, StandardCopyOption.REPLACE_EXISTING);
                    applyMode(outPath, entry.getMode());
                }
            }
        }
    }

    /**
     * Copies every native library inside the given jar/zip into {@code targetDir}, dropping the directory
     * structure of the archive. Entries starting with one of the {@code excludes} prefixes are skipped.
     *
     * @return the names of the extracted files
     */
    public static List<String> extractNativeLibraries(Path archive, Path targetDir, List<String> excludes) throws IOException {
        Files.createDirectories(targetDir);
        var extracted = new ArrayList<String>();
        try (var zis = new ZipInputStream(new BufferedInputStream(Files.newInputStream(archive)))) {
            for (var entry = zis.getNextEntry(); entry != null; entry = zis.getNextEntry()) {
                var name = entry.getName();
                if (entry.isDirectory() || !isNativeLibrary(name) || excludes.stream().anyMatch(name::startsWith)) {
                    continue;
                }

                var fileName = name.substring(name.lastIndexOf('/') + 1);
                var outPath = resolveEntry(targetDir, fileName);
                copyTo(zis, outPath);
                extracted.add(fileName);
            }
        }
        return extracted;
    }

    /**
     * JDK archives wrap everything in a single versioned directory such as {@code jdk-17.0.12+7}.
     * If that is the case, its content is moved up into {@code dir}.
     */
    public static void flattenSingleRootDirectory(Path dir) throws IOException {
        List<Path> children;
        try (var stream = Files.list(dir)) {
            children = stream.toList();
        }
        if (children.size() != 1 || !Files.isDirectory(children.get(0))) {
            return;
        }

        var root = children.get(0);
        try (var stream = Files.list(root)) {
            for (var child : stream.toList()) {
                Files.move(child, dir.resolve(child.getFileName().toString()));
            }
        }
        Files.delete(root);
    }

    private static boolean isNativeLibrary(String name) {
        var lowerName = name.toLowerCase(Locale.ROOT);
        return NATIVE_LIBRARY_EXTENSIONS.stream().anyMatch(lowerName::endsWith);
    }

    private static void copyTo(InputStream in, Path outPath) throws IOException {
        Files.createDirectories(outPath.getParent());
        Files.copy(in, outPath, StandardCopyOption.REPLACE_EXISTING);
    }

    private static Path resolveEntry(Path targetDir, String entryName) throws IOException {
        var normalizedTarget = targetDir.toAbsolutePath().normalize();
        var outPath = normalizedTarget.resolve(entryName).normalize();
        if (!outPath.startsWith(normalizedTarget)) {
            throw new IOException("Archive entry outside target dir: " + entryName);
        }
        return outPath;
    }

    private static void applyMode(Path file, int mode) throws IOException {
        if ((mode & 0111) == 0 || !FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
            return;
        }

        var permissions = new HashSet<>(Files.getPosixFilePermissions(file));
        permissions.add(PosixFilePermission.OWNER_EXECUTE);
        if ((mode & 0010) != 0) {
            permissions.add(PosixFilePermission.GROUP_EXECUTE);
        }
        if ((mode & 0001) != 0) {
            permissions.add(PosixFilePermission.OTHERS_EXECUTE);
        }
        Files.setPosixFilePermissions(file, permissions);
    }
}
