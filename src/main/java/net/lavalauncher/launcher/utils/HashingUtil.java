package net.lavalauncher.launcher.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashingUtil {
    public static final String SHA1 = "SHA-1";
    public static final String SHA256 = "SHA-256";

    private HashingUtil() {
    }

    /**
     * Manifests only give us the hex digest, so the algorithm is derived from its length.
     *
     * @throws IllegalArgumentException if the length matches neither SHA-1 nor SHA-256
     */
    public static String algorithmForChecksum(String checksum) {
        return switch (checksum.length()) {
            case 40 -> SHA1;
            case 64 -> SHA256;
            default -> throw new IllegalArgumentException("Unsupported checksum length " + checksum.length() + ": " + checksum);
        };
    }

    public static boolean verifyChecksum(Path path, String checksum) throws IOException {
        var actual = hashFile(path, algorithmForChecksum(checksum));
        return checksum.equalsIgnoreCase(actual);
    }

    public static String sha1(String value) {
        return hashBytes(value.getBytes(StandardCharsets.UTF_8), SHA1);
    }

    public static String sha1(Path path) throws IOException {
        return hashFile(path, SHA1);
    }

    public static String sha256(Path path) throws IOException {
        return hashFile(path, SHA256);
    }

    public static String hashBytes(byte[] value, String algorithm) {
        var digest = createDigest(algorithm);
        digest.update(value);
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String hashFile(Path path, String algorithm) throws IOException {
        var digest = createDigest(algorithm);

        try (var in = Files.newInputStream(path);
             var din = new DigestInputStream(in, digest)) {
            byte[] buffer = new byte[8192];
            while (din.read(buffer) != -1) {
                // Only the digest is of interest
            }
        }

        return HexFormat.of().formatHex(digest.digest());
    }

    private static MessageDigest createDigest(String algorithm) {
        try {
            return MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Missing digest algorithm " + algorithm, e);
        }
    }
}
