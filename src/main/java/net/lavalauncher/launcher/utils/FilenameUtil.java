package net.lavalauncher.launcher.utils;

import java.net.URI;
import java.text.Normalizer;
import java.util.Collection;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class FilenameUtil {
    private static final int MAX_FILENAME_LENGTH = 255;

    private static final String ILLEGAL_CHARACTERS = " |/\\:\"<>!?$&~#%^*";

    private static final Set<String> RESERVED_WINDOWS_NAMES = Set.of(
            "CON", "PRN", "AUX", "NUL",
            "COM1", "COM2", "COM3", "COM4", "COM5", "COM6", "COM7", "COM8", "COM9",
            "LPT1", "LPT2", "LPT3", "LPT4", "LPT5", "LPT6", "LPT7", "LPT8", "LPT9"
    );

    private FilenameUtil() {
    }

    /**
     * The filename includes the period.
     */
    public static String getExtension(String path) {
        var lastSep = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));

        var potentialExtension = path.lastIndexOf('.');
        if (potentialExtension > lastSep) {
            // Check for a double extension like .tar.gz heuristically
            var doubleExtensionStart = path.lastIndexOf('.', potentialExtension - 1);
            // We only allow 3 chars maximum for the double extension
            if (doubleExtensionStart > lastSep && potentialExtension - doubleExtensionStart <= 4) {
                return path.substring(doubleExtensionStart);
            }

            return path.substring(potentialExtension);
        } else {
            return "";
        }
    }

    /**
     * Last path segment of the URI, e.g. {@code OpenJDK17U-jdk_x64_linux_hotspot_17.0.12_7.tar.gz}.
     */
    public static String getFileName(URI uri) {
        var path = uri.getPath();
        if (path == null || path.isEmpty() || path.endsWith("/")) {
            throw new IllegalArgumentException("URI has no file name: " + uri);
        }
        return path.substring(path.lastIndexOf('/') + 1);
    }

    /**
     * Turns a user-chosen display name into a directory name that is valid on every supported file system.
     * <p>
     * Besides characters that are illegal in paths, invisible characters that could make the folder look like
     * something else (bidi overrides, zero-width and other format characters, unusual spaces) are replaced, as are
     * Unicode non-characters and broken surrogate pairs.
     *
     * @throws IllegalArgumentException if nothing usable remains of the name
     */
    public static String sanitizeDirectoryName(String name) {
        var normalized = Normalizer.normalize(replaceBrokenCodePoints(name), Normalizer.Form.NFC);
        normalized = trimDotsAndWhitespace(normalized);

        var result = new StringBuilder(normalized.length());
        normalized.codePoints().forEach(codePoint -> {
            if (isIllegal(codePoint)) {
                result.append('_');
            } else {
                result.appendCodePoint(codePoint);
            }
        });

        var sanitized = result.toString();
        var baseName = sanitized.contains(".") ? sanitized.substring(0, sanitized.indexOf('.')) : sanitized;
        if (RESERVED_WINDOWS_NAMES.contains(baseName.toUpperCase(Locale.ROOT))) {
            sanitized += "_";
        }

        if (sanitized.length() > MAX_FILENAME_LENGTH) {
            var end = MAX_FILENAME_LENGTH;
            // Don't cut a surrogate pair in half
            if (Character.isHighSurrogate(sanitized.charAt(end - 1))) {
                end--;
            }
            sanitized = sanitized.substring(0, end);
        }

        if (sanitized.isEmpty()) {
            throw new IllegalArgumentException("Name '" + name + "' does not contain any usable characters");
        }
        return sanitized;
    }

    /**
     * Picks a folder name for {@code name} that does not collide with any of {@code existingNames}.
     * On collision a {@code _(n)} suffix is appended, where n is one higher than the highest suffix in use.
     */
    public static String getUniqueFolderName(String name, Collection<String> existingNames) {
        var sanitized = sanitizeDirectoryName(name);

        var collides = existingNames.stream().anyMatch(sanitized::equalsIgnoreCase);
        if (!collides) {
            return sanitized;
        }

        var numberedPattern = Pattern.compile(Pattern.quote(sanitized) + "_\\((\\d{1,9})\\)", Pattern.CASE_INSENSITIVE);
        var highest = 0;
        for (var existing : existingNames) {
            var matcher = numberedPattern.matcher(existing);
            if (matcher.matches()) {
                highest = Math.max(highest, Integer.parseInt(matcher.group(1)));
            }
        }

        var suffix = "_(" + (highest + 1) + ")";
        if (sanitized.length() + suffix.length() > MAX_FILENAME_LENGTH) {
            sanitized = sanitized.substring(0, MAX_FILENAME_LENGTH - suffix.length());
        }
        return sanitized + suffix;
    }

    private static String trimDotsAndWhitespace(String text) {
        int start = 0;
        int end = text.length();
        while (start < end && isTrimmed(text.charAt(start))) {
            start++;
        }
        while (end > start && isTrimmed(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(start, end);
    }

    /**
     * Lone surrogates and non-characters become {@code _}. File systems reject the former and the latter
     * have no meaning in text.
     */
    private static String replaceBrokenCodePoints(String text) {
        var result = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            var ch = text.charAt(i);
            if (Character.isHighSurrogate(ch) && i + 1 < text.length() && Character.isLowSurrogate(text.charAt(i + 1))) {
                var codePoint = Character.toCodePoint(ch, text.charAt(++i));
                if (isNonCharacter(codePoint)) {
                    result.append('_');
                } else {
                    result.appendCodePoint(codePoint);
                }
            } else if (Character.isSurrogate(ch) || isNonCharacter(ch)) {
                result.append('_');
            } else {
                result.append(ch);
            }
        }
        return result.toString();
    }

    private static boolean isNonCharacter(int codePoint) {
        // U+FDD0..U+FDEF and the last two code points of every plane
        return (codePoint >= 0xFDD0 && codePoint <= 0xFDEF) || (codePoint & 0xFFFE) == 0xFFFE;
    }

    private static boolean isIllegal(int codePoint) {
        if (codePoint < 0x80) {
            return Character.isISOControl(codePoint) || ILLEGAL_CHARACTERS.indexOf(codePoint) != -1;
        }
        return Character.isISOControl(codePoint)
               || Character.getType(codePoint) == Character.FORMAT
               || Character.isSpaceChar(codePoint)
               || (codePoint >= 0xFFF9 && codePoint <= 0xFFFD);
    }

    private static boolean isTrimmed(char ch) {
        return ch == '.' || Character.isWhitespace(ch);
    }
}
