package net.lavalauncher.launcher.utils;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.Duration;
import java.util.Locale;

public final class StringUtil {
    private static final String[] FILE_SIZE_SUFFIXES = {"B", "KiB", "MiB", "GiB", "TiB"};

    private StringUtil() {
    }

    /**
     * Format a file or transfer size.
     */
    public static String formatBytes(long size) {
        long prevSize = size * 1024;
        for (var fileSizeSuffix : FILE_SIZE_SUFFIXES) {
            // If the size at this suffix is just 1 digit, we include a fractional digit from the previous suffix
            if (size < 10) {
                var df = new DecimalFormat("###.#", new DecimalFormatSymbols(Locale.ROOT));
                df.setMinimumFractionDigits(0);
                df.setMaximumFractionDigits(1);
                df.setRoundingMode(RoundingMode.DOWN);
                return df.format(prevSize / 1024.0) + " " + fileSizeSuffix;
            } else if (size < 1000) {
                return size + " " + fileSizeSuffix;
            }
            prevSize = size;
            size /= 1024;
        }
        return size * 1024 + " " + FILE_SIZE_SUFFIXES[FILE_SIZE_SUFFIXES.length - 1];
    }

    /**
     * Format an elapsed time such as an install duration. Durations below one second are shown in milliseconds.
     */
    public static String formatDuration(Duration duration) {
        if (duration.compareTo(Duration.ofSeconds(1)) < 0) {
            return duration.toMillis() + "ms";
        }

        var result = new StringBuilder();
        appendPart(result, duration.toHoursPart() + duration.toDaysPart() * 24, 'h');
        appendPart(result, duration.toMinutesPart(), 'm');
        appendPart(result, duration.toSecondsPart(), 's');
        return result.toString();
    }

    private static void appendPart(StringBuilder result, long value, char unit) {
        if (value > 0) {
            if (!result.isEmpty()) {
                result.append(' ');
            }
            result.append(value).append(unit);
        }
    }
}
