package net.convertcompress.util;

import java.util.Locale;

/**
 * Human readable byte counts for size estimates and batch summaries.
 */
public final class ByteFormatUtils {

    private static final long KIB = 1024L;
    private static final long MIB = KIB * 1024L;

    private ByteFormatUtils() {
    }

    /**
     * Formats a byte count as {@code "1.50 MB"}, {@code "12 KB"} or {@code "512 B"}.
     * Negative counts are treated as zero.
     */
    public static String formatBytes(long bytes) {
        long value = Math.max(0L, bytes);
        if (value >= MIB) {
            return String.format(Locale.ROOT, "%.2f MB", value / (double) MIB);
        }
        if (value >= KIB) {
            return String.format(Locale.ROOT, "%.0f KB", value / (double) KIB);
        }
        return value + " B";
    }
}
