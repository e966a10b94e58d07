package net.panotour.util;

import java.util.Collection;
import java.util.Locale;

/**
 * Filename extension helpers used for upload validation and RAW detection.
 */
public final class FileExtensionUtils {

    private FileExtensionUtils() {
    }

    /**
     * Lower-cased extension without the dot, or an empty string when the name has none.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        String trimmed = filename.trim();
        int dot = trimmed.lastIndexOf('.');
        if (dot < 0 || dot == trimmed.length() - 1) {
            return "";
        }
        return trimmed.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive check against a set of extensions given with or without leading dot.
     */
    public static boolean hasExtension(String filename, Collection<String> extensions) {
        String extension = extensionOf(filename);
        if (extension.isEmpty() || extensions == null) {
            return false;
        }
        for (String candidate : extensions) {
            if (candidate == null) {
                continue;
            }
            String normalized = candidate.trim().toLowerCase(Locale.ROOT);
            if (normalized.startsWith(".")) {
                normalized = normalized.substring(1);
            }
            if (normalized.equals(extension)) {
                return true;
            }
        }
        return false;
    }

    /** File size in megabytes with two decimals, for log lines. */
    public static String megabytes(long bytes) {
        return String.format(Locale.ROOT, "%.2f", bytes / (1024.0 * 1024.0));
    }
}
