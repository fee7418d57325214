package com.appbuilder.util;

import java.util.Locale;

public final class FormatUtils {

    private static final String[] SIZE_UNITS = {"B", "KB", "MB", "GB", "TB"};

    private FormatUtils() {
    }

    /** "45s", "3m 12s", "1h 5m". Null or negative renders as "0s". */
    public static String formatDuration(Long seconds) {
        if (seconds == null || seconds < 0) {
            return "0s";
        }
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        }
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }

    /** "512.0 B", "1.5 KB", "20.3 MB", "1.2 GB". */
    public static String formatFileSize(Long bytes) {
        if (bytes == null || bytes < 0) {
            return "0.0 B";
        }
        double size = bytes;
        int unit = 0;
        while (size >= 1024 && unit < SIZE_UNITS.length - 1) {
            size /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", size, SIZE_UNITS[unit]);
    }

    /** The last {@code maxChars} characters of {@code text}; null stays null. */
    public static String tail(String text, int maxChars) {
        if (text == null || text.length() <= maxChars) {
            return text;
        }
        return text.substring(text.length() - maxChars);
    }
}
