package com.appbuilder.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormatUtils Tests")
class FormatUtilsTest {

    @ParameterizedTest
    @CsvSource({
            "0, 0s",
            "45, 45s",
            "60, 1m 0s",
            "192, 3m 12s",
            "3600, 1h 0m",
            "3900, 1h 5m",
            "90061, 25h 1m"
    })
    @DisplayName("Should format durations as seconds, minutes or hours")
    void testFormatDuration(long seconds, String expected) {
        assertEquals(expected, FormatUtils.formatDuration(seconds));
    }

    @Test
    @DisplayName("Should render missing or negative durations as zero")
    void testFormatDuration_Missing() {
        assertEquals("0s", FormatUtils.formatDuration(null));
        assertEquals("0s", FormatUtils.formatDuration(-5L));
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0.0 B",
            "512, 512.0 B",
            "1536, 1.5 KB",
            "1048576, 1.0 MB",
            "21286093, 20.3 MB",
            "1288490189, 1.2 GB"
    })
    @DisplayName("Should format file sizes with one decimal")
    void testFormatFileSize(long bytes, String expected) {
        assertEquals(expected, FormatUtils.formatFileSize(bytes));
    }

    @Test
    @DisplayName("Should keep only the end of long text")
    void testTail() {
        assertEquals("world", FormatUtils.tail("hello world", 5));
        assertEquals("short", FormatUtils.tail("short", 10));
        assertNull(FormatUtils.tail(null, 10));
    }
}
