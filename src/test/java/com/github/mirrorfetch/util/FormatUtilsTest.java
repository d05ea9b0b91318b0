package com.github.mirrorfetch.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FormatUtils")
class FormatUtilsTest {

    @Nested
    @DisplayName("formatSpeed")
    class FormatSpeedTests {

        @Test
        @DisplayName("should format bytes per second")
        void shouldFormatBytesPerSecond() {
            assertEquals("500 B/s", FormatUtils.formatSpeed(500));
        }

        @Test
        @DisplayName("should format megabytes per second")
        void shouldFormatMegabytesPerSecond() {
            assertEquals("5.23 MB/s", FormatUtils.formatSpeed(5_230_000));
        }

        @ParameterizedTest
        @CsvSource({
            "999, 999 B/s",
            "1000, 1.00 KB/s",
            "1000000, 1.00 MB/s",
            "1500000000, 1.50 GB/s"
        })
        @DisplayName("should handle boundary values")
        void shouldHandleBoundaryValues(double input, String expected) {
            assertEquals(expected, FormatUtils.formatSpeed(input));
        }
    }

    @Nested
    @DisplayName("formatSize")
    class FormatSizeTests {

        @Test
        @DisplayName("should format bytes")
        void shouldFormatBytes() {
            assertEquals("512 B", FormatUtils.formatSize(512));
            assertEquals("999 B", FormatUtils.formatSize(999));
        }

        @Test
        @DisplayName("should format kilobytes")
        void shouldFormatKilobytes() {
            assertEquals("512.00 KB", FormatUtils.formatSize(512_000));
        }

        @Test
        @DisplayName("should format gigabytes")
        void shouldFormatGigabytes() {
            assertEquals("1.23 GB", FormatUtils.formatSize(1_230_000_000L));
        }
    }

    @Nested
    @DisplayName("formatProgress")
    class FormatProgressTests {

        @Test
        @DisplayName("should show transferred and total")
        void shouldShowTransferredAndTotal() {
            assertEquals("100.00 KB / 512.00 KB", FormatUtils.formatProgress(100_000, 512_000L));
        }

        @Test
        @DisplayName("should show only transferred when total unknown")
        void shouldShowOnlyTransferredWhenTotalUnknown() {
            assertEquals("100.00 KB", FormatUtils.formatProgress(100_000, null));
        }
    }

    @Nested
    @DisplayName("formatDuration")
    class FormatDurationTests {

        @ParameterizedTest
        @CsvSource({
            "0, 0s",
            "45, 45s",
            "125, 2m 5s",
            "8130, 2h 15m 30s",
            "-5, 0s"
        })
        @DisplayName("should format durations")
        void shouldFormatDurations(long seconds, String expected) {
            assertEquals(expected, FormatUtils.formatDuration(seconds));
        }
    }

    @Test
    @DisplayName("formatHealth should render a percentage")
    void formatHealthShouldRenderPercentage() {
        assertEquals("85%", FormatUtils.formatHealth(0.85));
        assertEquals("0%", FormatUtils.formatHealth(0.0));
    }
}
