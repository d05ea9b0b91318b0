package com.github.mirrorfetch.util;

import lombok.experimental.UtilityClass;

/**
 * Utility class for formatting data sizes, speeds and durations in log lines and progress events.
 */
@UtilityClass
public class FormatUtils {

    /**
     * Format bytes per second to human-readable speed string.
     *
     * @param bytesPerSecond Speed in bytes per second
     * @return Formatted string like "5.23 MB/s", "128.45 KB/s", or "512 B/s"
     */
    public static String formatSpeed(double bytesPerSecond) {
        if (bytesPerSecond >= TransferConstants.BYTES_PER_GB) {
            return String.format("%.2f GB/s", bytesPerSecond / TransferConstants.BYTES_PER_GB);
        } else if (bytesPerSecond >= TransferConstants.BYTES_PER_MB) {
            return String.format("%.2f MB/s", bytesPerSecond / TransferConstants.BYTES_PER_MB);
        } else if (bytesPerSecond >= TransferConstants.BYTES_PER_KB) {
            return String.format("%.2f KB/s", bytesPerSecond / TransferConstants.BYTES_PER_KB);
        } else {
            return String.format("%.0f B/s", bytesPerSecond);
        }
    }

    /**
     * Format bytes to human-readable size string.
     *
     * @param bytes Size in bytes
     * @return Formatted string like "1.23 GB", "456.78 MB", or "789 B"
     */
    public static String formatSize(long bytes) {
        if (bytes >= TransferConstants.BYTES_PER_GB) {
            return String.format("%.2f GB", bytes / (double) TransferConstants.BYTES_PER_GB);
        } else if (bytes >= TransferConstants.BYTES_PER_MB) {
            return String.format("%.2f MB", bytes / (double) TransferConstants.BYTES_PER_MB);
        } else if (bytes >= TransferConstants.BYTES_PER_KB) {
            return String.format("%.2f KB", bytes / (double) TransferConstants.BYTES_PER_KB);
        } else {
            return String.format("%d B", bytes);
        }
    }

    /**
     * Format byte progress, e.g. "1.20 MB / 3.00 MB", or just the transferred size when the total is unknown.
     */
    public static String formatProgress(long bytes, Long totalBytes) {
        if (totalBytes == null || totalBytes <= 0) {
            return formatSize(bytes);
        }
        return formatSize(bytes) + " / " + formatSize(totalBytes);
    }

    /**
     * Format duration in seconds to human-readable time string.
     *
     * @param seconds Duration in seconds
     * @return Formatted string like "2h 15m 30s", "45m 12s", or "23s"
     */
    public static String formatDuration(long seconds) {
        if (seconds < 0) {
            return "0s";
        }

        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }

    public static String formatHealth(double healthScore) {
        return String.format("%.0f%%", healthScore * 100);
    }
}
