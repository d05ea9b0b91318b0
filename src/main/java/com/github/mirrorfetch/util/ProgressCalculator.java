package com.github.mirrorfetch.util;

import lombok.Builder;
import lombok.Data;
import lombok.experimental.UtilityClass;

/**
 * Utility class for transfer progress calculations including speed, ETA, and percentage.
 */
@UtilityClass
public class ProgressCalculator {

    @Data
    @Builder
    public static class ProgressMetrics {
        private final Double progressPercentage;
        private final String downloadSpeed;
        private final Long etaSeconds;
        private final Long transferredBytes;
        private final Long totalBytes;
    }

    /**
     * Calculate transfer speed in bytes per second.
     *
     * @param bytes Bytes received in this session (excluding bytes resumed from disk)
     * @param elapsedSeconds Time elapsed since the session started
     * @return Speed in bytes per second, or null if calculation not possible
     */
    public static Double calculateSpeed(long bytes, long elapsedSeconds) {
        if (elapsedSeconds <= 0 || bytes <= 0) {
            return null;
        }
        return (double) bytes / elapsedSeconds;
    }

    /**
     * Calculate ETA (estimated time remaining) in seconds.
     *
     * @param remainingBytes Bytes still to fetch
     * @param bytesPerSecond Current speed
     * @return ETA in seconds, or null if calculation not possible
     */
    public static Long calculateEta(long remainingBytes, Double bytesPerSecond) {
        if (bytesPerSecond == null || bytesPerSecond <= 0) {
            return null;
        }
        if (remainingBytes <= 0) {
            return 0L;
        }
        return (long) (remainingBytes / bytesPerSecond);
    }

    /**
     * Calculate progress percentage based on bytes.
     *
     * @return Progress percentage (0-100), or null if calculation not possible
     */
    public static Double calculateProgress(long transferredBytes, long totalBytes) {
        if (totalBytes <= 0 || transferredBytes < 0) {
            return null;
        }

        if (transferredBytes >= totalBytes) {
            return 100.0;
        }

        return Math.min(100.0, (transferredBytes * 100.0) / totalBytes);
    }

    /**
     * Calculate all progress metrics at once.
     * <p>
     * A resumed transfer starts with {@code resumedFrom} bytes already on disk; only bytes
     * received since then count toward speed.
     *
     * @param bytesOnDisk Current size of the destination file
     * @param resumedFrom Size of the destination file when this session started
     * @param totalBytes Total size (null if unknown)
     * @param elapsedMillis Milliseconds elapsed since the session started
     */
    public static ProgressMetrics calculateMetrics(long bytesOnDisk, long resumedFrom, Long totalBytes, long elapsedMillis) {
        long elapsedSeconds = Math.max(1, elapsedMillis / 1000);

        Double progressPercentage = null;
        if (totalBytes != null) {
            progressPercentage = calculateProgress(bytesOnDisk, totalBytes);
        }

        Double speedBytesPerSecond = calculateSpeed(bytesOnDisk - resumedFrom, elapsedSeconds);
        String downloadSpeed = speedBytesPerSecond != null ?
            FormatUtils.formatSpeed(speedBytesPerSecond) : null;

        Long etaSeconds = null;
        if (totalBytes != null) {
            etaSeconds = calculateEta(totalBytes - bytesOnDisk, speedBytesPerSecond);
        }

        return ProgressMetrics.builder()
                .progressPercentage(progressPercentage)
                .downloadSpeed(downloadSpeed)
                .etaSeconds(etaSeconds)
                .transferredBytes(bytesOnDisk)
                .totalBytes(totalBytes)
                .build();
    }
}
