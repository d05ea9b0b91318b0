package com.github.mirrorfetch.service.transfer;

import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.model.TransferOutcome;
import com.github.mirrorfetch.util.FormatUtils;
import com.github.mirrorfetch.util.TransferConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link TransferEngine} over HTTP(S) using OkHttp.
 * <p>
 * Resumes with {@code Range: bytes=<size>-} and writes the body chunk by chunk without
 * buffering, so the file on disk always matches the reported byte count.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HttpTransferEngine implements TransferEngine {

    private static final Pattern CONTENT_RANGE = Pattern.compile("bytes\\s+(\\d+)-(\\d+)/(\\d+|\\*)");
    private static final Pattern UNSATISFIED_RANGE = Pattern.compile("bytes\\s+\\*/(\\d+)");

    private final OkHttpClient httpClient;
    private final MirrorFetchProperties properties;
    private final Clock clock;

    @Override
    public TransferOutcome transfer(String sourceUrl,
                                    Path destination,
                                    Long expectedSize,
                                    TransferListener listener,
                                    CancellationToken cancellation) {
        TransferListener progress = listener != null ? listener : TransferListener.NONE;
        CancellationToken token = cancellation != null ? cancellation : new CancellationToken();

        long offset;
        try {
            Path parent = destination.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            offset = Files.exists(destination) ? Files.size(destination) : 0L;
            if (expectedSize != null && offset > expectedSize) {
                log.info("Existing file {} is larger than expected ({} > {}), starting over",
                        destination, offset, expectedSize);
                Files.delete(destination);
                offset = 0L;
            }
        } catch (IOException e) {
            return TransferOutcome.fatal(sizeOf(destination), "Cannot prepare " + destination, e);
        }

        if (expectedSize != null && offset == expectedSize && Files.exists(destination)) {
            log.debug("{} already complete ({} bytes), skipping request", destination, offset);
            return TransferOutcome.completed(offset);
        }

        boolean restarted = false;
        while (true) {
            if (token.isCancelled()) {
                return TransferOutcome.cancelled(offset, expectedSize);
            }

            Request.Builder requestBuilder = new Request.Builder().url(sourceUrl).get();
            if (offset > 0) {
                requestBuilder.header(TransferConstants.HEADER_RANGE, "bytes=" + offset + "-");
                log.debug("Resuming {} from byte {}", sourceUrl, offset);
            } else {
                log.debug("Requesting {}", sourceUrl);
            }

            Call call = httpClient.newCall(requestBuilder.build());
            Runnable abort = call::cancel;
            token.onCancel(abort);
            try (Response response = call.execute()) {
                if (token.isCancelled()) {
                    return TransferOutcome.cancelled(offset, expectedSize);
                }

                int code = response.code();
                if (code == TransferConstants.HTTP_RANGE_NOT_SATISFIABLE) {
                    Long declaredTotal = parseUnsatisfiedTotal(response.header(TransferConstants.HEADER_CONTENT_RANGE));
                    if (offset > 0 && declaredTotal != null && declaredTotal == offset
                            && (expectedSize == null || expectedSize == offset)) {
                        log.debug("Server reports {} already complete at {} bytes", destination, offset);
                        return TransferOutcome.completed(offset);
                    }
                    if (restarted) {
                        return TransferOutcome.transientFailure(code, offset, "Range not satisfiable after restart", null);
                    }
                    log.info("Range not satisfiable for {} at byte {}, restarting from zero", sourceUrl, offset);
                    offset = discard(destination);
                    restarted = true;
                    continue;
                }
                if (code == TransferConstants.HTTP_NOT_FOUND || code == TransferConstants.HTTP_GONE) {
                    return TransferOutcome.notFound(code, offset);
                }
                if (code == TransferConstants.HTTP_TOO_MANY_REQUESTS) {
                    return TransferOutcome.rateLimited(code, offset,
                            parseRetryAfter(response.header(TransferConstants.HEADER_RETRY_AFTER)));
                }
                if (!response.isSuccessful()) {
                    return TransferOutcome.transientFailure(code, offset, "HTTP " + code, null);
                }

                boolean append;
                Long declaredTotal;
                if (code == TransferConstants.HTTP_PARTIAL_CONTENT) {
                    long[] range = parseContentRange(response.header(TransferConstants.HEADER_CONTENT_RANGE));
                    boolean startMismatch = range == null || range[0] != offset;
                    boolean totalMismatch = range != null && range[2] >= 0
                            && expectedSize != null && range[2] != expectedSize;
                    if (startMismatch || totalMismatch) {
                        if (restarted) {
                            return TransferOutcome.transientFailure(code, offset,
                                    "Inconsistent Content-Range after restart", null);
                        }
                        log.info("Content-Range mismatch for {} (local size {}), restarting from zero", sourceUrl, offset);
                        offset = discard(destination);
                        restarted = true;
                        continue;
                    }
                    declaredTotal = range[2] >= 0 ? range[2] : null;
                    append = true;
                } else {
                    if (offset > 0) {
                        log.info("Server ignored range request for {}, taking full body", sourceUrl);
                        offset = 0L;
                    }
                    long contentLength = response.body() != null ? response.body().contentLength() : -1L;
                    declaredTotal = contentLength >= 0 ? contentLength : null;
                    if (expectedSize != null && declaredTotal != null && !declaredTotal.equals(expectedSize)) {
                        return TransferOutcome.integrityMismatch(sizeOf(destination), expectedSize,
                                "Server declared " + declaredTotal + " bytes, expected " + expectedSize);
                    }
                    append = false;
                }

                Long total = expectedSize != null ? expectedSize : declaredTotal;
                return streamBody(response.body(), destination, append, offset, total, expectedSize, progress, token);
            } catch (IOException e) {
                if (token.isCancelled()) {
                    return TransferOutcome.cancelled(sizeOf(destination), expectedSize);
                }
                return TransferOutcome.transientFailure(null, offset, "Connection failed: " + e.getMessage(), e);
            } catch (LocalWriteException e) {
                return TransferOutcome.fatal(sizeOf(destination), e.getMessage(), e.getCause());
            } finally {
                token.removeHook(abort);
            }
        }
    }

    private TransferOutcome streamBody(ResponseBody body,
                                       Path destination,
                                       boolean append,
                                       long offset,
                                       Long total,
                                       Long expectedSize,
                                       TransferListener listener,
                                       CancellationToken token) {
        if (body == null) {
            return TransferOutcome.transientFailure(null, offset, "Empty response body", null);
        }

        long start = clock.millis();
        long written = offset;
        byte[] buffer = new byte[properties.getTransfer().getBufferSize()];
        OutputStream out = openOutput(destination, append);
        InputStream in = body.byteStream();
        try {
            while (true) {
                if (token.isCancelled()) {
                    log.debug("Transfer of {} cancelled at {} bytes", destination, written);
                    return TransferOutcome.cancelled(written, total);
                }

                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    if (token.isCancelled()) {
                        return TransferOutcome.cancelled(written, total);
                    }
                    log.debug("Stream for {} interrupted at {}: {}", destination, written, e.getMessage());
                    return TransferOutcome.partial(written, total, e);
                }
                if (read == -1) {
                    break;
                }

                if (expectedSize != null && written + read > expectedSize) {
                    return TransferOutcome.integrityMismatch(written, expectedSize,
                            "Received more than the expected " + expectedSize + " bytes");
                }

                write(out, buffer, read, destination);
                written += read;
                listener.onProgress(written, total);
            }
        } finally {
            closeInput(in, destination);
            close(out, destination);
        }

        if (expectedSize != null && written != expectedSize) {
            return TransferOutcome.integrityMismatch(written, expectedSize,
                    "Got " + written + " bytes, expected " + expectedSize);
        }
        if (total != null && written != total) {
            return TransferOutcome.integrityMismatch(written, total,
                    "Got " + written + " bytes, server declared " + total);
        }

        long elapsed = Math.max(1, clock.millis() - start);
        log.debug("Transferred {} ({}) in {} ms", destination,
                FormatUtils.formatSize(written - offset), elapsed);
        return TransferOutcome.completed(written);
    }

    private OutputStream openOutput(Path destination, boolean append) {
        try {
            return append
                    ? Files.newOutputStream(destination, StandardOpenOption.CREATE, StandardOpenOption.APPEND)
                    : Files.newOutputStream(destination, StandardOpenOption.CREATE,
                            StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new LocalWriteException("Cannot open " + destination + " for writing", e);
        }
    }

    private void write(OutputStream out, byte[] buffer, int length, Path destination) {
        try {
            out.write(buffer, 0, length);
        } catch (IOException e) {
            throw new LocalWriteException("Failed to write " + destination + ": " + e.getMessage(), e);
        }
    }

    private void close(OutputStream out, Path destination) {
        try {
            out.close();
        } catch (IOException e) {
            throw new LocalWriteException("Failed to close " + destination + ": " + e.getMessage(), e);
        }
    }

    private static void closeInput(InputStream in, Path destination) {
        try {
            in.close();
        } catch (IOException e) {
            log.debug("Error closing response body for {}: {}", destination, e.getMessage());
        }
    }

    private long discard(Path destination) {
        try {
            Files.deleteIfExists(destination);
            return 0L;
        } catch (IOException e) {
            throw new LocalWriteException("Cannot delete partial file " + destination, e);
        }
    }

    private static long sizeOf(Path destination) {
        try {
            return Files.exists(destination) ? Files.size(destination) : 0L;
        } catch (IOException e) {
            log.warn("Cannot read size of {}: {}", destination, e.getMessage());
            return 0L;
        }
    }

    /**
     * Parse {@code bytes start-end/total}.
     *
     * @return {start, end, total} with total -1 when unknown, or null if unparseable
     */
    static long[] parseContentRange(String header) {
        if (header == null) {
            return null;
        }
        Matcher matcher = CONTENT_RANGE.matcher(header.trim());
        if (!matcher.matches()) {
            return null;
        }
        long total = "*".equals(matcher.group(3)) ? -1L : Long.parseLong(matcher.group(3));
        return new long[]{Long.parseLong(matcher.group(1)), Long.parseLong(matcher.group(2)), total};
    }

    static Long parseUnsatisfiedTotal(String header) {
        if (header == null) {
            return null;
        }
        Matcher matcher = UNSATISFIED_RANGE.matcher(header.trim());
        return matcher.matches() ? Long.parseLong(matcher.group(1)) : null;
    }

    /**
     * Retry-After as delta seconds or an HTTP date. Null when absent or unparseable.
     */
    Duration parseRetryAfter(String header) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            return Duration.ofSeconds(Math.max(0, Long.parseLong(value)));
        } catch (NumberFormatException e) {
            try {
                ZonedDateTime date = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration delay = Duration.between(clock.instant(), date.toInstant());
                return delay.isNegative() ? Duration.ZERO : delay;
            } catch (DateTimeParseException dateError) {
                log.debug("Ignoring unparseable Retry-After: {}", value);
                return null;
            }
        }
    }

    /**
     * Local filesystem failure while streaming. Converted to a FATAL outcome.
     */
    private static class LocalWriteException extends RuntimeException {
        LocalWriteException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
