package com.github.mirrorfetch.service.transfer;

import com.github.mirrorfetch.config.HttpClientConfig;
import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.model.OutcomeType;
import com.github.mirrorfetch.model.TransferOutcome;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("HttpTransferEngine")
class HttpTransferEngineTest {

    private static final int TOTAL = 500_000;
    private static final int RESUME_AT = 100_000;

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private HttpTransferEngine engine;
    private byte[] content;
    private Path destination;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        MirrorFetchProperties properties = new MirrorFetchProperties();
        properties.getTransfer().setReadTimeoutSeconds(5);
        Clock clock = Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC);
        engine = new HttpTransferEngine(HttpClientConfig.buildClient(properties.getTransfer()), properties, clock);

        content = new byte[TOTAL];
        new Random(7).nextBytes(content);
        destination = tempDir.resolve("books").resolve("pg42.epub");
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private String url() {
        return server.url("/cache/epub/42/pg42.epub").toString();
    }

    private MockResponse full() {
        return new MockResponse().setResponseCode(200).setBody(new Buffer().write(content));
    }

    private MockResponse partialFrom(int start) {
        return new MockResponse()
                .setResponseCode(206)
                .setHeader("Content-Range", "bytes " + start + "-" + (TOTAL - 1) + "/" + TOTAL)
                .setBody(new Buffer().write(Arrays.copyOfRange(content, start, TOTAL)));
    }

    private void writeExisting(int length) throws IOException {
        Files.createDirectories(destination.getParent());
        Files.write(destination, Arrays.copyOf(content, length));
    }

    private TransferOutcome transfer(Long expectedSize) {
        return engine.transfer(url(), destination, expectedSize, TransferListener.NONE, new CancellationToken());
    }

    @Nested
    @DisplayName("successful transfers")
    class SuccessTests {

        @Test
        @DisplayName("should download a fresh file and create parent directories")
        void shouldDownloadFreshFile() throws Exception {
            server.enqueue(full());
            AtomicLong lastReported = new AtomicLong();

            TransferOutcome outcome = engine.transfer(url(), destination, (long) TOTAL,
                    (bytesOnDisk, totalBytes) -> lastReported.set(bytesOnDisk), new CancellationToken());

            assertEquals(OutcomeType.COMPLETED, outcome.getType());
            assertEquals(TOTAL, outcome.getBytesOnDisk());
            assertArrayEquals(content, Files.readAllBytes(destination));
            assertEquals(TOTAL, lastReported.get());
            assertNull(server.takeRequest().getHeader("Range"));
        }

        @Test
        @DisplayName("should resume a partial file with a range request")
        void shouldResumePartialFile() throws Exception {
            writeExisting(RESUME_AT);
            server.enqueue(partialFrom(RESUME_AT));

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.COMPLETED, outcome.getType());
            RecordedRequest request = server.takeRequest();
            assertEquals("bytes=" + RESUME_AT + "-", request.getHeader("Range"));
            assertArrayEquals(content, Files.readAllBytes(destination));
        }

        @Test
        @DisplayName("should replace the partial file when the server ignores the range")
        void shouldReplacePartialWhenRangeIgnored() throws Exception {
            Files.createDirectories(destination.getParent());
            Files.write(destination, new byte[RESUME_AT]);
            server.enqueue(full());

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.COMPLETED, outcome.getType());
            assertEquals("bytes=" + RESUME_AT + "-", server.takeRequest().getHeader("Range"));
            assertArrayEquals(content, Files.readAllBytes(destination));
        }

        @Test
        @DisplayName("should not contact the server when the file is already complete")
        void shouldSkipCompleteFile() throws Exception {
            writeExisting(TOTAL);

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.COMPLETED, outcome.getType());
            assertEquals(TOTAL, outcome.getBytesOnDisk());
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("should treat range not satisfiable at the full size as complete")
        void shouldTreatUnsatisfiableRangeAtFullSizeAsComplete() throws Exception {
            writeExisting(TOTAL);
            server.enqueue(new MockResponse().setResponseCode(416).setHeader("Content-Range", "bytes */" + TOTAL));

            TransferOutcome outcome = transfer(null);

            assertEquals(OutcomeType.COMPLETED, outcome.getType());
            assertEquals(1, server.getRequestCount());
            assertArrayEquals(content, Files.readAllBytes(destination));
        }

        @Test
        @DisplayName("should restart from zero once when the range cannot be satisfied")
        void shouldRestartOnUnsatisfiableRange() throws Exception {
            Files.createDirectories(destination.getParent());
            Files.write(destination, new byte[TOTAL + 10]);
            server.enqueue(new MockResponse().setResponseCode(416).setHeader("Content-Range", "bytes */" + TOTAL));
            server.enqueue(full());

            TransferOutcome outcome = transfer(null);

            assertEquals(OutcomeType.COMPLETED, outcome.getType());
            assertEquals("bytes=" + (TOTAL + 10) + "-", server.takeRequest().getHeader("Range"));
            assertNull(server.takeRequest().getHeader("Range"));
            assertArrayEquals(content, Files.readAllBytes(destination));
        }

        @Test
        @DisplayName("should restart when the returned range starts at the wrong offset")
        void shouldRestartOnMisalignedRange() throws Exception {
            writeExisting(RESUME_AT);
            server.enqueue(partialFrom(RESUME_AT + 1));
            server.enqueue(full());

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.COMPLETED, outcome.getType());
            assertEquals(2, server.getRequestCount());
            assertArrayEquals(content, Files.readAllBytes(destination));
        }
    }

    @Nested
    @DisplayName("failed transfers")
    class FailureTests {

        @Test
        @DisplayName("should report not found for 404 without creating the file")
        void shouldReportNotFound() {
            server.enqueue(new MockResponse().setResponseCode(404));

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.NOT_FOUND, outcome.getType());
            assertEquals(404, outcome.getHttpStatus());
            assertFalse(Files.exists(destination));
        }

        @Test
        @DisplayName("should report not found for 410")
        void shouldReportNotFoundForGone() {
            server.enqueue(new MockResponse().setResponseCode(410));

            assertEquals(OutcomeType.NOT_FOUND, transfer(null).getType());
        }

        @Test
        @DisplayName("should report rate limiting with the Retry-After delay")
        void shouldReportRateLimiting() {
            server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7"));

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.RATE_LIMITED, outcome.getType());
            assertEquals(Duration.ofSeconds(7), outcome.getRetryAfter());
        }

        @Test
        @DisplayName("should report server errors as transient with the status code")
        void shouldReportServerErrorAsTransient() {
            server.enqueue(new MockResponse().setResponseCode(500));

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.TRANSIENT, outcome.getType());
            assertEquals(500, outcome.getHttpStatus());
            assertTrue(outcome.isServerError());
            assertFalse(outcome.isConnectionFailure());
        }

        @Test
        @DisplayName("should report a refused connection as a connection failure")
        void shouldReportRefusedConnection() throws IOException {
            String unreachable = server.url("/pg42.epub").toString();
            server.shutdown();

            TransferOutcome outcome = engine.transfer(unreachable, destination, null,
                    TransferListener.NONE, new CancellationToken());

            assertEquals(OutcomeType.TRANSIENT, outcome.getType());
            assertTrue(outcome.isConnectionFailure());
        }

        @Test
        @DisplayName("should keep the bytes written before the connection dropped")
        void shouldKeepBytesWrittenBeforeDisconnect() throws IOException {
            server.enqueue(full().setSocketPolicy(SocketPolicy.DISCONNECT_DURING_RESPONSE_BODY));

            TransferOutcome outcome = transfer((long) TOTAL);

            assertEquals(OutcomeType.PARTIAL, outcome.getType());
            assertEquals(Files.size(destination), outcome.getBytesOnDisk());
            assertTrue(outcome.getBytesOnDisk() < TOTAL);
        }

        @Test
        @DisplayName("should reject a body whose declared length disagrees with the expected size")
        void shouldRejectWrongDeclaredLength() {
            server.enqueue(full());

            TransferOutcome outcome = transfer((long) TOTAL - 1);

            assertEquals(OutcomeType.INTEGRITY_MISMATCH, outcome.getType());
            assertFalse(Files.exists(destination));
        }

        @Test
        @DisplayName("should report a local filesystem failure as fatal")
        void shouldReportLocalFailureAsFatal() throws IOException {
            Path blocker = tempDir.resolve("not-a-directory");
            Files.write(blocker, new byte[]{1});

            TransferOutcome outcome = engine.transfer(url(), blocker.resolve("pg42.epub"), null,
                    TransferListener.NONE, new CancellationToken());

            assertEquals(OutcomeType.FATAL, outcome.getType());
            assertEquals(0, server.getRequestCount());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("should not send a request when already cancelled")
        void shouldNotSendRequestWhenCancelled() {
            CancellationToken token = new CancellationToken();
            token.cancel();

            TransferOutcome outcome = engine.transfer(url(), destination, (long) TOTAL, TransferListener.NONE, token);

            assertEquals(OutcomeType.CANCELLED, outcome.getType());
            assertEquals(0, server.getRequestCount());
        }

        @Test
        @DisplayName("should stop mid-stream and leave a consistent partial file")
        void shouldStopMidStream() throws IOException {
            server.enqueue(full().throttleBody(64 * 1024, 50, TimeUnit.MILLISECONDS));
            CancellationToken token = new CancellationToken();

            TransferOutcome outcome = engine.transfer(url(), destination, (long) TOTAL,
                    (bytesOnDisk, totalBytes) -> token.cancel(), token);

            assertEquals(OutcomeType.CANCELLED, outcome.getType());
            assertTrue(outcome.getBytesOnDisk() > 0);
            assertTrue(outcome.getBytesOnDisk() < TOTAL);
            assertEquals(Files.size(destination), outcome.getBytesOnDisk());
        }
    }

    @Nested
    @DisplayName("header parsing")
    class HeaderParsingTests {

        @Test
        @DisplayName("should parse a Content-Range with a known total")
        void shouldParseContentRange() {
            assertArrayEquals(new long[]{100, 499, 500}, HttpTransferEngine.parseContentRange("bytes 100-499/500"));
        }

        @Test
        @DisplayName("should parse a Content-Range with an unknown total")
        void shouldParseContentRangeWithUnknownTotal() {
            assertArrayEquals(new long[]{0, 9, -1}, HttpTransferEngine.parseContentRange("bytes 0-9/*"));
        }

        @Test
        @DisplayName("should reject malformed Content-Range")
        void shouldRejectMalformedContentRange() {
            assertNull(HttpTransferEngine.parseContentRange("items 0-9/10"));
            assertNull(HttpTransferEngine.parseContentRange(null));
        }

        @Test
        @DisplayName("should parse the total of an unsatisfied range")
        void shouldParseUnsatisfiedTotal() {
            assertEquals(500L, HttpTransferEngine.parseUnsatisfiedTotal("bytes */500"));
            assertNull(HttpTransferEngine.parseUnsatisfiedTotal("bytes 0-1/2"));
        }

        @Test
        @DisplayName("should parse Retry-After in seconds and as an HTTP date")
        void shouldParseRetryAfter() {
            assertEquals(Duration.ofSeconds(120), engine.parseRetryAfter("120"));
            assertEquals(Duration.ofSeconds(30), engine.parseRetryAfter("Mon, 01 Jan 2024 00:00:30 GMT"));
            assertEquals(Duration.ZERO, engine.parseRetryAfter("Sun, 31 Dec 2023 23:00:00 GMT"));
            assertNull(engine.parseRetryAfter("soon"));
            assertNull(engine.parseRetryAfter(null));
        }
    }
}
