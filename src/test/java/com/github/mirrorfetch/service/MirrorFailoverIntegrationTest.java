package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.HttpClientConfig;
import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.model.Availability;
import com.github.mirrorfetch.model.BatchResult;
import com.github.mirrorfetch.model.MirrorSite;
import com.github.mirrorfetch.model.TaskResult;
import com.github.mirrorfetch.model.TaskStatus;
import com.github.mirrorfetch.model.TransferRequest;
import com.github.mirrorfetch.service.persistence.MirrorStore;
import com.github.mirrorfetch.service.state.TransferStateMachine;
import com.github.mirrorfetch.service.transfer.CancellationToken;
import com.github.mirrorfetch.service.transfer.HttpTransferEngine;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okio.Buffer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end failover through the real HTTP engine against two local mirrors.
 */
@DisplayName("Mirror failover")
class MirrorFailoverIntegrationTest {

    @TempDir
    Path tempDir;

    private MockWebServer mirrorA;
    private MockWebServer mirrorB;
    private MirrorRegistry registry;
    private ConcurrencyCoordinator coordinator;

    @BeforeEach
    void setUp() throws IOException {
        mirrorA = new MockWebServer();
        mirrorB = new MockWebServer();
        mirrorA.start();
        mirrorB.start();

        MirrorFetchProperties properties = new MirrorFetchProperties();
        properties.getRegistry().setAutosave(false);
        Clock clock = Clock.systemUTC();

        registry = new MirrorRegistry(properties, new MirrorStore(tempDir.resolve("mirrors.json")), clock);
        registry.upsertMirror(MirrorSite.builder().name("A").baseUrl(mirrorA.url("/").toString()).priority(5).build());
        registry.upsertMirror(MirrorSite.builder().name("B").baseUrl(mirrorB.url("/").toString()).priority(1).build());

        // Lowest draw always lands on the highest-priority mirror
        Random firstChoice = new Random() {
            @Override
            public double nextDouble() {
                return 0.0;
            }
        };

        TransferStateMachine stateMachine = new TransferStateMachine();
        PartialTransferInspector inspector = new PartialTransferInspector();
        TransferTaskProcessor processor = new TransferTaskProcessor(
                new MirrorSelector(registry, properties, firstChoice, clock),
                new HttpTransferEngine(HttpClientConfig.buildClient(properties.getTransfer()), properties, clock),
                new FailureClassifier(registry, properties),
                inspector, stateMachine, new ProgressBroadcastService(), properties, clock);
        coordinator = new ConcurrencyCoordinator(processor, stateMachine, inspector, registry, properties, clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        mirrorA.shutdown();
        mirrorB.shutdown();
    }

    @Test
    @DisplayName("should fall over to the next mirror when the first lacks the item")
    void shouldFallOverWhenFirstMirrorLacksItem() throws Exception {
        byte[] book = new byte[64 * 1024];
        new Random(42).nextBytes(book);
        mirrorA.enqueue(new MockResponse().setResponseCode(404));
        mirrorB.enqueue(new MockResponse().setResponseCode(200).setBody(new Buffer().write(book)));

        Path destination = tempDir.resolve("pg42.epub");
        TransferRequest request = TransferRequest.builder()
                .identifier("42")
                .canonicalPath("cache/epub/42/pg42.epub")
                .destination(destination.toString())
                .expectedSize((long) book.length)
                .build();

        BatchResult result = coordinator.run(List.of(request), 1, new CancellationToken());

        TaskResult task = result.getResults().get(0);
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals("B", task.getLastMirror());
        assertEquals(2, task.getAttempts());
        assertArrayEquals(book, Files.readAllBytes(destination));

        assertEquals("/cache/epub/42/pg42.epub", mirrorA.takeRequest().getPath());
        assertEquals("/cache/epub/42/pg42.epub", mirrorB.takeRequest().getPath());

        MirrorSite a = registry.find(mirrorA.url("/").toString()).orElseThrow();
        MirrorSite b = registry.find(mirrorB.url("/").toString()).orElseThrow();
        assertEquals(0.95, a.getHealthScore(), 1e-9);
        assertEquals(1, a.getFailureCount());
        assertEquals(1.0, b.getHealthScore());
        assertEquals(Availability.ABSENT, registry.availability(a, "42"));
        assertEquals(Availability.PRESENT, registry.availability(b, "42"));
    }
}
