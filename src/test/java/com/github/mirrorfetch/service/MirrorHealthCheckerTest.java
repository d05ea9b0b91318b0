package com.github.mirrorfetch.service;

import com.github.mirrorfetch.config.HttpClientConfig;
import com.github.mirrorfetch.config.MirrorFetchProperties;
import com.github.mirrorfetch.model.MirrorSite;
import com.github.mirrorfetch.service.persistence.MirrorStore;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
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
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MirrorHealthChecker")
class MirrorHealthCheckerTest {

    @TempDir
    Path tempDir;

    private MockWebServer server;
    private MirrorFetchProperties properties;
    private MirrorRegistry registry;
    private MirrorHealthChecker checker;
    private MirrorSite mirror;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        properties = new MirrorFetchProperties();
        properties.getTransfer().setReadTimeoutSeconds(5);
        registry = new MirrorRegistry(properties, new MirrorStore(tempDir.resolve("mirrors.json")),
                Clock.fixed(Instant.parse("2024-01-01T00:00:00Z"), ZoneOffset.UTC));
        checker = new MirrorHealthChecker(HttpClientConfig.buildClient(properties.getTransfer()), registry, properties);
        mirror = registry.upsertMirror(MirrorSite.builder()
                .name("local")
                .baseUrl(server.url("/gutenberg/").toString())
                .healthScore(0.5)
                .build());
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    private MirrorSite stored() {
        return registry.find(mirror.getBaseUrl()).orElseThrow();
    }

    @Nested
    @DisplayName("single mirror")
    class SingleMirrorTests {

        @Test
        @DisplayName("should send HEAD to the base URL")
        void shouldSendHeadToBaseUrl() throws InterruptedException {
            server.enqueue(new MockResponse().setResponseCode(200));

            assertTrue(checker.check(mirror));

            RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
            assertNotNull(request);
            assertEquals("HEAD", request.getMethod());
            assertEquals("/gutenberg/", request.getPath());
        }

        @Test
        @DisplayName("reply below 400 should raise health")
        void successShouldRaiseHealth() {
            server.enqueue(new MockResponse().setResponseCode(302).setHeader("Location", "/gutenberg/"));
            server.enqueue(new MockResponse().setResponseCode(200));

            assertTrue(checker.check(mirror));

            assertEquals(0.6, stored().getHealthScore(), 1e-9);
        }

        @Test
        @DisplayName("HTTP error should cost a moderate penalty")
        void httpErrorShouldCostModeratePenalty() {
            server.enqueue(new MockResponse().setResponseCode(503));

            assertFalse(checker.check(mirror));

            MirrorSite after = stored();
            assertEquals(0.3, after.getHealthScore(), 1e-9);
            assertEquals(1, after.getFailureCount());
            assertEquals("Health check HTTP 503", after.getLastError());
            assertTrue(after.isActive());
        }

        @Test
        @DisplayName("unreachable mirror should cost a severe penalty")
        void unreachableMirrorShouldCostSeverePenalty() {
            server.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

            assertFalse(checker.check(mirror));

            MirrorSite after = stored();
            assertEquals(0.2, after.getHealthScore(), 1e-9);
            assertEquals(1, after.getFailureCount());
            assertTrue(after.getLastError().startsWith("Health check error"));
        }

        @Test
        @DisplayName("should deactivate once failures exceed the threshold")
        void shouldDeactivateAfterThreshold() {
            properties.getHealth().setFailureThreshold(2);
            for (int i = 0; i < 3; i++) {
                server.enqueue(new MockResponse().setResponseCode(500));
            }

            checker.check(mirror);
            checker.check(mirror);
            assertTrue(stored().isActive());

            checker.check(mirror);
            assertFalse(stored().isActive());
        }

        @Test
        @DisplayName("successful check should reactivate a deactivated mirror")
        void successShouldReactivate() {
            registry.setActive(mirror.getBaseUrl(), false);
            server.enqueue(new MockResponse().setResponseCode(200));

            assertTrue(checker.check(stored()));

            assertTrue(stored().isActive());
        }
    }

    @Nested
    @DisplayName("all mirrors")
    class AllMirrorsTests {

        @Test
        @DisplayName("should report each mirror and save the registry")
        void shouldReportEachMirrorAndSave() throws IOException {
            MockWebServer down = new MockWebServer();
            down.start();
            try {
                MirrorSite other = registry.upsertMirror(MirrorSite.builder()
                        .name("down")
                        .baseUrl(down.url("/").toString())
                        .build());
                server.enqueue(new MockResponse().setResponseCode(200));
                down.enqueue(new MockResponse().setResponseCode(404));

                Map<String, Boolean> results = checker.checkAll();

                assertEquals(Map.of(mirror.getBaseUrl(), true, other.getBaseUrl(), false), results);
                assertTrue(Files.exists(tempDir.resolve("mirrors.json")));
            } finally {
                down.shutdown();
            }
        }

        @Test
        @DisplayName("should not save when autosave is off")
        void shouldNotSaveWhenAutosaveIsOff() {
            properties.getRegistry().setAutosave(false);
            server.enqueue(new MockResponse().setResponseCode(200));

            checker.checkAll();

            assertFalse(Files.exists(tempDir.resolve("mirrors.json")));
        }
    }
}
