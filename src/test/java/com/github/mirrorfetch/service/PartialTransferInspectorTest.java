package com.github.mirrorfetch.service;

import com.github.mirrorfetch.model.TaskStatus;
import com.github.mirrorfetch.model.TransferRequest;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PartialTransferInspector")
class PartialTransferInspectorTest {

    @TempDir
    Path tempDir;

    private PartialTransferInspector inspector;

    @BeforeEach
    void setUp() {
        inspector = new PartialTransferInspector();
    }

    private TransferRequest request(String name, Long expectedSize) {
        return TransferRequest.builder()
                .identifier(name)
                .canonicalPath("files/" + name)
                .destination(tempDir.resolve(name).toString())
                .expectedSize(expectedSize)
                .build();
    }

    private void write(String name, int length) throws IOException {
        Files.write(tempDir.resolve(name), new byte[length]);
    }

    @Test
    @DisplayName("should derive status from the file on disk")
    void shouldDeriveStatusFromDisk() throws IOException {
        write("complete", 100);
        write("partial", 40);
        write("empty", 0);
        write("oversized", 120);

        assertEquals(TaskStatus.PENDING, inspector.statusOf(request("absent", 100L)));
        assertEquals(TaskStatus.COMPLETED, inspector.statusOf(request("complete", 100L)));
        assertEquals(TaskStatus.PAUSED, inspector.statusOf(request("partial", 100L)));
        assertEquals(TaskStatus.PENDING, inspector.statusOf(request("empty", 100L)));
        assertEquals(TaskStatus.PENDING, inspector.statusOf(request("oversized", 100L)));
    }

    @Test
    @DisplayName("should treat a non-empty file of unknown size as resumable")
    void shouldTreatUnknownSizeAsResumable() throws IOException {
        write("unknown", 10);

        assertEquals(TaskStatus.PAUSED, inspector.statusOf(request("unknown", null)));
    }

    @Test
    @DisplayName("should list only resumable requests")
    void shouldListOnlyResumable() throws IOException {
        write("partial", 40);
        write("complete", 100);

        List<TransferRequest> resumable = inspector.findResumable(List.of(
                request("partial", 100L), request("complete", 100L), request("absent", 100L)));

        assertEquals(1, resumable.size());
        assertEquals("partial", resumable.get(0).getIdentifier());
    }

    @Test
    @DisplayName("should report zero bytes for a missing file")
    void shouldReportZeroForMissingFile() {
        assertEquals(0L, inspector.bytesOnDisk(tempDir.resolve("missing")));
    }

    @Test
    @DisplayName("should discard a partial file")
    void shouldDiscardPartialFile() throws IOException {
        write("partial", 40);

        inspector.discard("partial", tempDir.resolve("partial"));
        inspector.discard("partial", tempDir.resolve("partial"));

        assertFalse(Files.exists(tempDir.resolve("partial")));
    }
}
