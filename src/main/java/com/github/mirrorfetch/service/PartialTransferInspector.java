package com.github.mirrorfetch.service;

import com.github.mirrorfetch.exception.FatalTransferException;
import com.github.mirrorfetch.model.TaskStatus;
import com.github.mirrorfetch.model.TransferRequest;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Derives task state from the filesystem alone. A paused task is nothing more than a
 * partial file at its destination.
 */
@Slf4j
@Component
public class PartialTransferInspector {

    /**
     * @return COMPLETED when the file matches the expected size, PAUSED when a resumable
     * partial file exists, PENDING otherwise
     */
    public TaskStatus statusOf(@NonNull TransferRequest request) {
        Path destination = request.getDestinationPath();
        long size = bytesOnDisk(destination);
        Long expected = request.getExpectedSize();

        if (!Files.exists(destination)) {
            return TaskStatus.PENDING;
        }
        if (expected != null && size == expected) {
            return TaskStatus.COMPLETED;
        }
        if (size == 0 || (expected != null && size > expected)) {
            return TaskStatus.PENDING;
        }
        return TaskStatus.PAUSED;
    }

    /**
     * Requests with a partial file on disk that a new batch would resume.
     */
    public List<TransferRequest> findResumable(@NonNull List<TransferRequest> requests) {
        List<TransferRequest> resumable = requests.stream()
                .filter(request -> statusOf(request) == TaskStatus.PAUSED)
                .collect(Collectors.toList());
        log.info("Found {} resumable transfers out of {}", resumable.size(), requests.size());
        return resumable;
    }

    public long bytesOnDisk(@NonNull Path destination) {
        try {
            return Files.exists(destination) ? Files.size(destination) : 0L;
        } catch (IOException e) {
            log.warn("Cannot read size of {}: {}", destination, e.getMessage());
            return 0L;
        }
    }

    /**
     * Delete a partial file so the next attempt starts from zero.
     *
     * @throws FatalTransferException if the file cannot be removed
     */
    public void discard(@NonNull String identifier, @NonNull Path destination) {
        try {
            if (Files.deleteIfExists(destination)) {
                log.debug("Discarded partial file {}", destination);
            }
        } catch (IOException e) {
            throw new FatalTransferException("Cannot delete partial file " + destination, e, identifier, destination);
        }
    }
}
