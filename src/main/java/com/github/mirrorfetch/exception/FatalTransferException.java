package com.github.mirrorfetch.exception;

import java.nio.file.Path;

/**
 * Exception thrown when a local resource failure (disk full, permissions) makes
 * continuing the batch pointless.
 */
public class FatalTransferException extends DownloadException {

    private final String identifier;
    private final Path destination;

    public FatalTransferException(String message, Throwable cause, String identifier, Path destination) {
        super(message, cause);
        this.identifier = identifier;
        this.destination = destination;
    }

    public String getIdentifier() {
        return identifier;
    }

    public Path getDestination() {
        return destination;
    }
}
