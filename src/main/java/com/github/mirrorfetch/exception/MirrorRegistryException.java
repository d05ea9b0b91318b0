package com.github.mirrorfetch.exception;

import java.nio.file.Path;

/**
 * Exception thrown when the mirror list cannot be read or written.
 */
public class MirrorRegistryException extends DownloadException {

    private final Path mirrorFile;

    public MirrorRegistryException(String message, Path mirrorFile, Throwable cause) {
        super(message, cause);
        this.mirrorFile = mirrorFile;
    }

    public Path getMirrorFile() {
        return mirrorFile;
    }
}
