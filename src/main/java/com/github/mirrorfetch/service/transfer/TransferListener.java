package com.github.mirrorfetch.service.transfer;

/**
 * Receives a notification after every chunk written to disk.
 */
@FunctionalInterface
public interface TransferListener {

    TransferListener NONE = (bytesOnDisk, totalBytes) -> {
    };

    /**
     * @param bytesOnDisk current size of the destination file
     * @param totalBytes  full size when known, otherwise null
     */
    void onProgress(long bytesOnDisk, Long totalBytes);
}
