package com.github.mirrorfetch.service.transfer;

import com.github.mirrorfetch.model.TransferOutcome;

import java.nio.file.Path;

/**
 * Executes one resumable, streamed transfer against a single source URL.
 * <p>
 * Implementations never throw for network or filesystem trouble; every attempt ends in a
 * {@link TransferOutcome}, and the destination file always holds exactly
 * {@link TransferOutcome#getBytesOnDisk()} valid bytes afterwards.
 */
public interface TransferEngine {

    /**
     * Fetch {@code sourceUrl} into {@code destination}, resuming a partial file when one exists.
     *
     * @param sourceUrl    full URL on the chosen mirror
     * @param destination  target file; a smaller existing file is treated as a partial download
     * @param expectedSize size known from the catalog, or null
     * @param listener     notified after every chunk written
     * @param cancellation checked before connecting, after the headers and before every chunk
     */
    TransferOutcome transfer(String sourceUrl,
                             Path destination,
                             Long expectedSize,
                             TransferListener listener,
                             CancellationToken cancellation);
}
