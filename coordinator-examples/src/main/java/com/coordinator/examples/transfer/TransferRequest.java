package com.coordinator.examples.transfer;

/**
 * Input of the file transfer activity.
 */
public record TransferRequest(
    String source,
    String destination,
    long sizeBytes,
    long chunkBytes
) {
}
