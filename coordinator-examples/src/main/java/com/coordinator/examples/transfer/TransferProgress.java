package com.coordinator.examples.transfer;

/**
 * Progress reported to the workflow while a transfer runs, and its final result.
 */
public record TransferProgress(
    String destination,
    long bytesTransferred,
    long totalBytes
) {
    public int percent() {
        return totalBytes == 0 ? 100 : (int) (bytesTransferred * 100 / totalBytes);
    }

    public boolean isDone() {
        return bytesTransferred >= totalBytes;
    }
}
