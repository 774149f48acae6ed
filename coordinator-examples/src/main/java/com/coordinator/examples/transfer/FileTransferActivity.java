package com.coordinator.examples.transfer;

import com.coordinator.core.model.ActivityTask;
import com.coordinator.worker.ActivityException;
import com.coordinator.worker.CoordinatedActivityHandler;
import com.coordinator.worker.TickResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simulated chunked file transfer driven as a coordinated activity.
 *
 * DEMONSTRATES:
 * - Handler-owned progress state keyed by task token
 * - A progress update every {@code reportEvery} chunks
 * - Cleanup of partial transfers on cancellation; the aborted byte count is kept
 *   until the caller takes it
 */
public class FileTransferActivity implements CoordinatedActivityHandler<TransferRequest, TransferProgress> {

    private static final Logger log = LoggerFactory.getLogger(FileTransferActivity.class);

    public static final String ACTIVITY_TYPE = "file-transfer";

    private final Map<String, Long> transferred = new ConcurrentHashMap<>();
    private final Map<String, Long> aborted = new ConcurrentHashMap<>();
    private final int reportEvery;

    public FileTransferActivity() {
        this(1);
    }

    public FileTransferActivity(int reportEvery) {
        if (reportEvery < 1) {
            throw new IllegalArgumentException("reportEvery must be >= 1");
        }
        this.reportEvery = reportEvery;
    }

    @Override
    public Class<TransferRequest> inputType() {
        return TransferRequest.class;
    }

    @Override
    public Object start(ActivityTask task, TransferRequest request) throws ActivityException {
        if (request == null || request.source() == null || request.destination() == null) {
            throw ActivityException.permanent("INVALID_REQUEST", "source and destination are required");
        }
        if (request.chunkBytes() <= 0 || request.sizeBytes() < 0) {
            throw ActivityException.permanent("INVALID_REQUEST", "sizes must be positive");
        }
        transferred.put(task.taskToken(), 0L);
        log.info("Starting transfer {} -> {} ({} bytes)", request.source(), request.destination(), request.sizeBytes());
        return new TransferProgress(request.destination(), 0, request.sizeBytes());
    }

    @Override
    public TickResult<TransferProgress> tick(ActivityTask task, TransferRequest request) throws ActivityException {
        Long done = transferred.get(task.taskToken());
        if (done == null) {
            throw new ActivityException("NOT_STARTED", "no transfer in progress for " + task.activityId());
        }
        long next = Math.min(request.sizeBytes(), done + request.chunkBytes());
        transferred.put(task.taskToken(), next);
        TransferProgress progress = new TransferProgress(request.destination(), next, request.sizeBytes());
        if (progress.isDone()) {
            transferred.remove(task.taskToken());
            log.info("Transfer to {} finished", request.destination());
            return TickResult.complete(progress);
        }
        long chunks = next / request.chunkBytes();
        return chunks % reportEvery == 0
            ? TickResult.continueWith(progress)
            : TickResult.continueWithoutUpdate();
    }

    @Override
    public void cancel(ActivityTask task, TransferRequest request) {
        Long partial = transferred.remove(task.taskToken());
        if (partial != null) {
            aborted.put(task.taskToken(), partial);
            log.info("Discarded {} partially transferred bytes of {}", partial, request.destination());
        }
    }

    /**
     * Bytes already moved when the transfer for the token was canceled, if it was.
     * The entry is removed, so a second call returns null.
     */
    public Long takeAbortedBytes(String taskToken) {
        return aborted.remove(taskToken);
    }

    public boolean isInProgress(String taskToken) {
        return transferred.containsKey(taskToken);
    }
}
