package com.coordinator.examples.transfer;

import com.coordinator.core.exception.UnknownResourceException;
import com.coordinator.core.model.HeartbeatStatus;
import com.coordinator.core.service.LivenessService;
import com.coordinator.worker.signal.WorkflowSignalClient;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Stand-in for the orchestration service: tracks open activity tasks, answers
 * heartbeats and collects workflow signals.
 */
public class InMemoryOrchestrationService implements LivenessService, WorkflowSignalClient {

    /**
     * A signal received by a workflow.
     */
    public record ReceivedSignal(String workflowId, String signalName, String input) {
    }

    private enum TaskStatus { OPEN, CANCEL_REQUESTED }

    private final Map<String, TaskStatus> tasks = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> heartbeats = new ConcurrentHashMap<>();
    private final List<ReceivedSignal> signals = new CopyOnWriteArrayList<>();

    public void open(String taskToken) {
        tasks.put(taskToken, TaskStatus.OPEN);
        heartbeats.put(taskToken, new AtomicInteger());
    }

    public void requestCancel(String taskToken) {
        tasks.computeIfPresent(taskToken, (token, status) -> TaskStatus.CANCEL_REQUESTED);
    }

    /**
     * Forget the task, as the service does when it times out.
     */
    public void expire(String taskToken) {
        tasks.remove(taskToken);
    }

    @Override
    public HeartbeatStatus recordHeartbeat(String taskToken) {
        TaskStatus status = tasks.get(taskToken);
        if (status == null) {
            throw UnknownResourceException.activityGone(taskToken);
        }
        heartbeats.get(taskToken).incrementAndGet();
        return status == TaskStatus.CANCEL_REQUESTED
            ? HeartbeatStatus.canceling()
            : HeartbeatStatus.recorded();
    }

    @Override
    public void signalWorkflow(String workflowId, String runId, String signalName, String input) {
        signals.add(new ReceivedSignal(workflowId, signalName, input));
    }

    public int getHeartbeatCount(String taskToken) {
        AtomicInteger count = heartbeats.get(taskToken);
        return count == null ? 0 : count.get();
    }

    public List<ReceivedSignal> getSignals() {
        return List.copyOf(signals);
    }
}
