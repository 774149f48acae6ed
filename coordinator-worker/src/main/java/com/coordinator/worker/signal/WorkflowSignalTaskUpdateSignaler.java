package com.coordinator.worker.signal;

import com.coordinator.core.exception.SignalDeliveryException;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.service.TaskUpdateSignaler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reports activity progress to the owning workflow as workflow signals carrying
 * an {@link ActivityStateSignal} JSON body.
 */
public class WorkflowSignalTaskUpdateSignaler implements TaskUpdateSignaler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowSignalTaskUpdateSignaler.class);

    public static final String ACTIVITY_STARTED_SIGNAL = "ActivityStartedSignal";
    public static final String ACTIVITY_UPDATED_SIGNAL = "ActivityUpdatedSignal";

    private final WorkflowSignalClient client;
    private final ObjectMapper objectMapper;

    public WorkflowSignalTaskUpdateSignaler(WorkflowSignalClient client) {
        this(client, new ObjectMapper());
    }

    public WorkflowSignalTaskUpdateSignaler(WorkflowSignalClient client, ObjectMapper objectMapper) {
        this.client = client;
        this.objectMapper = objectMapper;
    }

    @Override
    public void signalStart(ActivityTask task, Object payload) {
        send(ACTIVITY_STARTED_SIGNAL, task, payload);
    }

    @Override
    public void signalUpdate(ActivityTask task, Object payload) {
        send(ACTIVITY_UPDATED_SIGNAL, task, payload);
    }

    private void send(String signalName, ActivityTask task, Object payload) {
        String body;
        try {
            ActivityStateSignal signal = new ActivityStateSignal(
                task.activityId(),
                task.activityType(),
                payload == null ? null : objectMapper.valueToTree(payload)
            );
            body = objectMapper.writeValueAsString(signal);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SignalDeliveryException(signalName, task.workflowId(), e);
        }
        try {
            client.signalWorkflow(task.workflowId(), task.runId(), signalName, body);
        } catch (RuntimeException e) {
            throw new SignalDeliveryException(signalName, task.workflowId(), e);
        }
        log.debug("Sent {} to workflow {}", signalName, task.workflowId());
    }
}
