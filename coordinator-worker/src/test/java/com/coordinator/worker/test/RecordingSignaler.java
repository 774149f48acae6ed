package com.coordinator.worker.test;

import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.service.TaskUpdateSignaler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Signaler double that records payloads and can be told to fail.
 */
public class RecordingSignaler implements TaskUpdateSignaler {

    private final List<Object> starts = Collections.synchronizedList(new ArrayList<>());
    private final List<Object> updates = Collections.synchronizedList(new ArrayList<>());
    private volatile RuntimeException startFailure;
    private volatile RuntimeException updateFailure;

    public RecordingSignaler failStartWith(RuntimeException failure) {
        this.startFailure = failure;
        return this;
    }

    public RecordingSignaler failUpdatesWith(RuntimeException failure) {
        this.updateFailure = failure;
        return this;
    }

    @Override
    public void signalStart(ActivityTask task, Object payload) {
        starts.add(payload);
        if (startFailure != null) {
            throw startFailure;
        }
    }

    @Override
    public void signalUpdate(ActivityTask task, Object payload) {
        updates.add(payload);
        if (updateFailure != null) {
            throw updateFailure;
        }
    }

    public List<Object> getStarts() {
        return List.copyOf(starts);
    }

    public List<Object> getUpdates() {
        return List.copyOf(updates);
    }
}
