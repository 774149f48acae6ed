package com.coordinator.core.service;

import com.coordinator.core.model.ActivityTask;

/**
 * Notifies the owning workflow about an activity's progress.
 * Implementations report delivery problems by throwing.
 */
public interface TaskUpdateSignaler {
    
    /**
     * Tell the workflow the activity has started.
     *
     * @param task the activity task
     * @param payload value returned by the handler's start, may be null
     */
    void signalStart(ActivityTask task, Object payload);
    
    /**
     * Tell the workflow about partial progress.
     *
     * @param task the activity task
     * @param payload non-null progress value produced by a tick
     */
    void signalUpdate(ActivityTask task, Object payload);
}
