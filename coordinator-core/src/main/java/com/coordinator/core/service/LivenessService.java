package com.coordinator.core.service;

import com.coordinator.core.model.HeartbeatStatus;

/**
 * Liveness call into the orchestration service.
 */
@FunctionalInterface
public interface LivenessService {
    
    /**
     * Record a heartbeat for the task identified by the token.
     *
     * @param taskToken the token handed out with the activity task
     * @return the service's answer, including whether cancellation was requested
     * @throws com.coordinator.core.exception.UnknownResourceException if the service no longer knows the task
     */
    HeartbeatStatus recordHeartbeat(String taskToken);
}
