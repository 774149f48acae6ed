package com.coordinator.core.model;

/**
 * Response of a recorded heartbeat.
 *
 * @param cancelRequested the service asked the activity to stop
 */
public record HeartbeatStatus(boolean cancelRequested) {

    private static final HeartbeatStatus RECORDED = new HeartbeatStatus(false);
    private static final HeartbeatStatus CANCEL_REQUESTED = new HeartbeatStatus(true);

    public static HeartbeatStatus recorded() {
        return RECORDED;
    }

    public static HeartbeatStatus canceling() {
        return CANCEL_REQUESTED;
    }
}
