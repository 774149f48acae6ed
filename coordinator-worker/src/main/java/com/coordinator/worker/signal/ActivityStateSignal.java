package com.coordinator.worker.signal;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Body of the activity started/updated signals.
 */
public record ActivityStateSignal(
    String activityId,
    String activityType,
    JsonNode details
) {
}
