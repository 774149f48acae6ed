package com.coordinator.worker;

import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.TerminationOutcome;

/**
 * Drives a claimed activity task to exactly one terminal outcome.
 *
 * @param <I> decoded input type
 * @param <R> result type
 */
public interface ActivityCoordinator<I, R> {

    /**
     * Coordinate the task with an already decoded input.
     * Blocks the calling thread until the session ends.
     */
    TerminationOutcome<R> coordinate(ActivityTask task, I input);

    /**
     * Decode the task's JSON input and coordinate it.
     * Undecodable input fails the task without starting the handler.
     */
    TerminationOutcome<R> coordinateJson(ActivityTask task);
}
