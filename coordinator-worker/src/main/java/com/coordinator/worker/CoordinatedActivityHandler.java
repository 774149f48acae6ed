package com.coordinator.worker;

import com.coordinator.core.model.ActivityTask;

/**
 * Business logic of a long-running activity driven by a {@link CoordinatedActivityAdapter}.
 *
 * The adapter calls {@link #start} once, then {@link #tick} at a bounded rate until the
 * handler stops or the task is canceled, in which case {@link #cancel} is called exactly
 * once. All three run on the coordinating thread, never concurrently with each other.
 * Any progress state belongs to the implementation.
 *
 * @param <I> decoded input type
 * @param <R> progress and result type
 */
public interface CoordinatedActivityHandler<I, R> {

    /**
     * Type the task's JSON input is decoded into.
     */
    Class<I> inputType();

    /**
     * One-time setup.
     *
     * @return value sent to the workflow with the "activity started" signal, may be null
     * @throws ActivityException to fail the activity before any heartbeat is sent
     */
    Object start(ActivityTask task, I input) throws ActivityException;

    /**
     * Check progress. Called at most once per tick interval.
     *
     * @throws ActivityException to stop and fail the activity
     */
    TickResult<R> tick(ActivityTask task, I input) throws ActivityException;

    /**
     * Release resources after the task was canceled. Failures are logged and otherwise ignored.
     */
    void cancel(ActivityTask task, I input) throws ActivityException;
}
