package com.coordinator.worker.interceptor;

import com.coordinator.core.model.ActivityTask;

/**
 * Hooks the dispatch loop runs at key points of a task's lifecycle.
 * Every hook defaults to a no-op.
 */
public interface ActivityInterceptor {

    ActivityInterceptor NOOP = new ActivityInterceptor() { };

    default void beforeTask(ActivityTask task) {
    }

    default void afterTaskComplete(ActivityTask task, Object result) {
    }

    default void afterTaskFailed(ActivityTask task, Throwable error) {
    }

    /**
     * @param details cancellation details reported to the service, empty for a clean cancel
     */
    default void afterTaskCanceled(ActivityTask task, String details) {
    }
}
