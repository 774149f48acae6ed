package com.coordinator.worker.interceptor;

import com.coordinator.core.model.ActivityTask;

import java.util.List;

/**
 * Runs several interceptors in registration order.
 */
public final class CompositeInterceptor implements ActivityInterceptor {

    private final List<ActivityInterceptor> interceptors;

    public CompositeInterceptor(List<ActivityInterceptor> interceptors) {
        this.interceptors = List.copyOf(interceptors);
    }

    public static CompositeInterceptor of(ActivityInterceptor... interceptors) {
        return new CompositeInterceptor(List.of(interceptors));
    }

    @Override
    public void beforeTask(ActivityTask task) {
        interceptors.forEach(i -> i.beforeTask(task));
    }

    @Override
    public void afterTaskComplete(ActivityTask task, Object result) {
        interceptors.forEach(i -> i.afterTaskComplete(task, result));
    }

    @Override
    public void afterTaskFailed(ActivityTask task, Throwable error) {
        interceptors.forEach(i -> i.afterTaskFailed(task, error));
    }

    @Override
    public void afterTaskCanceled(ActivityTask task, String details) {
        interceptors.forEach(i -> i.afterTaskCanceled(task, details));
    }
}
