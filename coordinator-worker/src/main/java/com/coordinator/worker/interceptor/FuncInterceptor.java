package com.coordinator.worker.interceptor;

import com.coordinator.core.model.ActivityTask;

import java.util.function.BiConsumer;
import java.util.function.Consumer;

/**
 * An {@link ActivityInterceptor} assembled from callbacks. Unset callbacks are no-ops.
 *
 * <pre>{@code
 * ActivityInterceptor audit = FuncInterceptor.builder()
 *     .afterTaskFailed((task, error) -> alerts.raise(task.activityId(), error))
 *     .build();
 * }</pre>
 */
public final class FuncInterceptor implements ActivityInterceptor {

    private final Consumer<ActivityTask> beforeTask;
    private final BiConsumer<ActivityTask, Object> afterTaskComplete;
    private final BiConsumer<ActivityTask, Throwable> afterTaskFailed;
    private final BiConsumer<ActivityTask, String> afterTaskCanceled;

    private FuncInterceptor(Builder builder) {
        this.beforeTask = builder.beforeTask;
        this.afterTaskComplete = builder.afterTaskComplete;
        this.afterTaskFailed = builder.afterTaskFailed;
        this.afterTaskCanceled = builder.afterTaskCanceled;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public void beforeTask(ActivityTask task) {
        if (beforeTask != null) {
            beforeTask.accept(task);
        }
    }

    @Override
    public void afterTaskComplete(ActivityTask task, Object result) {
        if (afterTaskComplete != null) {
            afterTaskComplete.accept(task, result);
        }
    }

    @Override
    public void afterTaskFailed(ActivityTask task, Throwable error) {
        if (afterTaskFailed != null) {
            afterTaskFailed.accept(task, error);
        }
    }

    @Override
    public void afterTaskCanceled(ActivityTask task, String details) {
        if (afterTaskCanceled != null) {
            afterTaskCanceled.accept(task, details);
        }
    }

    public static class Builder {
        private Consumer<ActivityTask> beforeTask;
        private BiConsumer<ActivityTask, Object> afterTaskComplete;
        private BiConsumer<ActivityTask, Throwable> afterTaskFailed;
        private BiConsumer<ActivityTask, String> afterTaskCanceled;

        public Builder beforeTask(Consumer<ActivityTask> beforeTask) {
            this.beforeTask = beforeTask;
            return this;
        }

        public Builder afterTaskComplete(BiConsumer<ActivityTask, Object> afterTaskComplete) {
            this.afterTaskComplete = afterTaskComplete;
            return this;
        }

        public Builder afterTaskFailed(BiConsumer<ActivityTask, Throwable> afterTaskFailed) {
            this.afterTaskFailed = afterTaskFailed;
            return this;
        }

        public Builder afterTaskCanceled(BiConsumer<ActivityTask, String> afterTaskCanceled) {
            this.afterTaskCanceled = afterTaskCanceled;
            return this;
        }

        public FuncInterceptor build() {
            return new FuncInterceptor(this);
        }
    }
}
