package com.coordinator.worker.interceptor;

import com.coordinator.core.exception.ActivityCanceledException;
import com.coordinator.core.model.ActivityTask;
import com.coordinator.core.model.TerminationOutcome;
import com.coordinator.worker.ActivityCoordinator;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * Wraps a coordinator with lifecycle hooks. Exactly one after-hook runs per task,
 * matching the outcome type.
 */
public class InterceptingCoordinator<I, R> implements ActivityCoordinator<I, R> {

    private final ActivityCoordinator<I, R> delegate;
    private final ActivityInterceptor interceptor;

    public InterceptingCoordinator(ActivityCoordinator<I, R> delegate, ActivityInterceptor interceptor) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.interceptor = interceptor == null ? ActivityInterceptor.NOOP : interceptor;
    }

    @Override
    public TerminationOutcome<R> coordinate(ActivityTask task, I input) {
        return intercept(task, () -> delegate.coordinate(task, input));
    }

    @Override
    public TerminationOutcome<R> coordinateJson(ActivityTask task) {
        return intercept(task, () -> delegate.coordinateJson(task));
    }

    private TerminationOutcome<R> intercept(ActivityTask task, Supplier<TerminationOutcome<R>> coordination) {
        interceptor.beforeTask(task);
        TerminationOutcome<R> outcome = coordination.get();
        switch (outcome.type()) {
            case COMPLETED -> interceptor.afterTaskComplete(task, outcome.result());
            case FAILED -> interceptor.afterTaskFailed(task, outcome.error());
            case CANCELED -> interceptor.afterTaskCanceled(task, cancellationDetails(outcome.error()));
        }
        return outcome;
    }

    /**
     * Details reported with a cancellation: empty for a clean cancel.
     */
    static String cancellationDetails(Throwable cause) {
        if (cause == null) {
            return "";
        }
        if (cause instanceof ActivityCanceledException) {
            String details = ((ActivityCanceledException) cause).getDetails();
            return details == null ? "" : details;
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
