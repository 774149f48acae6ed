package com.coordinator.worker;

/**
 * What a single tick of a coordinated activity produced.
 *
 * @param shouldContinue false ends the session with {@code result} as the completed value
 * @param result progress update when continuing, final result otherwise; may be null
 * @param <R> the handler's result type
 */
public record TickResult<R>(boolean shouldContinue, R result) {

    /**
     * Keep going and forward {@code update} to the workflow.
     */
    public static <R> TickResult<R> continueWith(R update) {
        return new TickResult<>(true, update);
    }

    /**
     * Keep going without telling the workflow anything.
     */
    public static <R> TickResult<R> continueWithoutUpdate() {
        return new TickResult<>(true, null);
    }

    /**
     * Stop and complete the activity with {@code result}.
     */
    public static <R> TickResult<R> complete(R result) {
        return new TickResult<>(false, result);
    }

    public boolean hasResult() {
        return result != null;
    }
}
