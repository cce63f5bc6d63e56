package com.firstcrack.service.schedule;

/**
 * Cancellation handle for a task registered with a {@link StageTimer}.
 */
public interface Cancellable {

    /**
     * @return {@code true} if the task will not run because of this call;
     *         {@code false} if it already ran, is running, or was cancelled before
     */
    boolean cancel();
}
