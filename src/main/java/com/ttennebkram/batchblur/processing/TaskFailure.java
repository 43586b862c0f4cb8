package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.model.BlurTask;

/**
 * A task that could not be processed, and the worker that gave up on it.
 */
public final class TaskFailure {

    public final BlurTask task;
    public final int workerIndex;
    public final Exception cause;

    public TaskFailure(BlurTask task, int workerIndex, Exception cause) {
        this.task = task;
        this.workerIndex = workerIndex;
        this.cause = cause;
    }

    @Override
    public String toString() {
        return task + " (worker " + workerIndex + "): " + cause.getMessage();
    }
}
