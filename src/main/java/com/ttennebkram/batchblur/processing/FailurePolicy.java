package com.ttennebkram.batchblur.processing;

/**
 * What a worker does after a task fails to decode, process or encode.
 * Failed tasks are never retried under either policy.
 */
public enum FailurePolicy {
    /** The worker records the failure and exits its loop. */
    STOP_WORKER,
    /** The worker records the failure and takes the next task. */
    SKIP_TASK
}
