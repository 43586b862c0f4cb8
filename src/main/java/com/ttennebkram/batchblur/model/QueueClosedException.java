package com.ttennebkram.batchblur.model;

/**
 * Thrown when pushing onto a {@link BoundedTaskQueue} that has been closed.
 */
public class QueueClosedException extends IllegalStateException {

    public QueueClosedException(String message) {
        super(message);
    }
}
