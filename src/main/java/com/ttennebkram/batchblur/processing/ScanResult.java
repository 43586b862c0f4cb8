package com.ttennebkram.batchblur.processing;

import java.util.Objects;

/**
 * Outcome of validating or scanning the input directory.
 * Either a success with the number of tasks queued, or an error kind.
 */
public final class ScanResult {

    private final ScanError error;
    private final String detail;
    private final int tasksQueued;

    private ScanResult(ScanError error, String detail, int tasksQueued) {
        this.error = error;
        this.detail = detail;
        this.tasksQueued = tasksQueued;
    }

    public static ScanResult success(int tasksQueued) {
        return new ScanResult(null, null, tasksQueued);
    }

    public static ScanResult failure(ScanError error, String detail) {
        return failure(error, detail, 0);
    }

    public static ScanResult failure(ScanError error, String detail, int tasksQueued) {
        return new ScanResult(Objects.requireNonNull(error, "error"), detail, tasksQueued);
    }

    public boolean isSuccess() {
        return error == null;
    }

    /**
     * @return the error kind, or null on success
     */
    public ScanError getError() {
        return error;
    }

    public String getDetail() {
        return detail;
    }

    public int getTasksQueued() {
        return tasksQueued;
    }

    /**
     * Combine results from several producers: queued counts add up, the first error wins.
     */
    public ScanResult merge(ScanResult other) {
        int total = tasksQueued + other.tasksQueued;
        if (error != null) {
            return failure(error, detail, total);
        }
        if (other.error != null) {
            return failure(other.error, other.detail, total);
        }
        return success(total);
    }

    @Override
    public String toString() {
        if (isSuccess()) {
            return "ScanResult[ok, queued=" + tasksQueued + "]";
        }
        return "ScanResult[" + error + ": " + detail + ", queued=" + tasksQueued + "]";
    }
}
