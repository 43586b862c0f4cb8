package com.ttennebkram.batchblur.processing;

import java.util.Collections;
import java.util.List;

/**
 * Summary of one pipeline run.
 */
public final class PipelineReport {

    private final ScanResult scanResult;
    private final long tasksQueued;
    private final int tasksCompleted;
    private final List<TaskFailure> failures;

    public PipelineReport(ScanResult scanResult, long tasksQueued, int tasksCompleted, List<TaskFailure> failures) {
        this.scanResult = scanResult;
        this.tasksQueued = tasksQueued;
        this.tasksCompleted = tasksCompleted;
        this.failures = Collections.unmodifiableList(failures);
    }

    /**
     * Report for a run that stopped at startup validation.
     */
    public static PipelineReport notStarted(ScanResult scanResult) {
        return new PipelineReport(scanResult, 0, 0, Collections.emptyList());
    }

    public ScanResult getScanResult() {
        return scanResult;
    }

    public long getTasksQueued() {
        return tasksQueued;
    }

    public int getTasksCompleted() {
        return tasksCompleted;
    }

    public List<TaskFailure> getFailures() {
        return failures;
    }

    /**
     * Tasks that were queued but never taken, because every worker had stopped.
     */
    public long getTasksUnprocessed() {
        return tasksQueued - tasksCompleted - failures.size();
    }

    public boolean isConfigurationError() {
        return !scanResult.isSuccess() && scanResult.getError().isConfigurationError();
    }

    public boolean isSuccess() {
        return scanResult.isSuccess() && failures.isEmpty() && getTasksUnprocessed() == 0;
    }

    @Override
    public String toString() {
        return "PipelineReport[scan=" + scanResult + ", queued=" + tasksQueued
            + ", completed=" + tasksCompleted + ", failed=" + failures.size()
            + ", unprocessed=" + getTasksUnprocessed() + "]";
    }
}
