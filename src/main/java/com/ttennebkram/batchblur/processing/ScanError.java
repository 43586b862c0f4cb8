package com.ttennebkram.batchblur.processing;

/**
 * Reasons a directory scan can fail.
 */
public enum ScanError {
    /** Input directory does not exist or is not a directory. */
    MISSING_INPUT_LOCATION("Input directory does not exist"),
    /** Output directory was absent and could not be created. */
    CREATE_OUTPUT_FAILED("Error creating output directory"),
    /** Something other than a directory already exists at the output path. */
    OUTPUT_IS_NOT_A_DIRECTORY("Output path exists but is not a directory"),
    /** Listing the input directory failed part-way. */
    LISTING_FAILED("Error listing input directory"),
    /** The queue was closed before every entry could be pushed. */
    QUEUE_CLOSED("Work queue closed before scan finished"),
    /** The producer thread was interrupted while waiting for queue space. */
    INTERRUPTED("Scan interrupted"),
    /** The producer thread stopped on an unexpected error. */
    PRODUCER_FAILED("Scanner stopped on an unexpected error");

    private final String description;

    ScanError(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Configuration errors are detected before anything is queued.
     */
    public boolean isConfigurationError() {
        return this == MISSING_INPUT_LOCATION
            || this == CREATE_OUTPUT_FAILED
            || this == OUTPUT_IS_NOT_A_DIRECTORY;
    }
}
