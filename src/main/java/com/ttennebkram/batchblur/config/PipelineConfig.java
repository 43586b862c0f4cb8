package com.ttennebkram.batchblur.config;

import com.ttennebkram.batchblur.model.BoundedTaskQueue;
import com.ttennebkram.batchblur.processing.BoxBlurProcessor;
import com.ttennebkram.batchblur.processing.DirectoryScanner;
import com.ttennebkram.batchblur.processing.FailurePolicy;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.PatternSyntaxException;

/**
 * Settings for one pipeline run. Field names double as the JSON keys read by
 * {@link PipelineConfigSerializer}; any key missing from the file keeps its default.
 */
public class PipelineConfig {

    public static final String DEFAULT_INPUT_DIRECTORY = "../input";
    public static final String DEFAULT_OUTPUT_DIRECTORY = "../output";
    public static final int DEFAULT_CHANNEL_COUNT = 3;
    public static final int DEFAULT_WORKER_COUNT = 10;
    public static final int DEFAULT_PRODUCER_COUNT = 1;

    private String inputDirectory = DEFAULT_INPUT_DIRECTORY;
    private String outputDirectory = DEFAULT_OUTPUT_DIRECTORY;
    private String fileGlob = DirectoryScanner.DEFAULT_FILE_GLOB;
    private int kernelSize = BoxBlurProcessor.DEFAULT_KERNEL_SIZE;
    private int channelCount = DEFAULT_CHANNEL_COUNT;
    private int queueCapacity = BoundedTaskQueue.DEFAULT_CAPACITY;
    private int workerCount = DEFAULT_WORKER_COUNT;
    private int producerCount = DEFAULT_PRODUCER_COUNT;
    private FailurePolicy failurePolicy = FailurePolicy.STOP_WORKER;

    public PipelineConfig() {
    }

    public PipelineConfig(String inputDirectory, String outputDirectory) {
        this.inputDirectory = inputDirectory;
        this.outputDirectory = outputDirectory;
    }

    /**
     * Reject settings the pipeline cannot run with.
     *
     * @throws IllegalArgumentException naming the first bad setting
     */
    public void validate() {
        if (inputDirectory == null || inputDirectory.isEmpty()) {
            throw new IllegalArgumentException("inputDirectory is required");
        }
        if (outputDirectory == null || outputDirectory.isEmpty()) {
            throw new IllegalArgumentException("outputDirectory is required");
        }
        if (fileGlob == null || fileGlob.isEmpty()) {
            throw new IllegalArgumentException("fileGlob is required");
        }
        try {
            FileSystems.getDefault().getPathMatcher("glob:" + fileGlob);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("fileGlob is not a valid glob: " + e.getMessage(), e);
        }
        if (kernelSize <= 0 || kernelSize % 2 == 0) {
            throw new IllegalArgumentException("kernelSize must be a positive odd number, got " + kernelSize);
        }
        requirePositive("channelCount", channelCount);
        requirePositive("queueCapacity", queueCapacity);
        requirePositive("workerCount", workerCount);
        requirePositive("producerCount", producerCount);
        if (failurePolicy == null) {
            throw new IllegalArgumentException("failurePolicy is required");
        }
    }

    private static void requirePositive(String name, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    public Path getInputPath() {
        return Paths.get(inputDirectory);
    }

    public Path getOutputPath() {
        return Paths.get(outputDirectory);
    }

    // Getters/setters for serialization

    public String getInputDirectory() { return inputDirectory; }
    public void setInputDirectory(String v) { inputDirectory = v; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String v) { outputDirectory = v; }

    public String getFileGlob() { return fileGlob; }
    public void setFileGlob(String v) { fileGlob = v; }

    public int getKernelSize() { return kernelSize; }
    public void setKernelSize(int v) { kernelSize = v; }

    public int getChannelCount() { return channelCount; }
    public void setChannelCount(int v) { channelCount = v; }

    public int getQueueCapacity() { return queueCapacity; }
    public void setQueueCapacity(int v) { queueCapacity = v; }

    public int getWorkerCount() { return workerCount; }
    public void setWorkerCount(int v) { workerCount = v; }

    public int getProducerCount() { return producerCount; }
    public void setProducerCount(int v) { producerCount = v; }

    public FailurePolicy getFailurePolicy() { return failurePolicy; }
    public void setFailurePolicy(FailurePolicy v) { failurePolicy = v; }

    @Override
    public String toString() {
        return "PipelineConfig[input=" + inputDirectory + ", output=" + outputDirectory
            + ", glob=" + fileGlob + ", kernel=" + kernelSize + ", channels=" + channelCount
            + ", capacity=" + queueCapacity + ", workers=" + workerCount
            + ", producers=" + producerCount + ", onFailure=" + failurePolicy + "]";
    }
}
