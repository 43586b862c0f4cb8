package com.ttennebkram.batchblur;

import com.ttennebkram.batchblur.codec.ImageCodec;
import com.ttennebkram.batchblur.codec.OpenCvImageCodec;
import com.ttennebkram.batchblur.config.PipelineConfig;
import com.ttennebkram.batchblur.config.PipelineConfigSerializer;
import com.ttennebkram.batchblur.processing.BatchBlurPipeline;
import com.ttennebkram.batchblur.processing.PipelineReport;
import com.ttennebkram.batchblur.processing.TaskFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * Command-line entry point.
 *
 * Usage:
 *   BatchBlurLauncher                          (uses ../input and ../output)
 *   BatchBlurLauncher &lt;input-dir&gt; &lt;output-dir&gt;
 *   BatchBlurLauncher --config &lt;pipeline.json&gt;
 */
public class BatchBlurLauncher {

    private static final Logger logger = LoggerFactory.getLogger(BatchBlurLauncher.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_SCAN_ERROR = 1;
    public static final int EXIT_TASK_FAILURES = 2;
    public static final int EXIT_USAGE = 64;

    private static final String USAGE =
        "Usage: BatchBlurLauncher [<input-dir> <output-dir> | --config <pipeline.json>]";

    public static void main(String[] args) {
        // Load OpenCV native library
        OpenCvImageCodec.loadNativeLibrary();

        int status = run(args, new OpenCvImageCodec());
        System.exit(status);
    }

    /**
     * Parse arguments, run the pipeline, and map the outcome to an exit status.
     */
    public static int run(String[] args, ImageCodec codec) {
        PipelineConfig config;
        try {
            config = parseArgs(args);
            config.validate();
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            System.err.println(USAGE);
            return EXIT_USAGE;
        } catch (IOException e) {
            logger.error("Could not read config: {}", e.getMessage());
            return EXIT_USAGE;
        }

        PipelineReport report;
        try {
            report = new BatchBlurPipeline(config, codec).run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Interrupted before the pipeline finished");
            return EXIT_TASK_FAILURES;
        }

        if (!report.getScanResult().isSuccess()) {
            logger.error("Scan failed: {} ({})", report.getScanResult().getError().getDescription(),
                report.getScanResult().getDetail());
            return EXIT_SCAN_ERROR;
        }
        for (TaskFailure failure : report.getFailures()) {
            logger.error("Failed: {}", failure);
        }
        if (!report.isSuccess()) {
            return EXIT_TASK_FAILURES;
        }
        return EXIT_OK;
    }

    static PipelineConfig parseArgs(String[] args) throws IOException {
        if (args.length == 0) {
            return new PipelineConfig();
        }
        if ("--config".equals(args[0])) {
            if (args.length != 2) {
                throw new IllegalArgumentException("--config requires exactly one file argument");
            }
            return PipelineConfigSerializer.load(Paths.get(args[1]));
        }
        if (args.length == 2) {
            return new PipelineConfig(args[0], args[1]);
        }
        throw new IllegalArgumentException("Expected 0 or 2 arguments, got " + args.length);
    }
}
