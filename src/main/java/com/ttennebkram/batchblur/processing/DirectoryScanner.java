package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.model.BlurTask;
import com.ttennebkram.batchblur.model.BoundedTaskQueue;
import com.ttennebkram.batchblur.model.QueueClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Producer: lists the input directory and pushes one {@link BlurTask} per
 * regular file onto the work queue.
 *
 * Listing order is whatever the filesystem returns. When several scanners
 * share one directory, each takes the entries whose file name hashes to its
 * own shard, so every file is queued exactly once regardless of order.
 */
public class DirectoryScanner {

    private static final Logger logger = LoggerFactory.getLogger(DirectoryScanner.class);

    public static final String DEFAULT_FILE_GLOB = "*";

    private final Path inputDirectory;
    private final Path outputDirectory;
    private final BoundedTaskQueue<BlurTask> queue;
    private final String fileGlob;
    private final int shardIndex;
    private final int shardCount;

    public DirectoryScanner(Path inputDirectory, Path outputDirectory, BoundedTaskQueue<BlurTask> queue) {
        this(inputDirectory, outputDirectory, queue, DEFAULT_FILE_GLOB, 0, 1);
    }

    public DirectoryScanner(Path inputDirectory, Path outputDirectory, BoundedTaskQueue<BlurTask> queue,
                            String fileGlob, int shardIndex, int shardCount) {
        if (shardCount <= 0 || shardIndex < 0 || shardIndex >= shardCount) {
            throw new IllegalArgumentException("Invalid shard " + shardIndex + " of " + shardCount);
        }
        this.inputDirectory = inputDirectory;
        this.outputDirectory = outputDirectory;
        this.queue = queue;
        this.fileGlob = fileGlob == null || fileGlob.isEmpty() ? DEFAULT_FILE_GLOB : fileGlob;
        this.shardIndex = shardIndex;
        this.shardCount = shardCount;
    }

    /**
     * Check the input directory and make sure the output directory exists.
     * Nothing is queued.
     */
    public static ScanResult prepare(Path inputDirectory, Path outputDirectory) {
        if (!Files.exists(inputDirectory)) {
            return ScanResult.failure(ScanError.MISSING_INPUT_LOCATION, inputDirectory.toString());
        }
        if (!Files.isDirectory(inputDirectory)) {
            return ScanResult.failure(ScanError.MISSING_INPUT_LOCATION,
                inputDirectory + " is not a directory");
        }

        if (!Files.exists(outputDirectory)) {
            try {
                Files.createDirectories(outputDirectory);
                logger.info("Created output directory {}", outputDirectory);
            } catch (IOException e) {
                return ScanResult.failure(ScanError.CREATE_OUTPUT_FAILED, outputDirectory + ": " + e);
            }
        }

        if (!Files.isDirectory(outputDirectory)) {
            return ScanResult.failure(ScanError.OUTPUT_IS_NOT_A_DIRECTORY, outputDirectory.toString());
        }
        return ScanResult.success(0);
    }

    public ScanResult prepare() {
        return prepare(inputDirectory, outputDirectory);
    }

    /**
     * Validate, then push every matching file in this scanner's shard.
     * Blocks while the queue is full.
     */
    public ScanResult scan() throws InterruptedException {
        ScanResult prepared = prepare();
        if (!prepared.isSuccess()) {
            return prepared;
        }

        int queued = 0;
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(inputDirectory, fileGlob)) {
            for (Path entry : entries) {
                if (!Files.isRegularFile(entry)) {
                    logger.debug("Skipping non-file entry {}", entry);
                    continue;
                }
                if (!isInShard(entry)) {
                    continue;
                }
                queue.push(new BlurTask(entry));
                queued++;
                logger.debug("Scanner {} - produced: {} - queue count: {}", shardIndex, entry, queue.size());
            }
        } catch (QueueClosedException e) {
            logger.warn("Scanner {} stopped after {} tasks: queue closed", shardIndex, queued);
            return ScanResult.failure(ScanError.QUEUE_CLOSED, inputDirectory.toString(), queued);
        } catch (IOException | DirectoryIteratorException e) {
            logger.error("Scanner {} failed listing {}", shardIndex, inputDirectory, e);
            return ScanResult.failure(ScanError.LISTING_FAILED, inputDirectory + ": " + e, queued);
        }

        logger.info("Scanner {} queued {} file(s) from {}", shardIndex, queued, inputDirectory);
        return ScanResult.success(queued);
    }

    private boolean isInShard(Path entry) {
        if (shardCount == 1) {
            return true;
        }
        return Math.floorMod(entry.getFileName().toString().hashCode(), shardCount) == shardIndex;
    }

    public Path getInputDirectory() {
        return inputDirectory;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }
}
