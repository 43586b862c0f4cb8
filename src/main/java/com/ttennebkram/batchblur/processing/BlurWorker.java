package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.codec.DecodedImage;
import com.ttennebkram.batchblur.codec.ImageCodec;
import com.ttennebkram.batchblur.codec.ImageCodecException;
import com.ttennebkram.batchblur.model.BlurTask;
import com.ttennebkram.batchblur.model.BoundedTaskQueue;
import com.ttennebkram.batchblur.model.Image;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consumer thread: takes tasks from the work queue and runs
 * decode, per-channel processing and encode for each one.
 *
 * The loop ends when the queue is closed and drained, when the thread is
 * interrupted, or after a failed task under {@link FailurePolicy#STOP_WORKER}.
 * A failure never escapes the worker: it is logged and reported to the
 * {@link Listener}, and neither the queue nor other workers are touched.
 */
public class BlurWorker {

    private static final Logger logger = LoggerFactory.getLogger(BlurWorker.class);

    /**
     * Callbacks invoked on the worker's own thread.
     */
    public interface Listener {
        default void taskFailed(TaskFailure failure) {
        }

        default void workerFinished(BlurWorker worker) {
        }
    }

    private static final Listener NO_OP_LISTENER = new Listener() {
    };

    private final int index;
    private final BoundedTaskQueue<BlurTask> queue;
    private final ImageCodec codec;
    private final ImageProcessor processor;
    private final Path inputDirectory;
    private final Path outputDirectory;
    private final int channelCount;
    private final FailurePolicy failurePolicy;

    private Listener listener = NO_OP_LISTENER;

    private Thread workerThread;
    private final AtomicBoolean running = new AtomicBoolean(false);

    // Statistics
    private final AtomicInteger tasksTaken = new AtomicInteger();
    private final AtomicInteger tasksCompleted = new AtomicInteger();
    private final AtomicInteger tasksFailed = new AtomicInteger();

    public BlurWorker(int index, BoundedTaskQueue<BlurTask> queue, ImageCodec codec, ImageProcessor processor,
                      Path inputDirectory, Path outputDirectory, int channelCount, FailurePolicy failurePolicy) {
        this.index = index;
        this.queue = queue;
        this.codec = codec;
        this.processor = processor;
        this.inputDirectory = inputDirectory;
        this.outputDirectory = outputDirectory;
        this.channelCount = channelCount;
        this.failurePolicy = failurePolicy;
    }

    public void setListener(Listener listener) {
        this.listener = listener == null ? NO_OP_LISTENER : listener;
    }

    public String getName() {
        return "BlurWorker-" + index;
    }

    /**
     * Start the worker thread.
     */
    public void start() {
        if (running.get()) {
            return;
        }
        running.set(true);
        workerThread = new Thread(this::processingLoop, getName());
        workerThread.start();
    }

    /**
     * Wait for the worker thread to finish on its own.
     */
    public void join() throws InterruptedException {
        Thread t = workerThread;
        if (t != null) {
            t.join();
        }
    }

    /**
     * Interrupt the worker thread and wait briefly for it to exit.
     */
    public void stop() {
        Thread t = workerThread;
        if (t == null) {
            return;
        }
        t.interrupt();
        try {
            t.join(1000);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Main loop. Runs on the worker thread; also callable directly from tests.
     */
    protected void processingLoop() {
        running.set(true);
        try {
            while (true) {
                BlurTask task = queue.pop();
                if (task == null) {
                    logger.debug("{} - queue closed and drained", getName());
                    break;
                }
                tasksTaken.incrementAndGet();
                logger.debug("{} - consumed: {} - queue count: {}", getName(), task, queue.size());

                if (!processTask(task) && failurePolicy == FailurePolicy.STOP_WORKER) {
                    logger.warn("{} stopping after failed task {}", getName(), task);
                    break;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.debug("{} interrupted", getName());
        } finally {
            running.set(false);
            logger.info("{} finished: {} taken, {} completed, {} failed",
                getName(), tasksTaken.get(), tasksCompleted.get(), tasksFailed.get());
            listener.workerFinished(this);
        }
    }

    /**
     * @return true if the task was written successfully
     */
    private boolean processTask(BlurTask task) {
        try {
            DecodedImage decoded = codec.decode(task.getPath(), channelCount);
            Image output = processor.process(Image.fromDecoded(decoded));
            Path outputPath = resolveOutputPath(task.getPath());
            codec.encode(outputPath, output.toDecoded());
            tasksCompleted.incrementAndGet();
            logger.debug("{} - wrote {}", getName(), outputPath);
            return true;
        } catch (ImageCodecException | RuntimeException e) {
            tasksFailed.incrementAndGet();
            logger.warn("{} failed on {}: {}", getName(), task, e.getMessage());
            listener.taskFailed(new TaskFailure(task, index, e));
            return false;
        }
    }

    /**
     * Map an input file to the same relative location under the output directory.
     */
    public Path resolveOutputPath(Path inputPath) {
        if (inputPath.startsWith(inputDirectory)) {
            return outputDirectory.resolve(inputDirectory.relativize(inputPath));
        }
        return outputDirectory.resolve(inputPath.getFileName());
    }

    public int getTasksTaken() {
        return tasksTaken.get();
    }

    public int getTasksCompleted() {
        return tasksCompleted.get();
    }

    public int getTasksFailed() {
        return tasksFailed.get();
    }
}
