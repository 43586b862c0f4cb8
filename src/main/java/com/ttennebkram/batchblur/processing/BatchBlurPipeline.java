package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.codec.ImageCodec;
import com.ttennebkram.batchblur.config.PipelineConfig;
import com.ttennebkram.batchblur.model.BlurTask;
import com.ttennebkram.batchblur.model.BoundedTaskQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one batch: scanner threads feed a bounded queue, a fixed pool of
 * {@link BlurWorker}s drains it.
 *
 * Architecture:
 * - One queue, built per run and passed to every producer and consumer
 * - Producers close the queue once the last of them has finished pushing
 * - Workers exit when the queue is closed and empty
 * - If every worker stops early the queue is closed so producers do not block forever
 * - On a normal finish run() returns only after every thread has been joined
 * - On interrupt, producers are joined and each worker gets a bounded wait (see {@link BlurWorker#stop()})
 */
public class BatchBlurPipeline {

    private static final Logger logger = LoggerFactory.getLogger(BatchBlurPipeline.class);

    private final PipelineConfig config;
    private final ImageCodec codec;
    private final ImageProcessor processor;

    private volatile BoundedTaskQueue<BlurTask> queue;

    public BatchBlurPipeline(PipelineConfig config, ImageCodec codec) {
        this(config, codec, new BoxBlurProcessor(config.getKernelSize()));
    }

    public BatchBlurPipeline(PipelineConfig config, ImageCodec codec, ImageProcessor processor) {
        config.validate();
        this.config = config;
        this.codec = codec;
        this.processor = processor;
    }

    /**
     * Process every file in the input directory.
     *
     * @return the run summary; configuration errors are reported here, not thrown
     * @throws InterruptedException if the calling thread is interrupted while waiting;
     *         all pipeline threads are stopped first
     */
    public PipelineReport run() throws InterruptedException {
        Path inputDirectory = config.getInputPath();
        Path outputDirectory = config.getOutputPath();

        ScanResult prepared = DirectoryScanner.prepare(inputDirectory, outputDirectory);
        if (!prepared.isSuccess()) {
            logger.error("{}: {}", prepared.getError().getDescription(), prepared.getDetail());
            return PipelineReport.notStarted(prepared);
        }

        BoundedTaskQueue<BlurTask> taskQueue = new BoundedTaskQueue<>(config.getQueueCapacity());
        this.queue = taskQueue;
        logger.info("Starting pipeline: {}", config);

        List<TaskFailure> failures = new CopyOnWriteArrayList<>();
        AtomicInteger liveWorkers = new AtomicInteger(config.getWorkerCount());
        BlurWorker.Listener listener = new BlurWorker.Listener() {
            @Override
            public void taskFailed(TaskFailure failure) {
                failures.add(failure);
            }

            @Override
            public void workerFinished(BlurWorker worker) {
                if (liveWorkers.decrementAndGet() == 0 && !taskQueue.isClosed()) {
                    logger.warn("All workers have stopped; closing work queue");
                    taskQueue.close();
                }
            }
        };

        List<BlurWorker> workers = new ArrayList<>();
        for (int i = 0; i < config.getWorkerCount(); i++) {
            BlurWorker worker = new BlurWorker(i, taskQueue, codec, processor,
                inputDirectory, outputDirectory, config.getChannelCount(), config.getFailurePolicy());
            worker.setListener(listener);
            workers.add(worker);
        }

        int producerCount = config.getProducerCount();
        ScanResult[] scanResults = new ScanResult[producerCount];
        List<Thread> producers = new ArrayList<>();
        for (int i = 0; i < producerCount; i++) {
            final int shard = i;
            DirectoryScanner scanner = new DirectoryScanner(inputDirectory, outputDirectory, taskQueue,
                config.getFileGlob(), shard, producerCount);
            producers.add(new Thread(() -> scanResults[shard] = runScanner(scanner),
                "DirectoryScanner-" + shard));
        }

        for (BlurWorker worker : workers) {
            worker.start();
        }
        for (Thread producer : producers) {
            producer.start();
        }

        try {
            for (Thread producer : producers) {
                producer.join();
            }
            taskQueue.close();
            for (BlurWorker worker : workers) {
                worker.join();
            }
        } catch (InterruptedException e) {
            logger.warn("Pipeline interrupted; stopping all threads");
            taskQueue.close();
            for (Thread producer : producers) {
                producer.interrupt();
            }
            for (BlurWorker worker : workers) {
                worker.stop();
            }
            joinQuietly(producers);
            throw e;
        }

        ScanResult scanResult = ScanResult.success(0);
        for (ScanResult result : scanResults) {
            scanResult = scanResult.merge(result);
        }
        int completed = 0;
        for (BlurWorker worker : workers) {
            completed += worker.getTasksCompleted();
        }

        PipelineReport report = new PipelineReport(scanResult, taskQueue.getTotalAdded(), completed,
            new ArrayList<>(failures));
        logger.info("Pipeline finished: {}", report);
        return report;
    }

    static ScanResult runScanner(DirectoryScanner scanner) {
        try {
            return scanner.scan();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ScanResult.failure(ScanError.INTERRUPTED, Thread.currentThread().getName());
        } catch (RuntimeException e) {
            logger.error("{} died unexpectedly", Thread.currentThread().getName(), e);
            return ScanResult.failure(ScanError.PRODUCER_FAILED, String.valueOf(e));
        }
    }

    /**
     * Join threads that have already been interrupted, keeping the caller's interrupt status.
     */
    private static void joinQuietly(List<Thread> threads) {
        boolean interrupted = false;
        for (Thread thread : threads) {
            while (thread.isAlive()) {
                try {
                    thread.join();
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * @return the queue of the current or most recent run, or null before the first run
     */
    public BoundedTaskQueue<BlurTask> getQueue() {
        return queue;
    }
}
