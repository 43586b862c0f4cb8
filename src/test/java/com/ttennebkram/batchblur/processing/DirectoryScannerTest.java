package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.model.BlurTask;
import com.ttennebkram.batchblur.model.BoundedTaskQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DirectoryScannerTest {

    @TempDir
    Path tempDir;

    private Path inputDir() throws Exception {
        return Files.createDirectories(tempDir.resolve("input"));
    }

    private static List<BlurTask> drain(BoundedTaskQueue<BlurTask> queue) throws InterruptedException {
        queue.close();
        List<BlurTask> tasks = new ArrayList<>();
        BlurTask task;
        while ((task = queue.pop()) != null) {
            tasks.add(task);
        }
        return tasks;
    }

    @Test
    void missingInputDirectory() throws Exception {
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(4);
        DirectoryScanner scanner = new DirectoryScanner(tempDir.resolve("absent"), tempDir.resolve("out"), queue);

        ScanResult result = scanner.scan();

        assertFalse(result.isSuccess());
        assertEquals(ScanError.MISSING_INPUT_LOCATION, result.getError());
        assertTrue(result.getError().isConfigurationError());
        assertEquals(0, queue.size());
        assertFalse(Files.exists(tempDir.resolve("out")), "output must not be created when input is missing");
    }

    @Test
    void outputPathIsAFile() throws Exception {
        Path input = inputDir();
        Files.createFile(input.resolve("a.png"));
        Path output = Files.createFile(tempDir.resolve("output"));
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(4);

        ScanResult result = new DirectoryScanner(input, output, queue).scan();

        assertEquals(ScanError.OUTPUT_IS_NOT_A_DIRECTORY, result.getError());
        assertEquals(0, queue.size());
    }

    @Test
    void outputCannotBeCreated() throws Exception {
        Path input = inputDir();
        Path blocker = Files.createFile(tempDir.resolve("blocker"));

        ScanResult result = DirectoryScanner.prepare(input, blocker.resolve("output"));

        assertEquals(ScanError.CREATE_OUTPUT_FAILED, result.getError());
    }

    @Test
    void createsMissingOutputDirectory() throws Exception {
        Path input = inputDir();
        Path output = tempDir.resolve("nested").resolve("output");

        ScanResult result = DirectoryScanner.prepare(input, output);

        assertTrue(result.isSuccess());
        assertTrue(Files.isDirectory(output));
    }

    @Test
    void queuesEveryRegularFileOnce() throws Exception {
        Path input = inputDir();
        Set<Path> expected = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            expected.add(Files.createFile(input.resolve("img" + i + ".png")));
        }
        Files.createDirectory(input.resolve("subdir"));
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(10);

        ScanResult result = new DirectoryScanner(input, tempDir.resolve("output"), queue).scan();

        assertTrue(result.isSuccess());
        assertEquals(5, result.getTasksQueued());
        Set<Path> queued = new HashSet<>();
        for (BlurTask task : drain(queue)) {
            assertTrue(queued.add(task.getPath()), "duplicate " + task);
        }
        assertEquals(expected, queued);
    }

    @Test
    void globFiltersEntries() throws Exception {
        Path input = inputDir();
        Files.createFile(input.resolve("keep.png"));
        Files.createFile(input.resolve("skip.txt"));
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(10);

        ScanResult result = new DirectoryScanner(input, tempDir.resolve("output"), queue, "*.png", 0, 1).scan();

        assertEquals(1, result.getTasksQueued());
        assertEquals(input.resolve("keep.png"), drain(queue).get(0).getPath());
    }

    @Test
    void shardsTogetherCoverEveryFileExactlyOnce() throws Exception {
        Path input = inputDir();
        for (int i = 0; i < 40; i++) {
            Files.createFile(input.resolve("file-" + i + ".png"));
        }
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(100);

        int total = 0;
        for (int shard = 0; shard < 3; shard++) {
            total += new DirectoryScanner(input, tempDir.resolve("output"), queue, "*", shard, 3)
                .scan().getTasksQueued();
        }

        assertEquals(40, total);
        assertEquals(40, new HashSet<>(drain(queue)).size());
    }

    @Test
    void blocksOnFullQueueUntilDrained() throws Exception {
        Path input = inputDir();
        for (int i = 0; i < 6; i++) {
            Files.createFile(input.resolve("f" + i + ".png"));
        }
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(2);
        DirectoryScanner scanner = new DirectoryScanner(input, tempDir.resolve("output"), queue);

        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ScanResult> scan = pool.submit(scanner::scan);
            Thread.sleep(100);
            assertFalse(scan.isDone(), "scanner should be waiting for space");
            assertEquals(2, queue.size());

            int popped = 0;
            while (popped < 6) {
                assertNotNull(queue.pop());
                popped++;
            }
            assertEquals(6, scan.get(2, TimeUnit.SECONDS).getTasksQueued());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void closedQueueStopsScan() throws Exception {
        Path input = inputDir();
        for (int i = 0; i < 3; i++) {
            Files.createFile(input.resolve("f" + i + ".png"));
        }
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(2);
        queue.close();

        ScanResult result = new DirectoryScanner(input, tempDir.resolve("output"), queue).scan();

        assertEquals(ScanError.QUEUE_CLOSED, result.getError());
        assertFalse(result.getError().isConfigurationError());
        assertEquals(0, result.getTasksQueued());
    }

    @Test
    void rejectsBadShard() {
        BoundedTaskQueue<BlurTask> queue = new BoundedTaskQueue<>(2);
        assertThrows(IllegalArgumentException.class,
            () -> new DirectoryScanner(tempDir, tempDir, queue, "*", 2, 2));
    }
}
