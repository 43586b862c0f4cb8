package com.ttennebkram.batchblur.config;

import com.ttennebkram.batchblur.processing.FailurePolicy;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.junit.jupiter.api.Assertions.*;

class PipelineConfigSerializerTest {

    @TempDir
    Path tempDir;

    private static Path resource(String name) throws URISyntaxException {
        return Paths.get(PipelineConfigSerializerTest.class.getResource(name).toURI());
    }

    @Test
    void loadsFixtureAndKeepsDefaultsForMissingKeys() throws Exception {
        PipelineConfig config = PipelineConfigSerializer.load(resource("/config/pipeline.json"));

        assertEquals("images/in", config.getInputDirectory());
        assertEquals("images/out", config.getOutputDirectory());
        assertEquals("*.png", config.getFileGlob());
        assertEquals(7, config.getKernelSize());
        assertEquals(64, config.getQueueCapacity());
        assertEquals(4, config.getWorkerCount());
        assertEquals(FailurePolicy.SKIP_TASK, config.getFailurePolicy());
        // Not in the file
        assertEquals(PipelineConfig.DEFAULT_CHANNEL_COUNT, config.getChannelCount());
        assertEquals(PipelineConfig.DEFAULT_PRODUCER_COUNT, config.getProducerCount());
        config.validate();
    }

    @Test
    void saveThenLoadKeepsEverySetting() throws Exception {
        PipelineConfig config = new PipelineConfig("a", "b");
        config.setKernelSize(9);
        config.setChannelCount(1);
        config.setQueueCapacity(5);
        config.setWorkerCount(2);
        config.setProducerCount(2);
        config.setFileGlob("*.jpg");
        config.setFailurePolicy(FailurePolicy.SKIP_TASK);
        Path file = tempDir.resolve("config.json");

        PipelineConfigSerializer.save(file, config);
        PipelineConfig loaded = PipelineConfigSerializer.load(file);

        assertEquals(config.toString(), loaded.toString());
    }

    @Test
    void malformedFilesAreReportedAsIOException() throws Exception {
        Path notJson = tempDir.resolve("broken.json");
        Files.write(notJson, "{ kernelSize: ".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> PipelineConfigSerializer.load(notJson));

        Path badPolicy = tempDir.resolve("policy.json");
        Files.write(badPolicy, "{\"failurePolicy\": \"RETRY\"}".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> PipelineConfigSerializer.load(badPolicy));

        Path badNumber = tempDir.resolve("number.json");
        Files.write(badNumber, "{\"workerCount\": \"many\"}".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> PipelineConfigSerializer.load(badNumber));

        Path array = tempDir.resolve("array.json");
        Files.write(array, "[1, 2]".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> PipelineConfigSerializer.load(array));
    }

    @Test
    void defaultsMatchTheReferenceSetup() {
        PipelineConfig config = new PipelineConfig();
        assertEquals("../input", config.getInputDirectory());
        assertEquals("../output", config.getOutputDirectory());
        assertEquals(5, config.getKernelSize());
        assertEquals(3, config.getChannelCount());
        assertEquals(1000, config.getQueueCapacity());
        assertEquals(10, config.getWorkerCount());
        assertEquals(FailurePolicy.STOP_WORKER, config.getFailurePolicy());
        config.validate();
    }

    @Test
    void validateRejectsBadSettings() {
        PipelineConfig evenKernel = new PipelineConfig("a", "b");
        evenKernel.setKernelSize(6);
        assertThrows(IllegalArgumentException.class, evenKernel::validate);

        PipelineConfig noWorkers = new PipelineConfig("a", "b");
        noWorkers.setWorkerCount(0);
        assertThrows(IllegalArgumentException.class, noWorkers::validate);

        PipelineConfig noCapacity = new PipelineConfig("a", "b");
        noCapacity.setQueueCapacity(0);
        assertThrows(IllegalArgumentException.class, noCapacity::validate);

        PipelineConfig noInput = new PipelineConfig("", "b");
        assertThrows(IllegalArgumentException.class, noInput::validate);
    }

    @Test
    void validateRejectsMalformedGlob() {
        PipelineConfig config = new PipelineConfig("a", "b");
        config.setFileGlob("*.{png");
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, config::validate);
        assertTrue(e.getMessage().contains("fileGlob"), e.getMessage());

        config.setFileGlob("*.{png,jpg}");
        config.validate();
    }

    @Test
    void fractionalNumbersAreRejectedNotTruncated() throws Exception {
        Path fractional = tempDir.resolve("fractional.json");
        Files.write(fractional, "{\"kernelSize\": 5.5}".getBytes(StandardCharsets.UTF_8));
        IOException e = assertThrows(IOException.class, () -> PipelineConfigSerializer.load(fractional));
        assertTrue(e.getMessage().contains("kernelSize"), e.getMessage());

        Path tooLarge = tempDir.resolve("large.json");
        Files.write(tooLarge, "{\"workerCount\": 3000000000}".getBytes(StandardCharsets.UTF_8));
        assertThrows(IOException.class, () -> PipelineConfigSerializer.load(tooLarge));

        Path wholeAsDecimal = tempDir.resolve("whole.json");
        Files.write(wholeAsDecimal, "{\"kernelSize\": 7.0}".getBytes(StandardCharsets.UTF_8));
        assertEquals(7, PipelineConfigSerializer.load(wholeAsDecimal).getKernelSize());
    }
}
