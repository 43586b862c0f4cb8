package com.ttennebkram.batchblur.config;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.ttennebkram.batchblur.processing.FailurePolicy;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Saves and loads {@link PipelineConfig} as JSON.
 *
 * Example:
 * <pre>
 * {
 *   "inputDirectory": "../input",
 *   "outputDirectory": "../output",
 *   "kernelSize": 5,
 *   "workerCount": 10,
 *   "failurePolicy": "STOP_WORKER"
 * }
 * </pre>
 */
public class PipelineConfigSerializer {

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    /**
     * Save a config to a JSON file.
     */
    public static void save(Path path, PipelineConfig config) throws IOException {
        JsonObject root = toJson(config);
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(root, writer);
        }
    }

    /**
     * Load a config from a JSON file. Keys that are absent keep their defaults.
     *
     * @throws IOException if the file cannot be read or is not a valid config
     */
    public static PipelineConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonElement parsed = JsonParser.parseReader(reader);
            if (!parsed.isJsonObject()) {
                throw new IOException("Config root must be a JSON object: " + path);
            }
            return fromJson(parsed.getAsJsonObject());
        } catch (JsonParseException | IllegalStateException | UnsupportedOperationException | NumberFormatException e) {
            throw new IOException("Invalid config file " + path + ": " + e.getMessage(), e);
        }
    }

    public static JsonObject toJson(PipelineConfig config) {
        JsonObject json = new JsonObject();
        json.addProperty("inputDirectory", config.getInputDirectory());
        json.addProperty("outputDirectory", config.getOutputDirectory());
        json.addProperty("fileGlob", config.getFileGlob());
        json.addProperty("kernelSize", config.getKernelSize());
        json.addProperty("channelCount", config.getChannelCount());
        json.addProperty("queueCapacity", config.getQueueCapacity());
        json.addProperty("workerCount", config.getWorkerCount());
        json.addProperty("producerCount", config.getProducerCount());
        json.addProperty("failurePolicy", config.getFailurePolicy().name());
        return json;
    }

    /**
     * Read a whole-number setting; fractions and out-of-range values are rejected, not truncated.
     */
    private static int getInt(JsonObject json, String key) {
        BigDecimal value = json.get(key).getAsBigDecimal();
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new JsonParseException(key + " must be a whole number, got " + value, e);
        }
    }

    public static PipelineConfig fromJson(JsonObject json) {
        PipelineConfig config = new PipelineConfig();
        if (json.has("inputDirectory")) {
            config.setInputDirectory(json.get("inputDirectory").getAsString());
        }
        if (json.has("outputDirectory")) {
            config.setOutputDirectory(json.get("outputDirectory").getAsString());
        }
        if (json.has("fileGlob")) {
            config.setFileGlob(json.get("fileGlob").getAsString());
        }
        if (json.has("kernelSize")) {
            config.setKernelSize(getInt(json, "kernelSize"));
        }
        if (json.has("channelCount")) {
            config.setChannelCount(getInt(json, "channelCount"));
        }
        if (json.has("queueCapacity")) {
            config.setQueueCapacity(getInt(json, "queueCapacity"));
        }
        if (json.has("workerCount")) {
            config.setWorkerCount(getInt(json, "workerCount"));
        }
        if (json.has("producerCount")) {
            config.setProducerCount(getInt(json, "producerCount"));
        }
        if (json.has("failurePolicy")) {
            String policy = json.get("failurePolicy").getAsString();
            try {
                config.setFailurePolicy(FailurePolicy.valueOf(policy));
            } catch (IllegalArgumentException e) {
                throw new JsonParseException("Unknown failurePolicy: " + policy, e);
            }
        }
        return config;
    }
}
