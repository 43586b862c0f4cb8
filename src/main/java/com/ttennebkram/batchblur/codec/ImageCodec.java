package com.ttennebkram.batchblur.codec;

import java.nio.file.Path;

/**
 * Reads and writes image files as interleaved 8-bit rasters.
 * Implementations must be safe to call from several worker threads at once.
 */
public interface ImageCodec {

    /**
     * Decode an image file.
     *
     * @param path file to read
     * @param channelCount number of channels the caller expects
     * @return the decoded raster, with exactly {@code channelCount} channels
     * @throws ImageCodecException if the file is missing, unreadable, or has the wrong layout
     */
    DecodedImage decode(Path path, int channelCount) throws ImageCodecException;

    /**
     * Encode a raster to a file. The output format is chosen by the implementation.
     *
     * @throws ImageCodecException if the file cannot be written
     */
    void encode(Path path, DecodedImage image) throws ImageCodecException;
}
