package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.model.Image;

/**
 * Interface for pure image operations.
 * No I/O - just takes an Image and returns a processed Image.
 */
@FunctionalInterface
public interface ImageProcessor {
    /**
     * Process an input image and return the result.
     *
     * @param input The input image (not modified)
     * @return A new image with the same dimensions and channel count
     */
    Image process(Image input);
}
