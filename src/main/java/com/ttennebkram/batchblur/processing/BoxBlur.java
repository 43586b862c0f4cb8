package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.model.Plane;

/**
 * Box blur (averaging) over a single channel.
 *
 * Every interior pixel becomes the mean of the kernelSize x kernelSize
 * neighbourhood centred on it, accumulated in float and truncated to 8 bits.
 * Pixels closer than kernelSize / 2 to any edge are copied from the source
 * unchanged.
 */
public final class BoxBlur {

    private BoxBlur() {
    }

    /**
     * @param source plane to blur (not modified)
     * @param kernelSize positive odd box width/height
     * @return a new blurred plane of the same size
     */
    public static Plane apply(Plane source, int kernelSize) {
        if (kernelSize <= 0 || kernelSize % 2 == 0) {
            throw new IllegalArgumentException("Kernel size must be a positive odd number, got " + kernelSize);
        }

        int height = source.getHeight();
        int width = source.getWidth();
        int pad = kernelSize / 2;
        float area = kernelSize * kernelSize;

        // Start from a copy so the border band is already in place
        Plane result = source.copy();

        for (int row = pad; row < height - pad; row++) {
            for (int col = pad; col < width - pad; col++) {
                float sum = 0;
                for (int kRow = -pad; kRow <= pad; kRow++) {
                    for (int kCol = -pad; kCol <= pad; kCol++) {
                        sum += source.get(row + kRow, col + kCol);
                    }
                }
                result.set(row, col, (int) (sum / area));
            }
        }
        return result;
    }
}
