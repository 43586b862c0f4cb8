package com.ttennebkram.batchblur.processing;

import com.ttennebkram.batchblur.model.Image;
import com.ttennebkram.batchblur.model.Plane;

import java.util.ArrayList;
import java.util.List;

/**
 * Box Blur processor.
 * Applies {@link BoxBlur} to each channel plane independently.
 */
public class BoxBlurProcessor implements ImageProcessor {

    public static final int DEFAULT_KERNEL_SIZE = 5;

    private final int kernelSize;

    public BoxBlurProcessor() {
        this(DEFAULT_KERNEL_SIZE);
    }

    public BoxBlurProcessor(int kernelSize) {
        // Kernel size must be a positive odd number
        if (kernelSize <= 0 || kernelSize % 2 == 0) {
            throw new IllegalArgumentException("Kernel size must be a positive odd number, got " + kernelSize);
        }
        this.kernelSize = kernelSize;
    }

    public int getKernelSize() {
        return kernelSize;
    }

    @Override
    public Image process(Image input) {
        List<Plane> blurred = new ArrayList<>(input.getChannelCount());
        for (Plane plane : input.getPlanes()) {
            blurred.add(BoxBlur.apply(plane, kernelSize));
        }
        return new Image(blurred);
    }
}
