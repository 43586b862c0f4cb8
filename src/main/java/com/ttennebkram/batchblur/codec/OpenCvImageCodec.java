package com.ttennebkram.batchblur.codec;

import org.opencv.core.CvException;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * {@link ImageCodec} backed by OpenCV's Imgcodecs.
 *
 * Samples keep OpenCV's channel order (BGR for color images). Blurring treats
 * channels independently, so the order survives a decode/encode round trip
 * untouched. The output format follows the file extension of the target path.
 */
public class OpenCvImageCodec implements ImageCodec {

    private static final Logger logger = LoggerFactory.getLogger(OpenCvImageCodec.class);

    private static volatile boolean nativeLoaded = false;

    /**
     * Load the OpenCV native library bundled with the openpnp artifact.
     * Safe to call more than once.
     */
    public static synchronized void loadNativeLibrary() {
        if (nativeLoaded) {
            return;
        }
        nu.pattern.OpenCV.loadLocally();
        nativeLoaded = true;
        logger.debug("OpenCV native library loaded");
    }

    /**
     * Try to load the native library.
     *
     * @return false if the platform has no usable OpenCV binary
     */
    public static boolean isNativeLibraryAvailable() {
        try {
            loadNativeLibrary();
            return true;
        } catch (LinkageError | RuntimeException e) {
            logger.warn("OpenCV native library unavailable: {}", e.toString());
            return false;
        }
    }

    @Override
    public DecodedImage decode(Path path, int channelCount) throws ImageCodecException {
        Mat mat = Imgcodecs.imread(path.toString(), readFlagFor(channelCount));
        try {
            if (mat.empty()) {
                throw new ImageCodecException("Failed to load image " + path);
            }
            if (mat.depth() != CvType.CV_8U) {
                throw new ImageCodecException("Unsupported sample depth in " + path
                    + " (" + CvType.typeToString(mat.type()) + ")");
            }
            if (mat.channels() != channelCount) {
                throw new ImageCodecException("Expected " + channelCount + " channels in " + path
                    + ", found " + mat.channels());
            }

            int width = mat.cols();
            int height = mat.rows();
            byte[] samples = new byte[width * height * channelCount];
            Mat continuous = mat.isContinuous() ? mat : mat.clone();
            try {
                continuous.get(0, 0, samples);
            } finally {
                if (continuous != mat) {
                    continuous.release();
                }
            }
            return new DecodedImage(width, height, channelCount, samples);
        } finally {
            mat.release();
        }
    }

    @Override
    public void encode(Path path, DecodedImage image) throws ImageCodecException {
        if (image.width == 0 || image.height == 0) {
            throw new ImageCodecException("Cannot write empty image to " + path);
        }
        Mat mat = new Mat(image.height, image.width, CvType.CV_8UC(image.channels));
        try {
            mat.put(0, 0, image.samples);
            boolean written;
            try {
                written = Imgcodecs.imwrite(path.toString(), mat);
            } catch (CvException e) {
                throw new ImageCodecException("Failed to write image " + path, e);
            }
            if (!written) {
                throw new ImageCodecException("Failed to write image " + path);
            }
        } finally {
            mat.release();
        }
    }

    private static int readFlagFor(int channelCount) {
        switch (channelCount) {
            case 1: return Imgcodecs.IMREAD_GRAYSCALE;
            case 3: return Imgcodecs.IMREAD_COLOR;
            default: return Imgcodecs.IMREAD_UNCHANGED;
        }
    }
}
