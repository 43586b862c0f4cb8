package com.ttennebkram.batchblur.codec;

/**
 * Raw interleaved raster exchanged with an {@link ImageCodec}.
 * Layout is row-major, interleaved by channel: {@code samples[(y * width + x) * channels + c]}.
 */
public final class DecodedImage {

    public final int width;
    public final int height;
    public final int channels;
    public final byte[] samples;

    public DecodedImage(int width, int height, int channels, byte[] samples) {
        if (width < 0 || height < 0 || channels <= 0) {
            throw new IllegalArgumentException(
                "Invalid raster " + width + "x" + height + "x" + channels);
        }
        long expected = (long) width * height * channels;
        if (samples == null || samples.length != expected) {
            throw new IllegalArgumentException("Expected " + expected + " samples, got "
                + (samples == null ? "null" : samples.length));
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.samples = samples;
    }
}
