package com.ttennebkram.batchblur.model;

import com.ttennebkram.batchblur.codec.DecodedImage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Planar image: one {@link Plane} per channel, all with the same dimensions.
 */
public final class Image {

    private final List<Plane> planes;

    public Image(List<Plane> planes) {
        if (planes == null || planes.isEmpty()) {
            throw new IllegalArgumentException("An image needs at least one plane");
        }
        Plane first = planes.get(0);
        for (int c = 1; c < planes.size(); c++) {
            Plane p = planes.get(c);
            if (p.getHeight() != first.getHeight() || p.getWidth() != first.getWidth()) {
                throw new IllegalArgumentException("Channel " + c + " is " + p.getHeight() + "x" + p.getWidth()
                    + ", expected " + first.getHeight() + "x" + first.getWidth());
            }
        }
        this.planes = Collections.unmodifiableList(new ArrayList<>(planes));
    }

    /**
     * Split an interleaved raster into planes.
     */
    public static Image fromDecoded(DecodedImage raster) {
        int width = raster.width;
        int height = raster.height;
        int channels = raster.channels;

        List<Plane> planes = new ArrayList<>(channels);
        byte[][] planeSamples = new byte[channels][width * height];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int pixel = y * width + x;
                for (int c = 0; c < channels; c++) {
                    planeSamples[c][pixel] = raster.samples[pixel * channels + c];
                }
            }
        }
        for (int c = 0; c < channels; c++) {
            planes.add(Plane.of(height, width, planeSamples[c]));
        }
        return new Image(planes);
    }

    /**
     * Interleave the planes back into a raster.
     */
    public DecodedImage toDecoded() {
        int width = getWidth();
        int height = getHeight();
        int channels = getChannelCount();

        byte[] samples = new byte[width * height * channels];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                for (int c = 0; c < channels; c++) {
                    samples[(y * width + x) * channels + c] = (byte) planes.get(c).get(y, x);
                }
            }
        }
        return new DecodedImage(width, height, channels, samples);
    }

    public int getChannelCount() {
        return planes.size();
    }

    public int getHeight() {
        return planes.get(0).getHeight();
    }

    public int getWidth() {
        return planes.get(0).getWidth();
    }

    public Plane getPlane(int channel) {
        return planes.get(channel);
    }

    public List<Plane> getPlanes() {
        return planes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Image)) return false;
        return planes.equals(((Image) o).planes);
    }

    @Override
    public int hashCode() {
        return planes.hashCode();
    }

    @Override
    public String toString() {
        return "Image[" + getHeight() + "x" + getWidth() + "x" + getChannelCount() + "]";
    }
}
