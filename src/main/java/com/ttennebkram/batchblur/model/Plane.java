package com.ttennebkram.batchblur.model;

import java.util.Arrays;

/**
 * One channel of an image: a height x width grid of unsigned 8-bit samples,
 * stored row-major.
 */
public final class Plane {

    private final int height;
    private final int width;
    private final byte[] samples;

    public Plane(int height, int width) {
        this(height, width, new byte[checkedArea(height, width)]);
    }

    private Plane(int height, int width, byte[] samples) {
        this.height = height;
        this.width = width;
        this.samples = samples;
    }

    /**
     * Wrap a copy of row-major samples.
     */
    public static Plane of(int height, int width, byte[] samples) {
        int area = checkedArea(height, width);
        if (samples.length != area) {
            throw new IllegalArgumentException("Expected " + area + " samples, got " + samples.length);
        }
        return new Plane(height, width, samples.clone());
    }

    /**
     * A plane where every sample has the same value.
     */
    public static Plane filled(int height, int width, int value) {
        Plane plane = new Plane(height, width);
        Arrays.fill(plane.samples, toByte(value));
        return plane;
    }

    private static int checkedArea(int height, int width) {
        if (height < 0 || width < 0) {
            throw new IllegalArgumentException("Invalid plane size " + height + "x" + width);
        }
        return Math.multiplyExact(height, width);
    }

    private static byte toByte(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Sample out of range: " + value);
        }
        return (byte) value;
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    /**
     * @return sample at (row, col) in [0, 255]
     */
    public int get(int row, int col) {
        return samples[index(row, col)] & 0xFF;
    }

    public void set(int row, int col, int value) {
        samples[index(row, col)] = toByte(value);
    }

    public Plane copy() {
        return new Plane(height, width, samples.clone());
    }

    private int index(int row, int col) {
        if (row < 0 || row >= height || col < 0 || col >= width) {
            throw new IndexOutOfBoundsException("(" + row + ", " + col + ") outside " + height + "x" + width);
        }
        return row * width + col;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Plane)) return false;
        Plane other = (Plane) o;
        return height == other.height && width == other.width && Arrays.equals(samples, other.samples);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * height + width) + Arrays.hashCode(samples);
    }

    @Override
    public String toString() {
        return "Plane[" + height + "x" + width + "]";
    }
}
