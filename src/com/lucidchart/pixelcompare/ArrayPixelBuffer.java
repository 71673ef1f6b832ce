package com.lucidchart.pixelcompare;

import java.util.Arrays;

/** A pixel buffer backed by a row-major array of ARGB colors.
 * The array is copied on construction, so later changes by the caller are not visible.
 */
public final class ArrayPixelBuffer implements PixelBuffer {
    private final int width;
    private final int height;
    private final int[] pixels;

    private ArrayPixelBuffer(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    //*** FACTORY METHODS ***

    /** Wraps a copy of the given row-major pixels, where the color of (x, y) is at {@code y * width + x} */
    public static ArrayPixelBuffer of(int width, int height, int[] pixels) {
        requireDimensions(width, height);
        require(pixels != null, "Pixels must be provided");
        require((long) width * height == pixels.length, "Expected " + ((long) width * height) + " pixels for (w" + width + ",h" + height + ") but got " + pixels.length);
        return new ArrayPixelBuffer(width, height, pixels.clone());
    }

    /** An image of a single color */
    public static ArrayPixelBuffer filled(int width, int height, int color) {
        requireDimensions(width, height);
        require((long) width * height <= Integer.MAX_VALUE, "Image (w" + width + ",h" + height + ") is too large");
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, color);
        return new ArrayPixelBuffer(width, height, pixels);
    }

    /** Returns a copy of this buffer with a single pixel changed */
    public ArrayPixelBuffer withColorAt(int x, int y, int color) {
        int[] copy = pixels.clone();
        copy[indexOf(x, y)] = color;
        return new ArrayPixelBuffer(width, height, copy);
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    @Override
    public int colorAt(int x, int y) {
        return pixels[indexOf(x, y)];
    }

    /** Returns a row-major copy of every pixel */
    public int[] toArray() {
        return pixels.clone();
    }

    private int indexOf(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) throw new PixelOutOfRangeException(x, y, width, height);
        return y * width + x;
    }

    private static void requireDimensions(int width, int height) {
        require(width > 0 && height > 0, "Image dimensions must be positive, but were (w" + width + ",h" + height + ")");
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }

    @Override
    public String toString() {
        return "ArrayPixelBuffer(w" + width + ",h" + height + ")";
    }
}
