package com.lucidchart.pixelcompare;

/** A read-only view over a rectangular image.
 * Colors are packed ARGB values, following the {@link java.awt.image.BufferedImage#getRGB(int, int)} convention.
 *
 * Implementations must tolerate concurrent reads, as every chunk of a traversal reads the same buffer.
 */
public interface PixelBuffer {

    /** Width in pixels, always positive */
    int getWidth();

    /** Height in pixels, always positive */
    int getHeight();

    /** Returns the color at (x, y)
     * @throws PixelOutOfRangeException if the coordinate is outside of the buffer
     */
    int colorAt(int x, int y);
}
