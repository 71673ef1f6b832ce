package com.lucidchart.pixelcompare;

import java.awt.image.BufferedImage;

/** Exposes a {@link BufferedImage} as a pixel buffer.
 * The image is borrowed, not copied: it must not be modified while a comparison is running.
 */
public final class BufferedImagePixelBuffer implements PixelBuffer {
    private final BufferedImage image;
    private final int width;
    private final int height;

    private BufferedImagePixelBuffer(BufferedImage image) {
        this.image = image;
        this.width = image.getWidth();
        this.height = image.getHeight();
    }

    public static BufferedImagePixelBuffer apply(BufferedImage image) {
        if (image == null) throw new IllegalArgumentException("An image must be provided");
        return new BufferedImagePixelBuffer(image);
    }

    public BufferedImage getImage() {
        return image;
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
        if (x < 0 || x >= width || y < 0 || y >= height) throw new PixelOutOfRangeException(x, y, width, height);
        return image.getRGB(x, y);
    }

    @Override
    public String toString() {
        return "BufferedImagePixelBuffer(w" + width + ",h" + height + ")";
    }
}
