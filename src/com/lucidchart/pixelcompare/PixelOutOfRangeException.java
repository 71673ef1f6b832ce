package com.lucidchart.pixelcompare;

/** A pixel was read outside of its buffer. This is a programming error and is never recovered from. */
public class PixelOutOfRangeException extends IndexOutOfBoundsException {

    public PixelOutOfRangeException(int x, int y, int width, int height) {
        super("Pixel (" + x + "," + y + ") is outside of the image bounds (w" + width + ",h" + height + ")");
    }
}
