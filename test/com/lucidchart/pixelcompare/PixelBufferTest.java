package com.lucidchart.pixelcompare;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.awt.image.BufferedImage;

public class PixelBufferTest {

    @Test
    public void testArrayBufferIsRowMajor() {
        ArrayPixelBuffer buffer = ArrayPixelBuffer.of(3, 2, new int[] {0, 1, 2, 3, 4, 5});
        Assert.assertEquals(buffer.getWidth(), 3);
        Assert.assertEquals(buffer.getHeight(), 2);
        Assert.assertEquals(buffer.colorAt(0, 0), 0);
        Assert.assertEquals(buffer.colorAt(2, 0), 2);
        Assert.assertEquals(buffer.colorAt(0, 1), 3);
        Assert.assertEquals(buffer.colorAt(2, 1), 5);
    }

    @Test
    public void testArrayBufferCopiesItsInput() {
        int[] pixels = {7, 7, 7, 7};
        ArrayPixelBuffer buffer = ArrayPixelBuffer.of(2, 2, pixels);
        pixels[0] = 8;
        Assert.assertEquals(buffer.colorAt(0, 0), 7);

        int[] copy = buffer.toArray();
        copy[1] = 9;
        Assert.assertEquals(buffer.colorAt(1, 0), 7);
    }

    @Test
    public void testWithColorAtLeavesTheOriginalUnchanged() {
        ArrayPixelBuffer original = ArrayPixelBuffer.filled(2, 2, 1);
        ArrayPixelBuffer changed = original.withColorAt(1, 1, 2);
        Assert.assertEquals(original.colorAt(1, 1), 1);
        Assert.assertEquals(changed.colorAt(1, 1), 2);
        Assert.assertEquals(changed.colorAt(0, 0), 1);
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testArrayBufferRejectsWrongLength() {
        ArrayPixelBuffer.of(3, 3, new int[8]);
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testArrayBufferRejectsEmptyImage() {
        ArrayPixelBuffer.filled(0, 3, 0);
    }

    @Test
    public void testArrayBufferOutOfRange() {
        ArrayPixelBuffer buffer = ArrayPixelBuffer.filled(3, 2, 0);
        Assert.expectThrows(PixelOutOfRangeException.class, () -> buffer.colorAt(3, 0));
        Assert.expectThrows(PixelOutOfRangeException.class, () -> buffer.colorAt(0, 2));
        Assert.expectThrows(PixelOutOfRangeException.class, () -> buffer.colorAt(-1, 0));
        Assert.expectThrows(IndexOutOfBoundsException.class, () -> buffer.colorAt(0, -1));
    }

    @Test
    public void testBufferedImageAdapter() {
        BufferedImage image = new BufferedImage(4, 3, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(3, 2, 0xff123456);
        BufferedImagePixelBuffer buffer = BufferedImagePixelBuffer.apply(image);
        Assert.assertEquals(buffer.getWidth(), 4);
        Assert.assertEquals(buffer.getHeight(), 3);
        Assert.assertEquals(buffer.colorAt(3, 2), 0xff123456);
        Assert.assertSame(buffer.getImage(), image);
        Assert.expectThrows(PixelOutOfRangeException.class, () -> buffer.colorAt(4, 0));
    }

    @Test (expectedExceptions = IllegalArgumentException.class)
    public void testBufferedImageIsRequired() {
        BufferedImagePixelBuffer.apply(null);
    }
}
