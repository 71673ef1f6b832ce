package com.lucidchart.pixelcompare;

import java.util.ArrayList;
import java.util.List;

/** Splits the linear pixel indices of an image into contiguous chunks, and maps linear indices back to coordinates.
 *
 * Pixels are laid out in row-major order: {@code index = y * width + x}.
 */
public final class ChunkPlanner {

    private ChunkPlanner() {}

    /** Divides {@code totalPixels} into nearly equal contiguous chunks.
     * The worker count is clamped to [1, totalPixels]: there are never more chunks than pixels.
     * Every chunk gets {@code totalPixels / workers} indices, and the first {@code totalPixels % workers} chunks get one more.
     *
     * @param totalPixels the number of pixels in the image, at least 1
     * @param workerCount the desired number of chunks
     */
    public static ChunkPlan plan(int totalPixels, int workerCount) {
        require(totalPixels >= 1, "An image must contain at least one pixel, but had " + totalPixels);
        int workers = Math.max(1, Math.min(workerCount, totalPixels));

        int baseSize = totalPixels / workers;
        int remainder = totalPixels % workers;

        List<Chunk> chunks = new ArrayList<>(workers);
        int start = 0;
        for (int i = 0; i < workers; i++) {
            int end = start + baseSize + (i < remainder ? 1 : 0);
            chunks.add(new Chunk(start, end));
            start = end;
        }
        return new ChunkPlan(totalPixels, chunks);
    }

    /** Converts a row-major linear index into its (x, y) coordinate.
     * The result does not depend on how the image was chunked.
     */
    public static Position positionOf(int linearIndex, int width) {
        require(width > 0, "Width must be positive, but was " + width);
        require(linearIndex >= 0, "Linear index must not be negative, but was " + linearIndex);
        return Position.apply(linearIndex % width, linearIndex / width);
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
