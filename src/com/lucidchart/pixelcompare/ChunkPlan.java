package com.lucidchart.pixelcompare;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** The ordered set of chunks covering every linear pixel index of an image exactly once.
 * Chunks are sorted by their start, contiguous, and together span [0, totalPixels).
 */
public final class ChunkPlan {
    private final int totalPixels;
    private final List<Chunk> chunks;

    ChunkPlan(int totalPixels, List<Chunk> chunks) {
        require(!chunks.isEmpty(), "A plan needs at least one chunk");
        int expectedStart = 0;
        for (Chunk chunk : chunks) {
            require(chunk.start == expectedStart && chunk.end > chunk.start, "Chunk " + chunk + " does not continue the plan at " + expectedStart);
            expectedStart = chunk.end;
        }
        require(expectedStart == totalPixels, "Chunks end at " + expectedStart + " but the image has " + totalPixels + " pixels");
        this.totalPixels = totalPixels;
        this.chunks = Collections.unmodifiableList(new ArrayList<>(chunks));
    }

    public int getTotalPixels() {
        return totalPixels;
    }

    public List<Chunk> getChunks() {
        return chunks;
    }

    public int size() {
        return chunks.size();
    }

    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalStateException(message);
    }

    @Override
    public String toString() {
        return "ChunkPlan(pixels=" + totalPixels + ", chunks=" + chunks + ")";
    }
}
