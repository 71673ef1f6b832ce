package com.lucidchart.pixelcompare;

/** Receives every pixel of a traversal, along with the colors of both images at that pixel.
 *
 * When the worker ceiling is above 1, the analyzer is called concurrently from several threads and in no particular order
 * across chunks. Any state it accumulates must be thread safe.
 */
@FunctionalInterface
public interface PixelAnalyzer {

    /** Analyzes one pixel.
     *
     * @param baselineColor the ARGB color of the baseline image
     * @param currentColor the ARGB color of the current image
     * @param position the coordinate of the pixel
     * @return true if the pixel matches. The value is informational: the traversal always visits every pixel.
     */
    boolean analyze(int baselineColor, int currentColor, Position position);
}
