package com.lucidchart.pixelcompare;

/** Wraps a failure raised by a {@link PixelAnalyzer} during a traversal.
 * When several chunks fail, the first failure detected is thrown and the others are attached as suppressed exceptions.
 */
public class PixelAnalyzerException extends RuntimeException {
    private final Position position;
    private final Chunk chunk;

    public PixelAnalyzerException(Position position, Chunk chunk, Throwable cause) {
        super("Pixel analyzer failed at " + position + " in chunk " + chunk + ": " + cause, cause);
        this.position = position;
        this.chunk = chunk;
    }

    /** The pixel being analyzed when the failure occurred */
    public Position getPosition() {
        return position;
    }

    /** The chunk which was abandoned */
    public Chunk getChunk() {
        return chunk;
    }
}
