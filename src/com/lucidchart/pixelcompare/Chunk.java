package com.lucidchart.pixelcompare;

import java.util.Objects;

/** A contiguous range of linear pixel indices [start, end) traversed by a single worker */
public final class Chunk {
    public final int start;
    public final int end;

    Chunk(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public int size() {
        return end - start;
    }

    public boolean contains(int index) {
        return index >= start && index < end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Chunk)) return false;
        Chunk chunk = (Chunk) o;
        return start == chunk.start &&
                end == chunk.end;
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + "," + end + ")";
    }
}
