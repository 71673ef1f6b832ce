package com.lucidchart.pixelcompare;

import java.util.Objects;

/** The two dimensional coordinate of a pixel. */
public final class Position {
    public final int x;
    public final int y;

    private Position(int x, int y) {
        this.x = x;
        this.y = y;
    }

    public static Position apply(int x, int y) {
        return new Position(x, y);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Position)) return false;
        Position position = (Position) o;
        return x == position.x &&
                y == position.y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "(" + x + "," + y + ")";
    }
}
