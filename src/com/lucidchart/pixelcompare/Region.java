package com.lucidchart.pixelcompare;

import java.awt.Point;
import java.awt.Rectangle;

import java.util.Objects;

/** An area of an image, which can be used to limit the comparison to this region, or exclude comparing this region.
 * Regions are immutable, so they can safely be kept in sets.
 */
public class Region {
    public final int x;
    public final int y;
    public final int height;
    public final int width;
    public final RegionAction regionAction;

    private Region(int x, int y, int width, int height, RegionAction regionAction) {
        require(regionAction != null, "A region needs an action");
        require(width >= 0 && height >= 0, "Region dimensions must not be negative");
        this.x = x;
        this.y = y;
        this.height = height;
        this.width = width;
        this.regionAction = regionAction;
    }

    //*** FACTORY METHODS ***

    public static Region apply(Point location, int width, int height, RegionAction regionAction) {
        require(location != null, "A region needs a location");
        return new Region(location.x, location.y, width, height, regionAction);
    }

    public static Region apply(int x, int y, int width, int height, RegionAction regionAction) {
        return new Region(x, y, width, height, regionAction);
    }

    public static Region apply (Rectangle rectangle, RegionAction regionAction) {
        require(rectangle != null, "A region needs a rectangle");
        return new Region(
            rectangle.x,
            rectangle.y,
            rectangle.width,
            rectangle.height,
            regionAction
        );
    }

    /** The top left corner of the region.  A new point is returned on every call. */
    public Point getLocation() {
        return new Point(x, y);
    }

    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Region)) return false;
        Region region = (Region) o;
        return x == region.x &&
                y == region.y &&
                height == region.height &&
                width == region.width &&
                regionAction == region.regionAction;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height, regionAction);
    }

    @Override
    public String toString() {
        return regionAction + "(x" + x + ",y" + y + ",w" + width + ",h" + height + ")";
    }
}
