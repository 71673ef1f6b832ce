package com.lucidchart.pixelcompare;

/** Simply a flag to add or subtract a region */
public enum RegionAction {
    FOCUS,
    EXCLUDE
}
