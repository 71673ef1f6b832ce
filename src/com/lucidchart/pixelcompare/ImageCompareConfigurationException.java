package com.lucidchart.pixelcompare;

/** Thrown before a traversal starts, when the images to compare are missing or do not share the same dimensions */
public class ImageCompareConfigurationException extends IllegalArgumentException {

    public ImageCompareConfigurationException(String message) {
        super(message);
    }

    public ImageCompareConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
