package com.lucidchart.pixelcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.DoubleAccumulator;
import java.util.concurrent.atomic.LongAdder;

/** A utility to compare the equality of two images pixel by pixel, with the ability to adjust the definition of equality.
 * This will allow some minor differences in pixels to exist without failing the equality test.
 *
 * Every pixel of the baseline is compared to the pixel at the same position in the current image, using the RGB color distance.
 * A pixel further away than the max color distance is a mismatch, and the images match as long as the share of mismatched
 * pixels stays within the max mismatch ratio.  Regions may be used to focus the comparison or exclude parts of the images.
 *
 * The pixels are traversed in parallel by a {@link ParallelPixelProcessor}.
 */
public class PixelCompare {
    private static final Logger log = LoggerFactory.getLogger(PixelCompare.class);

    public final PixelBuffer originalBaseline; // The trusted image
    public final PixelBuffer originalCurrent; // The freshly captured image to compare to the baseline

    /** Record of initial input, used to tell a missing image from a comparison failure */
    public final boolean baselineProvided;
    public final boolean currentProvided;

    private final boolean sameSize;
    private final double maxColorDistance;
    private final double maxMismatchRatio;
    private final Set<Region> maskComponents;

    private final long comparedPixels;
    private final long maskedPixels;
    private final long mismatchCount;
    private final long differencesWithinTolerance;
    private final double largestColorDistance;
    private final Set<Position> mismatchedPositions;
    private final Rectangle mismatchBounds;

    private final boolean match;
    private final Status status;

    private PixelCompare(PixelBuffer baseline, PixelBuffer current, With context) {
        require(baseline != null || current != null, "At least one image must be provided");
        require(context != null, "A context must be provided");

        this.baselineProvided = (baseline != null);
        this.currentProvided = (current != null);
        this.originalBaseline = baseline;
        this.originalCurrent = current;
        this.sameSize = baselineProvided && currentProvided && baseline.getWidth() == current.getWidth() && baseline.getHeight() == current.getHeight();
        this.maxColorDistance = context.getMaxColorDistance();
        this.maxMismatchRatio = context.getMaxMismatchRatio();
        this.maskComponents = Collections.unmodifiableSet(new HashSet<>(context.getMask()));

        if (sameSize) {
            int width = baseline.getWidth();
            int height = baseline.getHeight();
            boolean[] mask = composeMask(width, height, maskComponents);
            double tolerance = maxColorDistance;

            // Shared by every chunk worker
            LongAdder compared = new LongAdder();
            LongAdder mismatched = new LongAdder();
            LongAdder tolerated = new LongAdder();
            DoubleAccumulator largest = new DoubleAccumulator(Math::max, 0.0);
            Set<Position> recorded = ConcurrentHashMap.newKeySet();
            AtomicInteger recordSlots = new AtomicInteger(context.getMaxRecordedDifferences());
            AtomicInteger minX = new AtomicInteger(Integer.MAX_VALUE);
            AtomicInteger minY = new AtomicInteger(Integer.MAX_VALUE);
            AtomicInteger maxX = new AtomicInteger(Integer.MIN_VALUE);
            AtomicInteger maxY = new AtomicInteger(Integer.MIN_VALUE);

            try (ParallelPixelProcessor processor = ParallelPixelProcessor.create(context).withBaseline(baseline).withCurrent(current)) {
                context.getExecutor().ifPresent(processor::executor);
                processor.analyze((baselineColor, currentColor, position) -> {
                    if (mask != null && mask[position.y * width + position.x]) return true;
                    compared.increment();

                    double colorDistance = distance(baselineColor, currentColor);
                    if (colorDistance == 0) return true;
                    largest.accumulate(colorDistance);
                    if (colorDistance <= tolerance) {
                        tolerated.increment();
                        return true;
                    }

                    mismatched.increment();
                    if (recordSlots.getAndDecrement() > 0) recorded.add(position);
                    minX.accumulateAndGet(position.x, Math::min);
                    minY.accumulateAndGet(position.y, Math::min);
                    maxX.accumulateAndGet(position.x, Math::max);
                    maxY.accumulateAndGet(position.y, Math::max);
                    return false;
                });
            }

            this.comparedPixels = compared.sum();
            this.maskedPixels = (long) width * height - comparedPixels;
            this.mismatchCount = mismatched.sum();
            this.differencesWithinTolerance = tolerated.sum();
            this.largestColorDistance = largest.get();
            this.mismatchedPositions = Collections.unmodifiableSet(new HashSet<>(recorded));
            this.mismatchBounds = mismatchCount == 0 ? null :
                    new Rectangle(minX.get(), minY.get(), maxX.get() - minX.get() + 1, maxY.get() - minY.get() + 1);
            this.match = mismatchCount <= allowedMismatches(comparedPixels, maxMismatchRatio);

        // Nothing to compare pixel by pixel
        } else {
            this.comparedPixels = 0;
            this.maskedPixels = 0;
            this.mismatchCount = 0;
            this.differencesWithinTolerance = 0;
            this.largestColorDistance = 0.0;
            this.mismatchedPositions = Collections.emptySet();
            this.mismatchBounds = null;
            this.match = false;
        }

        // Assign final status
        status = (match) ? Status.PASSED :
                    (baselineProvided && currentProvided && !sameSize) ? Status.DIFFERENT_SIZE :
                            (baselineProvided && !currentProvided) ? Status.MISSING :
                                    (!baselineProvided && currentProvided) ? Status.NEEDS_APPROVAL :
                                            Status.FAILED;

        log.debug("Compared {} pixels ({} masked): {} mismatched, {} within tolerance, status {}",
                comparedPixels, maskedPixels, mismatchCount, differencesWithinTolerance, status);
    }



    //*** FACTORY METHODS ***

    /** Compare two images using the STRICT match level */
    public static PixelCompare apply(PixelBuffer baseline, PixelBuffer current) {
        return new PixelCompare(baseline, current, With.context());
    }

    /** Compare two images using the matchLevel specifications */
    public static PixelCompare apply(PixelBuffer baseline, PixelBuffer current, MatchLevel matchLevel) {
        require(matchLevel != null, "A match level must be supplied");
        return new PixelCompare(baseline, current, With.context().matchLevel(matchLevel));
    }

    /** Compare two images with a custom context */
    public static PixelCompare apply(PixelBuffer baseline, PixelBuffer current, With context) {
        return new PixelCompare(baseline, current, context);
    }

    public static PixelCompare apply(BufferedImage baseline, BufferedImage current) {
        return apply(wrap(baseline), wrap(current));
    }

    public static PixelCompare apply(BufferedImage baseline, BufferedImage current, MatchLevel matchLevel) {
        return apply(wrap(baseline), wrap(current), matchLevel);
    }

    public static PixelCompare apply(BufferedImage baseline, BufferedImage current, With context) {
        return apply(wrap(baseline), wrap(current), context);
    }



    //*** PUBLIC UTILITIES ***

    /** True if the current image matches the baseline, based on color distance, mismatch ratio, image size, and mask */
    public boolean isMatch() {
        return match;
    }

    /** Obtain status of the comparison */
    public Status getStatus() {
        return status;
    }

    /** True if both images were provided with the same pixel dimensions */
    public boolean isSameSize() {
        return sameSize;
    }

    /** Number of pixels compared, which excludes masked pixels */
    public long getComparedPixels() {
        return comparedPixels;
    }

    /** Number of pixels skipped by the mask */
    public long getMaskedPixels() {
        return maskedPixels;
    }

    /** Number of pixels whose color distance exceeds the max color distance */
    public long getMismatchCount() {
        return mismatchCount;
    }

    /** Number of pixels which differ, but within the max color distance */
    public long getDifferencesWithinTolerance() {
        return differencesWithinTolerance;
    }

    /** The largest color distance between any two compared pixels */
    public double getLargestColorDistance() {
        return largestColorDistance;
    }

    /** Mismatched positions, up to the max recorded differences of the context.
     * Which positions are kept when there are more mismatches than that is not defined. */
    public Set<Position> getMismatchedPositions() {
        return mismatchedPositions;
    }

    /** The smallest rectangle containing every mismatched pixel, if there is any */
    public Optional<Rectangle> getMismatchBounds() {
        return Optional.ofNullable(mismatchBounds);
    }



    //*** INTERNAL UTILITIES ***

    /** The number of mismatches tolerated for the number of pixels compared */
    static long allowedMismatches(long comparedPixels, double maxMismatchRatio) {
        // Decimal arithmetic, so ratios like 0.29 of 100 allow 29 rather than 28
        return BigDecimal.valueOf(maxMismatchRatio)
                .multiply(BigDecimal.valueOf(comparedPixels))
                .setScale(0, RoundingMode.FLOOR)
                .longValue();
    }

    /** The euclidean distance between two colors in RGB space.  Alpha is ignored. */
    static double distance(int rgb1, int rgb2) {
        if ((rgb1 & 0x00FFFFFF) == (rgb2 & 0x00FFFFFF)) return 0.0;
        int red = getRed(rgb1) - getRed(rgb2);
        int green = getGreen(rgb1) - getGreen(rgb2);
        int blue = getBlue(rgb1) - getBlue(rgb2);
        return Math.sqrt(red * red + green * green + blue * blue);
    }

    /** An efficient way of extracting red from the rgb int value obtained from getRGB() */
    private static int getRed(int rgb) {
        return (rgb >> 16) & 0x000000FF;
    }

    /** An efficient way of extracting green from the rgb int value obtained from getRGB() */
    private static int getGreen(int rgb) {
        return (rgb >> 8) & 0x000000FF;
    }

    /** An efficient way of extracting blue from the rgb int value obtained from getRGB() */
    private static int getBlue(int rgb) {
        return (rgb) & 0x000000FF;
    }

    /**
     * Composes the MASK: the pixels of the image which we want to disregard.
     *
     * @param maskComponents focus regions restrict the comparison to their union; exclude regions are subtracted afterwards.
     * @return a row-major pixel map indexed by {@code y * imageWidth + x}, true where the pixel is ignored,
     *         or null when there are no mask components
     */
    static boolean[] composeMask(int imageWidth, int imageHeight, Set<Region> maskComponents) {
        if (maskComponents == null || maskComponents.isEmpty()) return null;
        boolean[] mask = new boolean[Math.multiplyExact(imageWidth, imageHeight)];

        // Divide mask
        Set<Region> include = new HashSet<>();
        Set<Region> exclude = new HashSet<>();
        for (Region region : maskComponents)
            if (region.regionAction == RegionAction.FOCUS) include.add(region);
            else exclude.add(region);

        // If there are inclusive elements, we want to START with the entire image as the mask, then subtract the areas we want to look at.
        if (!include.isEmpty()) {
            Arrays.fill(mask, true);
            for (Region includeRegion : include) updatePixelMap(mask, imageWidth, imageHeight, includeRegion);
        }
        // Exclusive regions are subtracted AFTER all the included regions are considered
        for (Region excludeRegion : exclude) updatePixelMap(mask, imageWidth, imageHeight, excludeRegion);
        return mask;
    }

    /** Adds or subtracts a mask component, clipped to the image */
    private static void updatePixelMap(boolean[] mask, int imageWidth, int imageHeight, Region maskComponent) {
        int fromX = Math.max(0, maskComponent.x);
        int fromY = Math.max(0, maskComponent.y);
        int toX = (int) Math.min(imageWidth, (long) maskComponent.x + maskComponent.width);
        int toY = (int) Math.min(imageHeight, (long) maskComponent.y + maskComponent.height);
        boolean ignored = maskComponent.regionAction == RegionAction.EXCLUDE;
        for (int y = fromY; y < toY; y++)
            if (fromX < toX) Arrays.fill(mask, y * imageWidth + fromX, y * imageWidth + toX, ignored);
    }

    private static PixelBuffer wrap(BufferedImage image) {
        return image == null ? null : BufferedImagePixelBuffer.apply(image);
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }

    @Override
    public String toString() {
        return "Pixel Comparison: " +
                "\n\nStatus = " + status.colored() +
                "\nBaseline Size = " + (baselineProvided ? "(w" + originalBaseline.getWidth() + ",h" + originalBaseline.getHeight() + ")" : "missing") +
                "\nCurrent Size = " + (currentProvided ? "(w" + originalCurrent.getWidth() + ",h" + originalCurrent.getHeight() + ")" : "missing") +
                "\nMask = " + maskComponents +
                "\nMax Color Distance = " + maxColorDistance +
                "\nMax Mismatch Ratio = " + maxMismatchRatio +
                "\nCompared Pixels = " + comparedPixels +
                "\nMasked Pixels = " + maskedPixels +
                "\nMismatched Pixels = " + mismatchCount +
                "\nDifferences Within Tolerance = " + differencesWithinTolerance +
                "\nLargest Color Diff = " + largestColorDistance +
                (mismatchBounds != null ? "\nMismatch Bounds = " + mismatchBounds : "") +
                "\nMatch = " + match;
    }
}
