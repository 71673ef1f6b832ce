package com.lucidchart.pixelcompare;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/** Visits every pixel of two same-sized images in parallel.
 *
 * The pixels are split into contiguous chunks by the {@link ChunkPlanner}, one chunk per worker, and each chunk is traversed
 * on its own task. Inside a chunk pixels are visited in increasing linear index order. There is no ordering between chunks.
 * {@link #analyze(PixelAnalyzer)} returns only once every chunk is done.
 *
 * <pre>
 * try (ParallelPixelProcessor processor = ParallelPixelProcessor.create().withBaseline(baseline).withCurrent(current)) {
 *     processor.analyze((baselineColor, currentColor, position) -&gt; baselineColor == currentColor);
 * }
 * </pre>
 *
 * The worker pool is created on the first traversal and reused by later ones. Closing the processor releases it.
 * A processor is meant to be configured and used from a single thread.
 */
public class ParallelPixelProcessor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ParallelPixelProcessor.class);

    private PixelBuffer baseline;
    private PixelBuffer current;
    private int workers;

    /** Supplied by the caller, and never shut down by the processor */
    private Executor executor;

    /** Owned pool, sized to the worker ceiling */
    private ExecutorService pool;
    private int poolSize;
    private volatile boolean closed;

    private ParallelPixelProcessor(int workers) {
        this.workers = workers;
    }

    //*** FACTORY METHODS ***

    /** A processor using as many workers as there are available processors */
    public static ParallelPixelProcessor create() {
        return new ParallelPixelProcessor(defaultWorkers());
    }

    /** A processor using the worker ceiling of the given context */
    public static ParallelPixelProcessor create(With context) {
        require(context != null, "A context must be provided");
        return new ParallelPixelProcessor(context.getWorkers());
    }

    /** The default worker ceiling: the number of available processors */
    public static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }

    /** The trusted image */
    public ParallelPixelProcessor withBaseline(PixelBuffer baseline) {
        this.baseline = baseline;
        return this;
    }

    /** The freshly captured image */
    public ParallelPixelProcessor withCurrent(PixelBuffer current) {
        this.current = current;
        return this;
    }

    /** Maximum number of chunks traversed concurrently. A value of 1 traverses the whole image in order. */
    public ParallelPixelProcessor workers(int workers) {
        require(workers >= 1, "Worker count must be at least 1, but was " + workers);
        this.workers = workers;
        return this;
    }

    /** Runs chunks on the given executor instead of the processor's own pool.
     * {@code Runnable::run} runs every chunk on the calling thread, one after the other.
     */
    public ParallelPixelProcessor executor(Executor executor) {
        require(executor != null, "An executor must be provided");
        this.executor = executor;
        return this;
    }

    public int getWorkers() {
        return workers;
    }

    /** Passes every pixel of the baseline and current images to the analyzer, exactly once.
     *
     * A failure in one chunk stops that chunk only. Once every chunk has finished, the first failure detected is thrown,
     * with any later ones attached as suppressed exceptions. Exceptions thrown by the analyzer are wrapped in a
     * {@link PixelAnalyzerException}; errors are rethrown as they are.
     *
     * @throws ImageCompareConfigurationException if either image is missing, or the images differ in size
     */
    public void analyze(PixelAnalyzer analyzer) {
        if (closed) throw new IllegalStateException("The pixel processor has been closed");
        if (analyzer == null) throw new ImageCompareConfigurationException("A pixel analyzer must be provided");
        if (baseline == null || current == null)
            throw new ImageCompareConfigurationException("Both a baseline and a current image are required" +
                    " (baseline " + (baseline == null ? "missing" : "attached") + ", current " + (current == null ? "missing" : "attached") + ")");
        if (baseline.getWidth() != current.getWidth() || baseline.getHeight() != current.getHeight())
            throw new ImageCompareConfigurationException("Images must be the same size: baseline is (w" + baseline.getWidth() + ",h" + baseline.getHeight() +
                    ") but current is (w" + current.getWidth() + ",h" + current.getHeight() + ")");

        // Effectively final copies for the chunk tasks
        PixelBuffer baselineBuffer = baseline;
        PixelBuffer currentBuffer = current;
        int width = baselineBuffer.getWidth();
        int totalPixels = totalPixels(width, baselineBuffer.getHeight());

        ChunkPlan plan = ChunkPlanner.plan(totalPixels, workers);
        log.debug("Analyzing {} pixels with {} chunks (worker ceiling {})", totalPixels, plan.size(), workers);

        Executor workerExecutor = workerExecutor();
        Queue<Throwable> failures = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>(plan.size());
        try {
            for (Chunk chunk : plan.getChunks())
                futures.add(CompletableFuture.runAsync(() -> traverse(chunk, width, baselineBuffer, currentBuffer, analyzer, failures), workerExecutor));
        } catch (RejectedExecutionException e) {
            // Chunks already dispatched must not outlive this call
            awaitAll(futures);
            IllegalStateException rejected = new IllegalStateException("The executor rejected a chunk of the traversal", e);
            for (Throwable failure = failures.poll(); failure != null; failure = failures.poll())
                rejected.addSuppressed(failure);
            throw rejected;
        }

        awaitAll(futures);
        rethrowFirstFailure(failures);
    }

    /** Shuts down the owned worker pool. A caller-supplied executor is left running. */
    @Override
    public synchronized void close() {
        closed = true;
        if (pool != null) {
            pool.shutdown();
            pool = null;
        }
    }

    /** Walks one chunk in increasing index order, recording the failure that ends it, if any */
    private static void traverse(Chunk chunk, int width, PixelBuffer baseline, PixelBuffer current, PixelAnalyzer analyzer, Queue<Throwable> failures) {
        try {
            for (int index = chunk.start; index < chunk.end; index++) {
                Position position = ChunkPlanner.positionOf(index, width);
                int baselineColor = baseline.colorAt(position.x, position.y);
                int currentColor = current.colorAt(position.x, position.y);
                try {
                    analyzer.analyze(baselineColor, currentColor, position);
                } catch (RuntimeException e) {
                    throw new PixelAnalyzerException(position, chunk, e);
                }
            }
        } catch (RuntimeException | Error e) {
            failures.add(e);
            throw e;
        }
    }

    private static int totalPixels(int width, int height) {
        try {
            return Math.multiplyExact(width, height);
        } catch (ArithmeticException e) {
            throw new ImageCompareConfigurationException("Image (w" + width + ",h" + height + ") has too many pixels to traverse", e);
        }
    }

    /** Blocks until every future has completed, whether normally or not */
    private static void awaitAll(List<CompletableFuture<Void>> futures) {
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]))
                .handle((ignored, failure) -> null)
                .join();
    }

    private static void rethrowFirstFailure(Queue<Throwable> failures) {
        Throwable first = failures.poll();
        if (first == null) return;
        for (Throwable next = failures.poll(); next != null; next = failures.poll())
            first.addSuppressed(next);
        log.warn("Pixel traversal failed in {} chunk(s): {}", 1 + first.getSuppressed().length, first.getMessage());
        if (first instanceof Error) throw (Error) first;
        throw (RuntimeException) first;
    }

    private synchronized Executor workerExecutor() {
        if (executor != null) return executor;
        if (pool == null || poolSize != workers) {
            if (pool != null) pool.shutdown();
            pool = Executors.newFixedThreadPool(workers, new ChunkThreadFactory());
            poolSize = workers;
            log.debug("Started a pool of {} chunk workers", workers);
        }
        return pool;
    }

    /** Daemon threads, so a processor that is never closed does not keep the JVM alive */
    private static class ChunkThreadFactory implements ThreadFactory {
        private static final AtomicInteger poolCounter = new AtomicInteger();
        private final int poolNumber = poolCounter.incrementAndGet();
        private final AtomicInteger threadCounter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pixel-chunk-" + poolNumber + "-" + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }

    /** A scala-like argument check */
    private static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
