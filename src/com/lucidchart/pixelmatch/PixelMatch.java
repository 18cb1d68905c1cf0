package com.lucidchart.pixelmatch;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.Rectangle;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

/** A pixel by pixel comparison of two equally sized images, which does not flag differences caused by anti-aliasing.
 *
 * Every pixel whose perceptual YIQ distance exceeds the threshold is either counted as a difference,
 * or, if it looks like part of an anti-aliased edge in one of the images, reported as anti-aliased.
 * The result is the count of different pixels, plus an output image showing the classification of each pixel.
 *
 * The plane is cut into tiles which are compared in parallel.  Each task writes only to its own tile of the output,
 * so the output needs no locking.
 */
public class PixelMatch {

    private final static Logger LOGGER = LogManager.getLogger(PixelMatch.class);

    static final String FIRST = "first";
    static final String SECOND = "second";
    static final String OUTPUT = "output";

    public final BufferedImage first;
    public final BufferedImage second;
    private final BufferedImage output;
    private final Options options;
    private final long diffCount;

    private PixelMatch(BufferedImage first, BufferedImage second, Options options) {
        PixelGrid firstGrid = PixelGrids.of(first);
        PixelGrid secondGrid = PixelGrids.of(second);
        this.first = first;
        this.second = second;
        this.options = options;
        this.output = PixelGrids.isEmpty(firstGrid) ? null : PixelGrids.newOutputImage(firstGrid);
        this.diffCount = diff(firstGrid, secondGrid, PixelGrids.of(output), options);
    }

    /*
     * Factory methods
     */

    /** Compare two images using the default options */
    public static PixelMatch apply(BufferedImage first, BufferedImage second) {
        return new PixelMatch(first, second, Options.DEFAULTS);
    }

    public static PixelMatch apply(BufferedImage first, BufferedImage second, Options options) {
        PixelGrids.require(options != null, "Options must be supplied");
        return new PixelMatch(first, second, options);
    }

    public static PixelMatch apply(BufferedImage first, BufferedImage second, With with) {
        PixelGrids.require(with != null, "A context must be supplied");
        return new PixelMatch(first, second, with.options());
    }

    /** Compares two images, painting the result into output.
     *
     * @param first the reference image
     * @param second the image compared against the reference
     * @param output receives the diff, must be the size of both images
     * @return the number of pixels that differ beyond the threshold, not counting anti-aliasing
     * @throws EmptyImageException if any image has no pixels
     * @throws ImageSizeMismatchException if the images do not all share the same size
     * @throws IllegalArgumentException if the output packs several pixels into one storage element
     * @throws DiffExecutionException if a tile could not be compared
     */
    public static long diff(PixelGrid first, PixelGrid second, PixelGrid output, Options options) {
        PixelGrids.require(options != null, "Options must be supplied");
        checkImages(first, second, output);
        PixelGrids.require(output.isWriteIsolated(), "Output pixels of " + output.describeSize() + " share storage with their neighbors and cannot be written by concurrent tiles");

        int width = output.getWidth();
        int height = output.getHeight();
        List<Rectangle> tiles = TilePartitioner.partition(width, height, options.tileWidth, options.tileHeight);
        List<TileComparison> tasks = tiles.stream()
                .map(tile -> new TileComparison(first, second, output, tile, options))
                .collect(Collectors.toList());

        LOGGER.debug("Comparing {}x{} images in {} tiles with {}", width, height, tasks.size(), options);
        long start = System.nanoTime();

        long diff = (tasks.size() == 1 || options.parallelism == 1) ? runInline(tasks) : runParallel(tasks, options.parallelism);

        LOGGER.debug("Found {} different pixels in {} ms", diff, (System.nanoTime() - start) / 1_000_000);
        return diff;
    }

    private static long runInline(List<TileComparison> tasks) {
        long diff = 0;
        try {
            for (TileComparison task : tasks) {
                diff += task.call();
            }
        } catch (RuntimeException e) {
            throw new DiffExecutionException("Unable to compare a tile", e);
        }
        return diff;
    }

    private static long runParallel(List<TileComparison> tasks, int parallelism) {
        ExecutorService executor = Executors.newFixedThreadPool(
            Math.min(parallelism, tasks.size()),
            r -> {
                final Thread t = Executors.defaultThreadFactory().newThread(r);
                t.setDaemon(true);
                return t;
            });
        try {
            long diff = 0;
            for (Future<Long> result : executor.invokeAll(tasks)) {
                diff += result.get();
            }
            return diff;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DiffExecutionException("Interrupted while comparing tiles", e);
        } catch (ExecutionException e) {
            throw new DiffExecutionException("Unable to compare a tile", e.getCause());
        } finally {
            executor.shutdownNow();
        }
    }

    /** Rejects empty images first, then images which are not all the same size */
    static void checkImages(PixelGrid first, PixelGrid second, PixelGrid output) {
        PixelGrid[] images = {first, second, output};
        String[] names = {FIRST, SECOND, OUTPUT};

        List<String> empty = new ArrayList<>();
        for (int i = 0; i < images.length; i++) {
            if (PixelGrids.isEmpty(images[i])) empty.add(names[i]);
        }
        if (!empty.isEmpty()) throw new EmptyImageException(empty);

        List<String> mismatches = new ArrayList<>();
        for (int i = 0; i < images.length - 1; i++) {
            for (int j = i + 1; j < images.length; j++) {
                if (!images[i].sameSize(images[j])) {
                    mismatches.add(names[i] + " (" + images[i].describeSize() + ") != " + names[j] + " (" + images[j].describeSize() + ")");
                }
            }
        }
        if (!mismatches.isEmpty()) throw new ImageSizeMismatchException(mismatches);
    }

    /*
     * Getters
     */

    public long getDiffCount() {
        return diffCount;
    }

    /** True when no pixel differs beyond the threshold */
    public boolean isMatch() {
        return diffCount == 0;
    }

    /** The diff image, highlighting anti-aliased and different pixels */
    public BufferedImage getOutput() {
        return output;
    }

    public Options getOptions() {
        return options;
    }

    @Override
    public String toString() {
        return "PixelMatch{" +
                "size=" + (output == null ? "empty" : output.getWidth() + "x" + output.getHeight()) +
                ", diffCount=" + diffCount +
                ", match=" + isMatch() +
                ", " + options +
                "}";
    }
}
