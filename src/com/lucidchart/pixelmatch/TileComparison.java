package com.lucidchart.pixelmatch;

import java.awt.Rectangle;
import java.util.concurrent.Callable;

/** Compares the pixels of one tile and paints them into the output.
 *
 * Neighborhood reads may reach into other tiles, writes stay inside this tile.
 * The result is the number of different pixels in the tile.
 */
final class TileComparison implements Callable<Long> {

    private final PixelGrid first;
    private final PixelGrid second;
    private final Rectangle tile;
    private final Options options;
    private final DiffCompositor compositor;
    private final double maxDelta;
    private final int width;
    private final int height;

    TileComparison(PixelGrid first, PixelGrid second, PixelGrid output, Rectangle tile, Options options) {
        this.first = first;
        this.second = second;
        this.tile = tile;
        this.options = options;
        this.compositor = new DiffCompositor(output, options);
        this.maxDelta = ColorDelta.maxDelta(options.threshold);
        this.width = first.getWidth();
        this.height = first.getHeight();
    }

    @Override
    public Long call() {
        long diff = 0;
        for (int y = tile.y; y < tile.y + tile.height; y++) {
            for (int x = tile.x; x < tile.x + tile.width; x++) {
                int original = first.getPixel(x, y);
                Classification classification = classify(original, second.getPixel(x, y), x, y);
                compositor.paint(x, y, classification, original);
                if (classification.counted) diff++;
            }
        }
        return diff;
    }

    Classification classify(int color1, int color2, int x, int y) {
        // squared YIQ distance, negative if the second image's pixel is darker
        double delta = ColorDelta.delta(color1, color2, false);
        if (Math.abs(delta) <= maxDelta) return Classification.SIMILAR;

        if (!options.includeAA && AntiAliasing.eitherAntialiased(first, second, x, y, width, height)) {
            return Classification.ANTIALIASED;
        }
        return Classification.DIFFERENT;
    }
}
