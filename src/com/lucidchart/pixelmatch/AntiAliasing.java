package com.lucidchart.pixelmatch;

/** Detection of anti-aliased pixels, based on "Anti-aliased Pixel and Intensity Slope Detector" by V. Vysniauskas, 2009.
 *
 * Neighborhood windows are clamped to the image, and a pixel on an edge or corner starts with one virtual
 * equal neighbor to make up for the neighbors it lacks.
 */
final class AntiAliasing {

    private AntiAliasing() {}

    /** Window of the up to 8 neighbors of a pixel, clamped to the image bounds */
    static final class Window {
        final int x0;
        final int y0;
        final int x2;
        final int y2;
        final boolean onEdge;

        Window(int x, int y, int width, int height) {
            this.x0 = Math.max(x - 1, 0);
            this.y0 = Math.max(y - 1, 0);
            this.x2 = Math.min(x + 1, width - 1);
            this.y2 = Math.min(y + 1, height - 1);
            this.onEdge = x == x0 || x == x2 || y == y0 || y == y2;
        }

        int seed() {
            return onEdge ? 1 : 0;
        }
    }

    /** Returns true if the pixel has 3 or more neighbors of exactly its color */
    static boolean hasManySiblings(PixelGrid image, int x1, int y1, int width, int height) {
        Window window = new Window(x1, y1, width, height);
        int center = image.getPixel(x1, y1);
        int zeroes = window.seed();

        for (int x = window.x0; x <= window.x2; x++) {
            for (int y = window.y0; y <= window.y2; y++) {
                if (x == x1 && y == y1) continue;
                if (image.getPixel(x, y) == center) zeroes++;
                if (zeroes > 2) return true;
            }
        }
        return false;
    }

    /** Returns true if the pixel at (x1, y1) of {@code image} looks like part of an anti-aliased edge.
     * The brightest and darkest neighbors are looked up in {@code image}; they must be flat in {@code image} and {@code other} alike.
     */
    static boolean isAntialiased(PixelGrid image, PixelGrid other, int x1, int y1, int width, int height) {
        Window window = new Window(x1, y1, width, height);
        int center = image.getPixel(x1, y1);
        int zeroes = window.seed();
        double min = 0;
        double max = 0;
        int minX = 0, minY = 0, maxX = 0, maxY = 0;

        for (int x = window.x0; x <= window.x2; x++) {
            for (int y = window.y0; y <= window.y2; y++) {
                if (x == x1 && y == y1) continue;

                double delta = ColorDelta.delta(center, image.getPixel(x, y), true);

                if (delta == 0) {
                    zeroes++;
                    // more than 2 equal siblings, not anti-aliasing
                    if (zeroes > 2) return false;
                } else if (delta < min) {
                    min = delta;
                    minX = x;
                    minY = y;
                } else if (delta > max) {
                    max = delta;
                    maxX = x;
                    maxY = y;
                }
            }
        }

        // needs both darker and brighter siblings
        if (min == 0 || max == 0) return false;

        return (hasManySiblings(image, minX, minY, width, height) && hasManySiblings(other, minX, minY, width, height)) ||
                (hasManySiblings(image, maxX, maxY, width, height) && hasManySiblings(other, maxX, maxY, width, height));
    }

    /** Anti-aliasing in either image explains the difference */
    static boolean eitherAntialiased(PixelGrid a, PixelGrid b, int x, int y, int width, int height) {
        return isAntialiased(a, b, x, y, width, height) || isAntialiased(b, a, x, y, width, height);
    }
}
