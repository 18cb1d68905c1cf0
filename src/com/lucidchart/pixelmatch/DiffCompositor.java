package com.lucidchart.pixelmatch;

/** Paints classified pixels into the diff output. */
final class DiffCompositor {

    private final PixelGrid output;
    private final Options options;
    private final int aaRgb;
    private final int diffRgb;

    DiffCompositor(PixelGrid output, Options options) {
        this.output = output;
        this.options = options;
        this.aaRgb = options.aaColor.getRGB();
        this.diffRgb = options.diffColor.getRGB();
    }

    /** @param original the first image's color at (x, y), used for the background */
    void paint(int x, int y, Classification classification, int original) {
        switch (classification) {
            case DIFFERENT:
                output.setPixel(x, y, diffRgb);
                break;
            case ANTIALIASED:
                // anti-aliased pixels are not part of a mask
                if (!options.diffMask) output.setPixel(x, y, aaRgb);
                break;
            default:
                if (!options.diffMask) output.setPixel(x, y, grayColor(original, options.alpha));
        }
    }

    /** The color's luma blended with white, as an opaque gray */
    static int grayColor(int argb, double alpha) {
        double y = Yiq.y(Yiq.red(argb), Yiq.green(argb), Yiq.blue(argb));
        long value = Math.round(Yiq.blend(y, alpha * Yiq.alpha(argb) / 255));
        int v = (int) Math.max(0, Math.min(255, value));
        return 0xff000000 | v << 16 | v << 8 | v;
    }
}
