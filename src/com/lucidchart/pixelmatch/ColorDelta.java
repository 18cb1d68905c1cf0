package com.lucidchart.pixelmatch;

/** Perceptual color difference, following "Measuring perceived color difference using YIQ NTSC transmission
 * color space in mobile applications" by Y. Kotsarenko and F. Ramos.
 */
final class ColorDelta {

    /** The largest value {@link #delta(int, int, boolean)} can return in full mode */
    static final double MAX_DELTA = 35215.0;

    private ColorDelta() {}

    /** Squared YIQ distance between two colors, negative when the first color is the brighter one.
     * In luma-only mode the plain brightness difference (first minus second) is returned instead.
     */
    static double delta(int argb1, int argb2, boolean yOnly) {
        if (argb1 == argb2) return 0;

        int a1 = Yiq.alpha(argb1);
        double r1 = Yiq.onWhite(Yiq.red(argb1), a1);
        double g1 = Yiq.onWhite(Yiq.green(argb1), a1);
        double b1 = Yiq.onWhite(Yiq.blue(argb1), a1);

        int a2 = Yiq.alpha(argb2);
        double r2 = Yiq.onWhite(Yiq.red(argb2), a2);
        double g2 = Yiq.onWhite(Yiq.green(argb2), a2);
        double b2 = Yiq.onWhite(Yiq.blue(argb2), a2);

        double y1 = Yiq.y(r1, g1, b1);
        double y2 = Yiq.y(r2, g2, b2);
        double y = y1 - y2;

        // brightness difference only
        if (yOnly) return y;

        double i = Yiq.i(r1, g1, b1) - Yiq.i(r2, g2, b2);
        double q = Yiq.q(r1, g1, b1) - Yiq.q(r2, g2, b2);

        double delta = 0.5053 * y * y + 0.299 * i * i + 0.1957 * q * q;

        // the sign tells whether the pixel got lighter or darker
        return y1 > y2 ? -delta : delta;
    }

    /** Absolute delta above which two colors count as different */
    static double maxDelta(double threshold) {
        return MAX_DELTA * threshold * threshold;
    }
}
