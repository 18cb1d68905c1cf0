package com.lucidchart.pixelmatch;

/** Conversion of 8-bit RGBA colors into the NTSC YIQ space.
 *
 * Semi-transparent colors are composited over white before conversion.
 */
final class Yiq {

    private Yiq() {}

    static double y(double r, double g, double b) {
        return r * 0.29889531 + g * 0.58662247 + b * 0.11448223;
    }

    static double i(double r, double g, double b) {
        return r * 0.59597799 - g * 0.27417610 - b * 0.32180189;
    }

    static double q(double r, double g, double b) {
        return r * 0.21147017 - g * 0.52261711 + b * 0.31114694;
    }

    /** Blends a channel value toward white, alpha in [0,1] */
    static double blend(double c, double alpha) {
        return 255 + (c - 255) * alpha;
    }

    static int alpha(int argb) {
        return argb >>> 24;
    }

    static int red(int argb) {
        return (argb >> 16) & 0xff;
    }

    static int green(int argb) {
        return (argb >> 8) & 0xff;
    }

    static int blue(int argb) {
        return argb & 0xff;
    }

    /** A channel of the color composited over white; opaque colors pass through untouched */
    static double onWhite(int channel, int alpha) {
        return alpha == 255 ? channel : blend(channel, alpha / 255.0);
    }
}
