package com.lucidchart.pixelmatch;

import java.awt.Color;

/** A flexible way of specifying arguments in chain for a pixel comparison.
 * This enables semantic calls and flexible updates of arguments without needing to maintain so many constructor alternatives.
 */
public class With {
    private double thresholdHolder = Options.DEFAULT_THRESHOLD;
    private boolean includeAAHolder = false;
    private double alphaHolder = Options.DEFAULT_ALPHA;
    private Color aaColorHolder = Options.DEFAULT_AA_COLOR;
    private Color diffColorHolder = Options.DEFAULT_DIFF_COLOR;
    private Color diffColorAltHolder = null;
    private boolean diffMaskHolder = false;
    private int tileWidthHolder = Options.DEFAULT_TILE_SIZE;
    private int tileHeightHolder = Options.DEFAULT_TILE_SIZE;
    private int parallelismHolder = Runtime.getRuntime().availableProcessors();

    private With(){}

    /** Provides a With object to enable easy chaining of context options */
    public static With context() {
        return new With();
    }

    /** Matching threshold from 0 to 1.  Smaller values make the comparison more sensitive.  (Default is 0.1) */
    public With threshold(double threshold) {
        thresholdHolder = threshold;
        return this;
    }

    /** Count anti-aliased pixels as differences instead of detecting them */
    public With includeAA(boolean includeAA) {
        includeAAHolder = includeAA;
        return this;
    }

    /** Opacity of the unchanged pixels drawn in the diff output.  (Default is 0.1) */
    public With alpha(double alpha) {
        alphaHolder = alpha;
        return this;
    }

    public With aaColor(Color aaColor) {
        aaColorHolder = aaColor;
        return this;
    }

    public With diffColor(Color diffColor) {
        diffColorHolder = diffColor;
        return this;
    }

    public With diffColorAlt(Color diffColorAlt) {
        diffColorAltHolder = diffColorAlt;
        return this;
    }

    /** Draw the diff over a transparent background, as a mask */
    public With diffMask(boolean diffMask) {
        diffMaskHolder = diffMask;
        return this;
    }

    /** Maximum size of the tiles compared in parallel */
    public With tileSize(int width, int height) {
        tileWidthHolder = width;
        tileHeightHolder = height;
        return this;
    }

    /** Number of threads comparing tiles.  (Default is the number of available processors) */
    public With parallelism(int parallelism) {
        parallelismHolder = parallelism;
        return this;
    }

    /** Freezes the current arguments.  Invalid arguments are rejected here. */
    public Options options() {
        return new Options(thresholdHolder, includeAAHolder, alphaHolder, aaColorHolder, diffColorHolder, diffColorAltHolder,
                diffMaskHolder, tileWidthHolder, tileHeightHolder, parallelismHolder);
    }
}
