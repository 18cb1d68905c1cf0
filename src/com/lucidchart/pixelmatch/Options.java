package com.lucidchart.pixelmatch;

import java.awt.Color;

/** Immutable settings for a single comparison.  Build one with {@link With#context()}. */
public final class Options {

    public static final double DEFAULT_THRESHOLD = 0.1;
    public static final double DEFAULT_ALPHA = 0.1;
    public static final Color DEFAULT_AA_COLOR = new Color(255, 255, 0);
    public static final Color DEFAULT_DIFF_COLOR = new Color(255, 0, 0);
    public static final int DEFAULT_TILE_SIZE = 512;

    /** The defaults, shared since options never change once built */
    public static final Options DEFAULTS = With.context().options();

    /** Matching threshold (0 to 1); smaller is more sensitive */
    public final double threshold;

    /** Whether to skip anti-aliasing detection and count every pixel above the threshold */
    public final boolean includeAA;

    /** Opacity of the first image in the background of the diff output */
    public final double alpha;

    public final Color aaColor;
    public final Color diffColor;

    /** Alternative color for pixels that got darker.  Carried for callers, the comparison does not paint with it. */
    public final Color diffColorAlt;

    /** Draw only the anti-aliased and different pixels, leaving the rest of the output untouched */
    public final boolean diffMask;

    /** Maximum tile extent, each tile is compared by its own task */
    public final int tileWidth;
    public final int tileHeight;

    /** Number of worker threads */
    public final int parallelism;

    Options(double threshold, boolean includeAA, double alpha, Color aaColor, Color diffColor, Color diffColorAlt,
            boolean diffMask, int tileWidth, int tileHeight, int parallelism) {
        PixelGrids.require(threshold >= 0 && threshold <= 1, "Threshold must be between 0 and 1, was " + threshold);
        PixelGrids.require(alpha >= 0 && alpha <= 1, "Alpha must be between 0 and 1, was " + alpha);
        PixelGrids.require(aaColor != null, "An anti-aliasing color must be provided");
        PixelGrids.require(diffColor != null, "A diff color must be provided");
        PixelGrids.require(tileWidth >= 1 && tileHeight >= 1, "Tile size must be at least 1x1, was " + tileWidth + "x" + tileHeight);
        PixelGrids.require(parallelism >= 1, "Parallelism must be greater than or equal to 1");
        this.threshold = threshold;
        this.includeAA = includeAA;
        this.alpha = alpha;
        this.aaColor = aaColor;
        this.diffColor = diffColor;
        this.diffColorAlt = diffColorAlt;
        this.diffMask = diffMask;
        this.tileWidth = tileWidth;
        this.tileHeight = tileHeight;
        this.parallelism = parallelism;
    }

    @Override
    public String toString() {
        return "Options{threshold=" + threshold +
                ", includeAA=" + includeAA +
                ", alpha=" + alpha +
                ", diffMask=" + diffMask +
                ", tile=" + tileWidth + "x" + tileHeight +
                ", parallelism=" + parallelism + "}";
    }
}
