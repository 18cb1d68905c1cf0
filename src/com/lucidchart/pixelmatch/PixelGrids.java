package com.lucidchart.pixelmatch;

import java.awt.image.BufferedImage;

/** Chooses the pixel grid for a given backing representation.
 * The choice is made once, before the comparison starts, so the comparison itself only deals with {@link PixelGrid}.
 */
public final class PixelGrids {

    private PixelGrids() {}

    /** Wraps an AWT image.  A null image yields null, which the comparison reports as an empty image. */
    public static PixelGrid of(BufferedImage image) {
        return image == null ? null : new BufferedImageGrid(image);
    }

    /** Wraps an RGBA byte buffer with straight alpha */
    public static PixelGrid nrgba(byte[] pix, int width, int height) {
        return NrgbaGrid.apply(pix, width, height);
    }

    /** Wraps an RGBA byte buffer whose color channels are premultiplied by alpha */
    public static PixelGrid premultiplied(byte[] pix, int width, int height) {
        return PremultipliedRgbaGrid.apply(pix, width, height);
    }

    /** A new ARGB image of the grid's size, used as a diff output */
    public static BufferedImage newOutputImage(PixelGrid like) {
        return new BufferedImage(like.getWidth(), like.getHeight(), BufferedImage.TYPE_INT_ARGB);
    }

    static boolean isEmpty(PixelGrid grid) {
        return grid == null || grid.isEmpty();
    }

    static void require(boolean requirement, String message) {
        if (!requirement) throw new IllegalArgumentException(message);
    }
}
