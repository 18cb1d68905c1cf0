package com.lucidchart.pixelmatch;

import java.awt.image.BufferedImage;
import java.awt.image.MultiPixelPackedSampleModel;

/** Exposes an AWT image as a pixel grid.  AWT converts to and from straight ARGB for every image type. */
public class BufferedImageGrid implements PixelGrid {

    private final BufferedImage image;

    BufferedImageGrid(BufferedImage image) {
        this.image = image;
    }

    @Override
    public int getWidth() {
        return image.getWidth();
    }

    @Override
    public int getHeight() {
        return image.getHeight();
    }

    @Override
    public int getPixel(int x, int y) {
        return image.getRGB(x, y);
    }

    /** Packed binary images keep several pixels per byte, and setRGB rewrites the whole byte */
    @Override
    public boolean isWriteIsolated() {
        return !(image.getSampleModel() instanceof MultiPixelPackedSampleModel);
    }

    @Override
    public void setPixel(int x, int y, int argb) {
        image.setRGB(x, y, argb);
    }
}
