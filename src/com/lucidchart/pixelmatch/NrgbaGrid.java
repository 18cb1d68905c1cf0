package com.lucidchart.pixelmatch;

/** Pixels packed as consecutive R, G, B, A bytes with straight (non-premultiplied) alpha. */
public class NrgbaGrid implements PixelGrid {

    final byte[] pix;
    final int stride;
    private final int width;
    private final int height;

    NrgbaGrid(byte[] pix, int stride, int width, int height) {
        PixelGrids.require(width >= 0 && height >= 0, "Grid dimensions must not be negative");
        PixelGrids.require(stride >= width * 4L, "Stride " + stride + " is too small for a width of " + width);
        PixelGrids.require(pix.length >= (height == 0 ? 0 : (long) stride * (height - 1) + width * 4L), "Pixel buffer is too small for " + width + "x" + height);
        this.pix = pix;
        this.stride = stride;
        this.width = width;
        this.height = height;
    }

    /** A fully transparent grid of the given size */
    public static NrgbaGrid apply(int width, int height) {
        return new NrgbaGrid(new byte[bufferSize(width, height)], rowSize(width), width, height);
    }

    /** Wraps an existing buffer, rows are width * 4 bytes long */
    public static NrgbaGrid apply(byte[] pix, int width, int height) {
        return new NrgbaGrid(pix, rowSize(width), width, height);
    }

    /** Bytes in a row of the given width; negative widths count as empty */
    static int rowSize(int width) {
        return bufferSize(width, 1);
    }

    static int bufferSize(int width, int height) {
        long size = Math.max(0L, width) * Math.max(0L, height) * 4L;
        PixelGrids.require(size <= Integer.MAX_VALUE, "A " + width + "x" + height + " grid does not fit in a byte array");
        return (int) size;
    }

    @Override
    public int getWidth() {
        return width;
    }

    @Override
    public int getHeight() {
        return height;
    }

    int offset(int x, int y) {
        return y * stride + x * 4;
    }

    @Override
    public int getPixel(int x, int y) {
        int i = offset(x, y);
        return (pix[i + 3] & 0xff) << 24 | (pix[i] & 0xff) << 16 | (pix[i + 1] & 0xff) << 8 | (pix[i + 2] & 0xff);
    }

    @Override
    public void setPixel(int x, int y, int argb) {
        int i = offset(x, y);
        pix[i] = (byte) (argb >> 16);
        pix[i + 1] = (byte) (argb >> 8);
        pix[i + 2] = (byte) argb;
        pix[i + 3] = (byte) (argb >>> 24);
    }

    /** The backing buffer, not a copy */
    public byte[] getPix() {
        return pix;
    }
}
