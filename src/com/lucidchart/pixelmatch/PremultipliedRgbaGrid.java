package com.lucidchart.pixelmatch;

/** Pixels packed as consecutive R, G, B, A bytes where the color channels are premultiplied by alpha.
 *
 * Reads undo the premultiplication, writes apply it, so callers only ever see straight alpha.
 */
public class PremultipliedRgbaGrid extends NrgbaGrid {

    PremultipliedRgbaGrid(byte[] pix, int stride, int width, int height) {
        super(pix, stride, width, height);
    }

    public static PremultipliedRgbaGrid apply(int width, int height) {
        return new PremultipliedRgbaGrid(new byte[bufferSize(width, height)], rowSize(width), width, height);
    }

    public static PremultipliedRgbaGrid apply(byte[] pix, int width, int height) {
        return new PremultipliedRgbaGrid(pix, rowSize(width), width, height);
    }

    @Override
    public int getPixel(int x, int y) {
        int i = offset(x, y);
        int a = pix[i + 3] & 0xff;
        if (a == 0) return 0;
        if (a == 255) return super.getPixel(x, y);
        return a << 24 | unmultiply(pix[i] & 0xff, a) << 16 | unmultiply(pix[i + 1] & 0xff, a) << 8 | unmultiply(pix[i + 2] & 0xff, a);
    }

    @Override
    public void setPixel(int x, int y, int argb) {
        int a = argb >>> 24;
        if (a == 255) {
            super.setPixel(x, y, argb);
            return;
        }
        int i = offset(x, y);
        pix[i] = (byte) multiply((argb >> 16) & 0xff, a);
        pix[i + 1] = (byte) multiply((argb >> 8) & 0xff, a);
        pix[i + 2] = (byte) multiply(argb & 0xff, a);
        pix[i + 3] = (byte) a;
    }

    private static int multiply(int c, int a) {
        return (c * a + 127) / 255;
    }

    private static int unmultiply(int c, int a) {
        return Math.min(255, (c * 255 + a / 2) / a);
    }
}
