package com.lucidchart.pixelmatch;

/** A readable and writable rectangular grid of 8-bit RGBA pixels.
 *
 * Pixels are always exchanged as packed, non-premultiplied 0xAARRGGBB ints, whatever the backing packing is.
 * Writes to distinct pixels may happen concurrently when {@link #isWriteIsolated()} holds.
 */
public interface PixelGrid {

    int getWidth();

    int getHeight();

    /** Returns the straight-alpha 0xAARRGGBB color at (x, y) */
    int getPixel(int x, int y);

    /** Stores the straight-alpha 0xAARRGGBB color at (x, y) */
    void setPixel(int x, int y, int argb);

    default boolean isEmpty() {
        return getWidth() <= 0 || getHeight() <= 0;
    }

    default boolean sameSize(PixelGrid other) {
        return getWidth() == other.getWidth() && getHeight() == other.getHeight();
    }

    /** True when every pixel has storage of its own, so writing one pixel never touches another */
    default boolean isWriteIsolated() {
        return true;
    }

    default String describeSize() {
        return getWidth() + "x" + getHeight();
    }
}
