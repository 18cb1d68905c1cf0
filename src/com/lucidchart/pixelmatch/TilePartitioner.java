package com.lucidchart.pixelmatch;

import java.awt.Rectangle;
import java.util.ArrayList;
import java.util.List;

/** Splits an image plane into disjoint tiles which together cover every pixel exactly once.
 *
 * <pre>
 *   (0,0)-(w,h) | (w,0)-(2w,h) | ... | (nw,0)-(width,h)
 *   (0,h)-(w,2h) | ...
 * </pre>
 * Tiles along the right and bottom edges are cut short by the image.
 */
final class TilePartitioner {

    private TilePartitioner() {}

    static List<Rectangle> partition(int width, int height, int maxTileWidth, int maxTileHeight) {
        PixelGrids.require(maxTileWidth >= 1 && maxTileHeight >= 1, "Tile size must be at least 1x1");
        int tileWidth = Math.min(maxTileWidth, width);
        int tileHeight = Math.min(maxTileHeight, height);

        List<Rectangle> tiles = new ArrayList<>();
        for (int y0 = 0; y0 < height; y0 += tileHeight) {
            for (int x0 = 0; x0 < width; x0 += tileWidth) {
                tiles.add(new Rectangle(x0, y0, Math.min(tileWidth, width - x0), Math.min(tileHeight, height - y0)));
            }
        }
        return tiles;
    }
}
