package com.lucidchart.pixelmatch;

import org.testng.Assert;
import org.testng.annotations.Test;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Collections;

import static com.lucidchart.pixelmatch.TestUtil.RED;
import static com.lucidchart.pixelmatch.TestUtil.WHITE;
import static com.lucidchart.pixelmatch.TestUtil.YELLOW;
import static com.lucidchart.pixelmatch.TestUtil.pixels;

public class PixelMatchTest {

    private static final int DIAGONAL_SIZE = 8;

    @Test
    public void testIdenticalImages() {
        BufferedImage standard = TestUtil.blocks(40, 30, 3);
        PixelMatch compare = PixelMatch.apply(standard, TestUtil.copy(standard));
        Assert.assertEquals(compare.getDiffCount(), 0);
        Assert.assertTrue(compare.isMatch());
        for (int pixel : pixels(compare.getOutput())) {
            Assert.assertNotEquals(pixel, RED);
        }
    }

    @Test
    public void testSolidRedBackgroundIsGrayedOut() {
        BufferedImage red = TestUtil.solid(4, 4, Color.RED);
        PixelMatch compare = PixelMatch.apply(red, TestUtil.solid(4, 4, Color.RED));
        Assert.assertEquals(compare.getDiffCount(), 0);
        // luma of red is 76.2, blended with white at 0.1 opacity
        int gray = 0xffededed;
        for (int pixel : pixels(compare.getOutput())) {
            Assert.assertEquals(pixel, gray);
        }
    }

    @Test
    public void testSinglePixelChange() {
        BufferedImage standard = TestUtil.solid(5, 5, Color.WHITE);
        BufferedImage snapshot = TestUtil.copy(standard);
        snapshot.setRGB(2, 2, TestUtil.BLACK);

        PixelMatch compare = PixelMatch.apply(standard, snapshot);
        Assert.assertEquals(compare.getDiffCount(), 1);
        Assert.assertFalse(compare.isMatch());
        BufferedImage output = compare.getOutput();
        for (int y = 0; y < 5; y++) {
            for (int x = 0; x < 5; x++) {
                Assert.assertEquals(output.getRGB(x, y), x == 2 && y == 2 ? RED : WHITE, "pixel (" + x + "," + y + ")");
            }
        }
    }

    @Test
    public void testAntialiasedDiagonalIsNotADifference() {
        BufferedImage hard = TestUtil.diagonal(DIAGONAL_SIZE, false);
        BufferedImage smooth = TestUtil.diagonal(DIAGONAL_SIZE, true);

        PixelMatch compare = PixelMatch.apply(hard, smooth);
        Assert.assertEquals(compare.getDiffCount(), 0);
        for (int k = 0; k < DIAGONAL_SIZE; k++) {
            Assert.assertEquals(compare.getOutput().getRGB(k, k), YELLOW, "diagonal pixel " + k);
        }

        // the order of the images does not matter
        Assert.assertEquals(PixelMatch.apply(smooth, hard).getDiffCount(), 0);
    }

    @Test
    public void testIncludeAACountsAntialiasedPixels() {
        BufferedImage hard = TestUtil.diagonal(DIAGONAL_SIZE, false);
        BufferedImage smooth = TestUtil.diagonal(DIAGONAL_SIZE, true);

        PixelMatch compare = PixelMatch.apply(hard, smooth, With.context().includeAA(true));
        Assert.assertEquals(compare.getDiffCount(), DIAGONAL_SIZE);
        for (int k = 0; k < DIAGONAL_SIZE; k++) {
            Assert.assertEquals(compare.getOutput().getRGB(k, k), RED);
        }
    }

    @Test
    public void testCustomColors() {
        BufferedImage hard = TestUtil.diagonal(DIAGONAL_SIZE, false);
        BufferedImage smooth = TestUtil.diagonal(DIAGONAL_SIZE, true);
        smooth.setRGB(6, 1, TestUtil.BLACK);

        PixelMatch compare = PixelMatch.apply(hard, smooth, With.context().aaColor(Color.CYAN).diffColor(Color.MAGENTA));
        Assert.assertEquals(compare.getDiffCount(), 1);
        Assert.assertEquals(compare.getOutput().getRGB(6, 1), Color.MAGENTA.getRGB());
        Assert.assertEquals(compare.getOutput().getRGB(3, 3), Color.CYAN.getRGB());
    }

    @Test
    public void testDiffMaskLeavesUnchangedPixelsAlone() {
        BufferedImage hard = TestUtil.diagonal(DIAGONAL_SIZE, false);
        BufferedImage smooth = TestUtil.diagonal(DIAGONAL_SIZE, true);
        smooth.setRGB(6, 1, TestUtil.BLACK);

        PixelMatch compare = PixelMatch.apply(hard, smooth, With.context().diffMask(true));
        Assert.assertEquals(compare.getDiffCount(), 1);
        BufferedImage output = compare.getOutput();
        for (int y = 0; y < DIAGONAL_SIZE; y++) {
            for (int x = 0; x < DIAGONAL_SIZE; x++) {
                // anti-aliased pixels are not part of the mask either
                Assert.assertEquals(output.getRGB(x, y), x == 6 && y == 1 ? RED : 0, "pixel (" + x + "," + y + ")");
            }
        }
    }

    @Test
    public void testWithoutMaskEveryUnchangedPixelIsGray() {
        BufferedImage standard = TestUtil.blocks(21, 17, 5);
        BufferedImage snapshot = TestUtil.scatter(standard, 10, 9);
        PixelMatch compare = PixelMatch.apply(standard, snapshot);
        int[] output = pixels(compare.getOutput());
        for (int pixel : output) {
            if (pixel == RED || pixel == YELLOW) continue;
            Assert.assertEquals(pixel >>> 24, 255);
            Assert.assertEquals((pixel >> 16) & 0xff, pixel & 0xff);
            Assert.assertEquals((pixel >> 8) & 0xff, pixel & 0xff);
        }
    }

    @Test
    public void testTilingDoesNotChangeTheResult() {
        BufferedImage standard = TestUtil.blocks(37, 23, 42);
        BufferedImage snapshot = TestUtil.scatter(standard, 60, 17);

        PixelMatch whole = PixelMatch.apply(standard, snapshot, With.context().tileSize(37, 23).parallelism(1));
        PixelMatch single = PixelMatch.apply(standard, snapshot, With.context().tileSize(1, 1).parallelism(4));
        PixelMatch uneven = PixelMatch.apply(standard, snapshot, With.context().tileSize(5, 3).parallelism(3));

        Assert.assertTrue(whole.getDiffCount() > 0);
        Assert.assertEquals(single.getDiffCount(), whole.getDiffCount());
        Assert.assertEquals(uneven.getDiffCount(), whole.getDiffCount());
        Assert.assertEquals(pixels(single.getOutput()), pixels(whole.getOutput()));
        Assert.assertEquals(pixels(uneven.getOutput()), pixels(whole.getOutput()));
    }

    @Test
    public void testPixelPackingsAgree() {
        BufferedImage standard = TestUtil.blocks(16, 12, 8);
        BufferedImage snapshot = TestUtil.scatter(standard, 12, 4);
        Options options = With.context().tileSize(4, 4).options();

        NrgbaGrid straightOutput = NrgbaGrid.apply(16, 12);
        long straight = PixelMatch.diff(TestUtil.nrgba(standard), TestUtil.nrgba(snapshot), straightOutput, options);

        BufferedImage awtOutput = new BufferedImage(16, 12, BufferedImage.TYPE_INT_ARGB);
        long awt = PixelMatch.diff(PixelGrids.of(standard), PixelGrids.of(snapshot), PixelGrids.of(awtOutput), options);

        Assert.assertEquals(straight, awt);
        for (int y = 0; y < 12; y++) {
            for (int x = 0; x < 16; x++) {
                Assert.assertEquals(straightOutput.getPixel(x, y), awtOutput.getRGB(x, y));
            }
        }
    }

    @Test
    public void testPremultipliedOpaqueImages() {
        BufferedImage standard = TestUtil.solid(6, 6, Color.BLUE);
        BufferedImage snapshot = TestUtil.copy(standard);
        snapshot.setRGB(3, 3, WHITE);

        PremultipliedRgbaGrid output = PremultipliedRgbaGrid.apply(6, 6);
        long diff = PixelMatch.diff(TestUtil.premultiplied(standard), TestUtil.premultiplied(snapshot), output, Options.DEFAULTS);
        Assert.assertEquals(diff, 1);
        Assert.assertEquals(output.getPixel(3, 3), RED);
    }

    @Test
    public void testZeroThresholdFlagsAnyChange() {
        BufferedImage standard = TestUtil.solid(5, 5, Color.WHITE);
        BufferedImage snapshot = TestUtil.copy(standard);
        snapshot.setRGB(2, 2, 0xfffefefe);
        Assert.assertEquals(PixelMatch.apply(standard, snapshot).getDiffCount(), 0);
        Assert.assertEquals(PixelMatch.apply(standard, snapshot, With.context().threshold(0)).getDiffCount(), 1);
    }

    @Test
    public void testEmptyImagesAreNamed() {
        NrgbaGrid image = NrgbaGrid.apply(4, 4);
        try {
            PixelMatch.diff(image, NrgbaGrid.apply(0, 4), null, Options.DEFAULTS);
            Assert.fail("Expected an EmptyImageException");
        } catch (EmptyImageException e) {
            Assert.assertEquals(e.getEmptyImages(), Arrays.asList("second", "output"));
            Assert.assertTrue(e.getMessage().contains("second, output"), e.getMessage());
        }
    }

    @Test
    public void testMismatchedSizesAreNamed() {
        NrgbaGrid output = NrgbaGrid.apply(4, 4);
        try {
            PixelMatch.diff(NrgbaGrid.apply(4, 4), NrgbaGrid.apply(3, 4), output, Options.DEFAULTS);
            Assert.fail("Expected an ImageSizeMismatchException");
        } catch (ImageSizeMismatchException e) {
            Assert.assertEquals(e.getMismatches(), Arrays.asList("first (4x4) != second (3x4)", "second (3x4) != output (4x4)"));
        }
    }

    @Test
    public void testFailedPreconditionsLeaveTheOutputUntouched() {
        NrgbaGrid output = NrgbaGrid.apply(5, 4);
        NrgbaGrid white = TestUtil.nrgba(TestUtil.solid(4, 4, Color.WHITE));
        try {
            PixelMatch.diff(white, white, output, Options.DEFAULTS);
            Assert.fail("Expected an ImageSizeMismatchException");
        } catch (ImageSizeMismatchException e) {
            Assert.assertEquals(e.getMismatches().size(), 2);
        }
        Assert.assertEquals(output.getPix(), new byte[5 * 4 * 4]);
    }

    @Test(expectedExceptions = EmptyImageException.class)
    public void testMissingSnapshot() {
        PixelMatch.apply(TestUtil.solid(2, 2, Color.WHITE), null);
    }

    @Test
    public void testEmptyMessageForSingleImage() {
        EmptyImageException e = new EmptyImageException(Collections.singletonList("first"));
        Assert.assertEquals(e.getMessage(), "Image is empty: first");
    }

    @Test
    public void testSemiTransparentBackground() {
        Assert.assertEquals(DiffCompositor.grayColor(0x80000000, 0.1), 0xfff2f2f2);
        Assert.assertEquals(DiffCompositor.grayColor(0x00000000, 0.1), 0xffffffff);
        Assert.assertEquals(DiffCompositor.grayColor(0xff000000, 1.0), 0xff000000);
    }

    @Test
    public void testTileFailureIsReported() {
        NrgbaGrid standard = NrgbaGrid.apply(6, 6);
        PixelGrid broken = new NrgbaGrid(new byte[6 * 6 * 4], 6 * 4, 6, 6) {
            @Override
            public int getPixel(int x, int y) {
                if (x == 5 && y == 5) throw new IllegalStateException("unreadable");
                return super.getPixel(x, y);
            }
        };
        try {
            PixelMatch.diff(standard, broken, NrgbaGrid.apply(6, 6), With.context().tileSize(2, 2).parallelism(2).options());
            Assert.fail("Expected a DiffExecutionException");
        } catch (DiffExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testTileFailureIsReportedWhenRunningInline() {
        NrgbaGrid standard = NrgbaGrid.apply(6, 6);
        PixelGrid broken = new NrgbaGrid(new byte[6 * 6 * 4], 6 * 4, 6, 6) {
            @Override
            public int getPixel(int x, int y) {
                if (x == 5 && y == 5) throw new IllegalStateException("unreadable");
                return super.getPixel(x, y);
            }
        };
        try {
            PixelMatch.diff(standard, broken, NrgbaGrid.apply(6, 6), With.context().parallelism(1).options());
            Assert.fail("Expected a DiffExecutionException");
        } catch (DiffExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testPackedBinaryOutputIsRejected() {
        BufferedImage binary = new BufferedImage(8, 8, BufferedImage.TYPE_BYTE_BINARY);
        NrgbaGrid white = TestUtil.nrgba(TestUtil.solid(8, 8, Color.WHITE));
        try {
            PixelMatch.diff(white, white, PixelGrids.of(binary), With.context().tileSize(1, 1).options());
            Assert.fail("Expected an IllegalArgumentException");
        } catch (IllegalArgumentException e) {
            Assert.assertTrue(e.getMessage().contains("8x8"), e.getMessage());
        }
        Assert.assertEquals(pixels(binary), pixels(new BufferedImage(8, 8, BufferedImage.TYPE_BYTE_BINARY)));
    }

    @Test
    public void testBytePerChannelOutputsAreAccepted() {
        BufferedImage standard = TestUtil.solid(4, 4, Color.WHITE);
        BufferedImage gray = new BufferedImage(4, 4, BufferedImage.TYPE_BYTE_GRAY);
        long diff = PixelMatch.diff(PixelGrids.of(standard), PixelGrids.of(standard), PixelGrids.of(gray), Options.DEFAULTS);
        Assert.assertEquals(diff, 0);
        Assert.assertEquals(gray.getRGB(1, 1), WHITE);
    }
}
