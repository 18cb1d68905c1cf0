package com.lucidchart.pixelmatch;

import java.util.List;

/** Thrown before comparing when the first, second and output images are not all the same size. */
public class ImageSizeMismatchException extends IllegalArgumentException {

    private final List<String> mismatches;

    public ImageSizeMismatchException(List<String> mismatches) {
        super("Sizes of images must be equal: " + String.join(", ", mismatches));
        this.mismatches = mismatches;
    }

    /** One entry per pair of images which differ in size, e.g. {@code first (4x4) != output (3x4)} */
    public List<String> getMismatches() {
        return mismatches;
    }
}
