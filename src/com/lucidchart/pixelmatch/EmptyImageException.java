package com.lucidchart.pixelmatch;

import java.util.List;

/** Thrown before comparing when the first, second or output image has no pixels. */
public class EmptyImageException extends IllegalArgumentException {

    private final List<String> emptyImages;

    public EmptyImageException(List<String> emptyImages) {
        super("Image is empty: " + String.join(", ", emptyImages));
        this.emptyImages = emptyImages;
    }

    /** Names of the empty images: first, second and/or output */
    public List<String> getEmptyImages() {
        return emptyImages;
    }
}
