package com.lucidchart.pixelmatch;

/** Possible outcomes for a single compared pixel */
enum Classification {

    SIMILAR (false),
    ANTIALIASED (false),
    DIFFERENT (true);

    /** Whether the pixel adds to the diff count */
    final boolean counted;

    Classification(boolean counted) {
        this.counted = counted;
    }
}
