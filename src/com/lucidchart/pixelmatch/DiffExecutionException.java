package com.lucidchart.pixelmatch;

/** Thrown when a tile could not be compared, or the caller was interrupted while waiting for the tiles. */
public class DiffExecutionException extends RuntimeException {

    public DiffExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
