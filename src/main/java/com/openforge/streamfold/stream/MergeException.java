package com.openforge.streamfold.stream;

/**
 * Two chunks could not be combined.  Aborts the fold that hit it; any
 * partially accumulated value is discarded by the caller.
 */
public class MergeException extends RuntimeException {

    public MergeException(String message) {
        super(message);
    }
}
