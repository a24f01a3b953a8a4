package com.purchasingpower.prreview.exception;

/**
 * No diff content was supplied. Malformed hunks never raise this.
 */
public class DiffParseException extends RuntimeException {

    public DiffParseException(String message) {
        super(message);
    }
}
