package com.purchasingpower.prreview.exception;

import lombok.Getter;

/**
 * Remote diff could not be retrieved. Fatal to the run.
 */
@Getter
public class FetchException extends RuntimeException {

    /**
     * HTTP status returned by the remote host, or 0 when the failure happened before a response.
     */
    private final int statusCode;

    public FetchException(String message) {
        this(message, 0, null);
    }

    public FetchException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public FetchException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }
}
