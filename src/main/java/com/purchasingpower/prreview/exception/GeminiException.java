package com.purchasingpower.prreview.exception;

/**
 * Gemini call failed after retries or returned nothing usable.
 */
public class GeminiException extends RuntimeException {

    public GeminiException(String message, Throwable cause) {
        super(message, cause);
    }
}
