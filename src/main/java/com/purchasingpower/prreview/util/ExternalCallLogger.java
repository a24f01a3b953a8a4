package com.purchasingpower.prreview.util;

import com.purchasingpower.prreview.model.CallContext;
import com.purchasingpower.prreview.model.ServiceType;
import org.slf4j.Logger;

/**
 * Entry point for structured logging of GitHub and Gemini calls.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, Logger logger) {
        return new CallContext(service, operation, logger);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }

    /**
     * Masks a secret down to its first four characters. Tokens never reach the log in full.
     */
    public static String maskToken(String token) {
        if (token == null || token.isEmpty()) {
            return "(none)";
        }
        if (token.length() <= 8) {
            return "****";
        }
        return token.substring(0, 4) + "****";
    }
}
