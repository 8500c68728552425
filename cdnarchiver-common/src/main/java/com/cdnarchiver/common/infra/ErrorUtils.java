package com.cdnarchiver.common.infra;

import com.cdnarchiver.common.logging.LogRedact;

/**
 * Error formatting utilities: safely extract redacted messages from exceptions.
 */
public final class ErrorUtils {

    private ErrorUtils() {
    }

    /**
     * Format an exception message safely.
     *
     * @return a non-null, credential-free human-readable error string
     */
    public static String formatErrorMessage(Throwable err) {
        if (err == null)
            return "Error";
        String msg = err.getMessage();
        if (msg != null && !msg.isEmpty()) {
            return LogRedact.redactSensitiveText(msg);
        }
        return err.getClass().getSimpleName();
    }

    /**
     * Unwrap completion/execution wrappers down to the failure that matters.
     */
    public static Throwable unwrap(Throwable err) {
        Throwable current = err;
        while ((current instanceof java.util.concurrent.CompletionException
                || current instanceof java.util.concurrent.ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
