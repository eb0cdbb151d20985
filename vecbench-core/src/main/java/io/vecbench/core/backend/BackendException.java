package io.vecbench.core.backend;

import java.io.IOException;

/**
 * Non-2xx reply from a backend. 429 and 5xx replies are transient and may be retried;
 * every other status is permanent for the call that produced it.
 */
public class BackendException extends IOException {
    private final int statusCode;
    private final long retryAfterMs;

    public BackendException(int statusCode, String message) {
        this(statusCode, message, -1L);
    }

    public BackendException(int statusCode, String message, long retryAfterMs) {
        super("HTTP " + statusCode + ": " + message);
        this.statusCode = statusCode;
        this.retryAfterMs = retryAfterMs;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * Server supplied back-off hint in milliseconds, or -1 when the reply had none.
     */
    public long retryAfterMs() {
        return retryAfterMs;
    }

    public boolean isTransient() {
        return statusCode == 429 || statusCode >= 500;
    }
}
