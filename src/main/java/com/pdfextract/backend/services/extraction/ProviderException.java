package com.pdfextract.backend.services.extraction;

/**
 * A provider call errored. Retryable failures (timeouts, 5xx, 429) are attempted again by the
 * extraction chain; the rest move straight to the next provider.
 */
public class ProviderException extends RuntimeException {

    private final boolean retryable;

    public ProviderException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public ProviderException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
