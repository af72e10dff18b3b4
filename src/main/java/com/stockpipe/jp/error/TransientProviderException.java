package com.stockpipe.jp.error;

/**
 * Retryable provider failure: timeouts, rate limits, 5xx responses.
 */
public class TransientProviderException extends ProviderException {
    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
