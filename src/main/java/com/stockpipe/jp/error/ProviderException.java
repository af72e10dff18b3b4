package com.stockpipe.jp.error;

/**
 * Failure reported by an external collaborator (calendar, market data, metadata, ranking).
 */
public class ProviderException extends Exception {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }

    public boolean isTransient() {
        return false;
    }
}
