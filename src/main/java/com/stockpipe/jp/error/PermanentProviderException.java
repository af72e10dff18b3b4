package com.stockpipe.jp.error;

/**
 * Provider failure that retrying will not fix: unknown symbol, malformed payload, 4xx.
 */
public class PermanentProviderException extends ProviderException {
    public PermanentProviderException(String message) {
        super(message);
    }

    public PermanentProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
