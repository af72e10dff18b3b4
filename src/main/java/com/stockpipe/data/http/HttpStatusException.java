package com.stockpipe.data.http;

import java.io.IOException;

/**
 * Non-2xx HTTP response.
 */
public class HttpStatusException extends IOException {
    private final int statusCode;
    private final String url;

    public HttpStatusException(int statusCode, String url) {
        super("HTTP " + statusCode + " for " + url);
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }

    public boolean isRetryable() {
        return statusCode == 408 || statusCode == 429 || statusCode >= 500;
    }
}
