package com.scratchodds.domain.exception;

import java.io.IOException;

/**
 * Raised when a page cannot be retrieved: a non-2xx response, a transport error or an
 * unreadable body.
 */
public class PageFetchException extends IOException {

    /** Status used when no HTTP response was received. */
    public static final int NO_STATUS = -1;

    private final int statusCode;
    private final String url;

    public PageFetchException(String message, int statusCode, String url) {
        super(message);
        this.statusCode = statusCode;
        this.url = url;
    }

    public PageFetchException(String message, String url, Throwable cause) {
        super(message, cause);
        this.statusCode = NO_STATUS;
        this.url = url;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getUrl() {
        return url;
    }
}
