package com.eainde.vendorrisk.fetch;

import java.io.IOException;

/**
 * Transport-level failure of a single fetch. Always recoverable at the call site.
 */
public class FetchException extends IOException {

    private final String url;

    public FetchException(String url, String message) {
        super(message + " [" + url + "]");
        this.url = url;
    }

    public FetchException(String url, String message, Throwable cause) {
        super(message + " [" + url + "]", cause);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }
}
