package com.assetcore.remote;

import java.io.IOException;

public class RemoteApiException extends IOException {
    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String url;

    public RemoteApiException(int statusCode, String url, String detail) {
        super("HTTP " + statusCode + " from " + url + (detail == null || detail.isBlank() ? "" : ": " + detail));
        this.statusCode = statusCode;
        this.url = url;
    }

    public int statusCode() {
        return statusCode;
    }

    public String url() {
        return url;
    }
}
