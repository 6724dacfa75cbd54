package com.assetcore.blob;

public class BlobResolutionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final String path;

    public BlobResolutionException(String path, Throwable cause) {
        super("Failed to resolve blob '" + path + "': " + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.path = path;
    }

    public String path() {
        return path;
    }
}
