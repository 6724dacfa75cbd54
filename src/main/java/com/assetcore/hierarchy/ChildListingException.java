package com.assetcore.hierarchy;

public class ChildListingException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long parentId;

    public ChildListingException(long parentId, Throwable cause) {
        super("Failed to list children of artifact " + parentId + ": "
                + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.parentId = parentId;
    }

    public long parentId() {
        return parentId;
    }
}
