package com.assetcore.fragment;

import java.util.Optional;

public class FragmentDeletionException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    private final long artifactId;
    private final String key;
    private final transient FragmentEntry removedEntry;

    public FragmentDeletionException(long artifactId, String key, FragmentEntry removedEntry, Throwable cause) {
        super("Failed to delete fragment '" + key + "' of artifact " + artifactId + ": "
                + (cause == null ? "unknown cause" : cause.getMessage()), cause);
        this.artifactId = artifactId;
        this.key = key;
        this.removedEntry = removedEntry;
    }

    public long artifactId() {
        return artifactId;
    }

    public String key() {
        return key;
    }

    public Optional<FragmentEntry> removedEntry() {
        return Optional.ofNullable(removedEntry);
    }
}
