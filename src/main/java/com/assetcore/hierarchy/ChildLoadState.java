package com.assetcore.hierarchy;

import java.util.List;

public record ChildLoadState(Status status, List<ChildArtifact> children, int declaredCount, String errorMessage) {

    public enum Status {
        EMPTY,
        LOADING,
        LOADED,
        STALE,
        ERROR
    }

    public ChildLoadState {
        children = List.copyOf(children);
    }

    public static ChildLoadState empty() {
        return new ChildLoadState(Status.EMPTY, List.of(), -1, null);
    }

    public boolean isLoaded() {
        return status == Status.LOADED;
    }
}
