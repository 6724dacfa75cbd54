package com.assetcore.hierarchy;

import java.util.List;
import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface ChildLister {
    CompletableFuture<List<ChildArtifact>> listChildren(long parentId);
}
