package com.assetcore.fragment;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface FragmentRemote {
    CompletableFuture<Void> deleteFragment(long artifactId, String key);
}
