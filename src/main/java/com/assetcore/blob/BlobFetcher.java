package com.assetcore.blob;

import java.util.concurrent.CompletableFuture;

@FunctionalInterface
public interface BlobFetcher {
    CompletableFuture<byte[]> fetch(String path);
}
