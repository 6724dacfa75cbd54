package com.assetcore.blob;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

public final class BlobScope implements AutoCloseable {
    private final ArtifactBlobCache cache;
    private final Set<String> acquired = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    BlobScope(ArtifactBlobCache cache) {
        this.cache = cache;
    }

    public CompletableFuture<BlobHandle> resolve(String path) {
        if (closed.get()) {
            throw new IllegalStateException("Blob scope already closed");
        }
        if (acquired.add(path)) {
            return cache.acquire(path);
        }
        return cache.resolve(path);
    }

    public boolean belongsTo(ArtifactBlobCache candidate) {
        return cache == candidate;
    }

    public Set<String> acquiredPaths() {
        return Set.copyOf(acquired);
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        List<String> paths = List.copyOf(acquired);
        acquired.clear();
        paths.forEach(cache::releaseHold);
    }
}
