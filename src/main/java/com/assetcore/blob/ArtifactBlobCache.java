package com.assetcore.blob;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves blob paths to local handles, fetching each path at most once while any number of callers are
 * interested in it.
 *
 * <p>Each path maps to a single shared future: incomplete while the fetch is in flight, completed once the
 * handle exists. Failed resolutions are removed before their future fails, so the next call retries. Callers
 * receive copies of the shared future; cancelling or abandoning a copy leaves the resolution untouched.
 */
public class ArtifactBlobCache {
    private static final Logger log = LoggerFactory.getLogger(ArtifactBlobCache.class);

    private final BlobFetcher fetcher;
    private final BlobHandleFactory handleFactory;
    private final ConcurrentHashMap<String, CompletableFuture<BlobHandle>> entries = new ConcurrentHashMap<>();
    // released while still fetching; a new resolution of the path waits for these to settle
    private final ConcurrentHashMap<String, CompletableFuture<BlobHandle>> detached = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Integer> scopeHolds = new ConcurrentHashMap<>();

    public ArtifactBlobCache(BlobFetcher fetcher, BlobHandleFactory handleFactory) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.handleFactory = Objects.requireNonNull(handleFactory, "handleFactory");
    }

    public CompletableFuture<BlobHandle> resolve(String path) {
        checkPath(path);
        CompletableFuture<BlobHandle> existing = entries.get(path);
        if (existing != null) {
            log.debug("blob.resolve.{} path={}", existing.isDone() ? "hit" : "join", path);
            return existing.copy();
        }

        CompletableFuture<BlobHandle> created = new CompletableFuture<>();
        existing = entries.putIfAbsent(path, created);
        if (existing != null) {
            log.debug("blob.resolve.join path={}", path);
            return existing.copy();
        }

        CompletableFuture<BlobHandle> previous = detached.get(path);
        if (previous != null && !previous.isDone()) {
            log.debug("blob.fetch.deferred path={}", path);
            previous.handle((handle, error) -> null).thenRun(() -> startFetch(path, created));
        } else {
            startFetch(path, created);
        }
        return created.copy();
    }

    public void release(String path) {
        if (path == null) {
            return;
        }
        scopeHolds.remove(path);
        detach(path);
    }

    public void releaseAll() {
        List<String> paths = List.copyOf(entries.keySet());
        paths.forEach(this::release);
        if (!paths.isEmpty()) {
            log.debug("blob.release.all count={}", paths.size());
        }
    }

    // scope holds are counted per path; the handle is freed when the last holder lets go
    CompletableFuture<BlobHandle> acquire(String path) {
        checkPath(path);
        scopeHolds.merge(path, 1, Integer::sum);
        return resolve(path);
    }

    void releaseHold(String path) {
        Integer remaining = scopeHolds.computeIfPresent(path, (key, count) -> {
            if (count > 1) {
                return count - 1;
            }
            detach(path);
            return null;
        });
        if (remaining != null) {
            log.debug("blob.hold.dropped path={} holders={}", path, remaining);
        }
    }

    int holders(String path) {
        return scopeHolds.getOrDefault(path, 0);
    }

    private void detach(String path) {
        CompletableFuture<BlobHandle> entry = entries.get(path);
        if (entry == null) {
            return;
        }
        if (!entry.isDone()) {
            detached.put(path, entry);
            entry.whenComplete((handle, error) -> detached.remove(path, entry));
        }
        if (entries.remove(path, entry)) {
            entry.thenAccept(BlobHandle::release);
            log.debug("blob.release path={} resolved={}", path, entry.isDone());
        }
    }

    public BlobScope openScope() {
        return new BlobScope(this);
    }

    public boolean isResolved(String path) {
        CompletableFuture<BlobHandle> entry = entries.get(path);
        return entry != null && entry.isDone() && !entry.isCompletedExceptionally();
    }

    public boolean isInFlight(String path) {
        CompletableFuture<BlobHandle> entry = entries.get(path);
        return entry != null && !entry.isDone();
    }

    public int size() {
        return entries.size();
    }

    private void startFetch(String path, CompletableFuture<BlobHandle> target) {
        log.debug("blob.fetch.start path={}", path);
        CompletableFuture<byte[]> fetch;
        try {
            fetch = Objects.requireNonNull(fetcher.fetch(path), "fetcher returned null future");
        } catch (RuntimeException e) {
            fetch = CompletableFuture.failedFuture(e);
        }
        fetch.whenComplete((bytes, error) -> complete(path, target, bytes, error));
    }

    private void complete(String path, CompletableFuture<BlobHandle> target, byte[] bytes, Throwable error) {
        if (error != null) {
            fail(path, target, unwrap(error));
            return;
        }
        if (bytes == null) {
            fail(path, target, new IOException("fetch returned no content"));
            return;
        }
        BlobHandle handle;
        try {
            handle = handleFactory.create(path, bytes);
        } catch (IOException | RuntimeException e) {
            fail(path, target, e);
            return;
        }
        log.info("blob.fetch.done path={} bytes={}", path, bytes.length);
        target.complete(handle);
    }

    private void fail(String path, CompletableFuture<BlobHandle> target, Throwable cause) {
        entries.remove(path, target);
        log.warn("blob.fetch.failed path={} reason={}", path, cause.getMessage());
        target.completeExceptionally(new BlobResolutionException(path, cause));
    }

    private static void checkPath(String path) {
        Objects.requireNonNull(path, "path");
        if (path.isBlank()) {
            throw new IllegalArgumentException("Blob path must not be blank");
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
