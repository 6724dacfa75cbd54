package com.assetcore.hierarchy;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.assetcore.blob.ArtifactBlobCache;
import com.assetcore.blob.BlobHandle;
import com.assetcore.blob.BlobScope;

/**
 * Holds the materialized children of parent artifacts and keeps them consistent with the child count the
 * catalog declares.
 *
 * <p>Each parent id has its own slot guarded by the slot's monitor. A load replaces the whole ordered child set
 * once the listing arrives; until then readers keep seeing the last set that loaded successfully.
 */
public class HierarchicalArtifactStore {
    private static final Logger log = LoggerFactory.getLogger(HierarchicalArtifactStore.class);
    private static final int UNKNOWN_COUNT = -1;

    private final ChildLister lister;
    private final ArtifactBlobCache blobCache;
    private final ConcurrentHashMap<Long, ParentSlot> slots = new ConcurrentHashMap<>();
    private final List<ChildStateListener> listeners = new CopyOnWriteArrayList<>();

    public HierarchicalArtifactStore(ChildLister lister, ArtifactBlobCache blobCache) {
        this.lister = Objects.requireNonNull(lister, "lister");
        this.blobCache = Objects.requireNonNull(blobCache, "blobCache");
    }

    public void addListener(ChildStateListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void removeListener(ChildStateListener listener) {
        listeners.remove(listener);
    }

    public CompletableFuture<List<ChildArtifact>> loadChildren(long parentId) {
        ParentSlot slot = slot(parentId);
        CompletableFuture<List<ChildArtifact>> shared;
        ChildLoadState snapshot;
        synchronized (slot) {
            if (slot.inFlight != null) {
                log.debug("children.load.join parentId={}", parentId);
                return slot.inFlight.copy();
            }
            shared = new CompletableFuture<>();
            slot.inFlight = shared;
            slot.status = ChildLoadState.Status.LOADING;
            slot.requestedCount = slot.declaredCount;
            slot.reloadQueued = false;
            snapshot = slot.snapshot();
        }
        log.debug("children.load.start parentId={} declaredCount={}", parentId, snapshot.declaredCount());
        notifyListeners(parentId, snapshot, false);

        CompletableFuture<List<ChildArtifact>> listing;
        try {
            listing = Objects.requireNonNull(lister.listChildren(parentId), "lister returned null future");
        } catch (RuntimeException e) {
            listing = CompletableFuture.failedFuture(e);
        }
        listing.whenComplete((children, error) -> finishLoad(slot, shared, children, error));
        return shared.copy();
    }

    // count changes seen while a load is in flight collapse into one follow-up load
    public ChildLoadState observeParent(Artifact parent) {
        Objects.requireNonNull(parent, "parent");
        ParentSlot slot = slot(parent.id());
        int declared = parent.declaredChildCount();
        boolean reload = false;
        ChildLoadState stale = null;
        synchronized (slot) {
            slot.declaredCount = declared;
            switch (slot.status) {
                case LOADED -> {
                    if (declared != slot.loadedCount) {
                        slot.status = ChildLoadState.Status.STALE;
                        stale = slot.snapshot();
                        reload = true;
                    }
                }
                case LOADING, STALE -> slot.reloadQueued = declared != slot.requestedCount;
                default -> {
                    // nothing loaded yet, or the last load failed: callers decide when to load
                }
            }
        }
        if (stale != null) {
            log.info("children.stale parentId={} loadedCount={} declaredCount={}",
                    parent.id(), stale.children().size(), declared);
            notifyListeners(parent.id(), stale, false);
        }
        if (reload) {
            loadChildren(parent.id());
        }
        return getState(parent.id());
    }

    public List<ChildArtifact> getChildren(long parentId) {
        ParentSlot slot = slots.get(parentId);
        if (slot == null) {
            return List.of();
        }
        synchronized (slot) {
            return slot.children;
        }
    }

    public ChildLoadState getState(long parentId) {
        ParentSlot slot = slots.get(parentId);
        if (slot == null) {
            return ChildLoadState.empty();
        }
        synchronized (slot) {
            return slot.snapshot();
        }
    }

    public BlobScope openBlobScope() {
        return blobCache.openScope();
    }

    public CompletableFuture<Optional<BlobHandle>> resolveChildBlob(ChildArtifact child, BlobScope scope) {
        Objects.requireNonNull(child, "child");
        if (!scope.belongsTo(blobCache)) {
            throw new IllegalArgumentException("Blob scope was opened on a different cache");
        }
        if (!child.artifact().hasBlob()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return scope.resolve(child.blobPath()).thenApply(Optional::of);
    }

    // a listing still in flight completes for its callers but no longer updates the store
    public void evict(long parentId) {
        slots.remove(parentId);
    }

    private ParentSlot slot(long parentId) {
        return slots.computeIfAbsent(parentId, ParentSlot::new);
    }

    private void finishLoad(
            ParentSlot slot,
            CompletableFuture<List<ChildArtifact>> shared,
            List<ChildArtifact> children,
            Throwable error) {
        ChildLoadState snapshot;
        boolean changed = false;
        boolean reloadNow = false;
        ChildListingException failure = null;
        synchronized (slot) {
            slot.inFlight = null;
            if (error != null || children == null) {
                Throwable cause = error == null ? new IllegalStateException("lister returned no children list") : unwrap(error);
                failure = new ChildListingException(slot.parentId, cause);
                slot.status = ChildLoadState.Status.ERROR;
                slot.errorMessage = failure.getMessage();
                slot.reloadQueued = false;
            } else {
                List<ChildArtifact> ordered = new ArrayList<>(children);
                ordered.sort(ChildArtifact.BY_PART_INDEX);
                List<ChildArtifact> replacement = List.copyOf(ordered);
                changed = !replacement.equals(slot.children);
                slot.children = replacement;
                slot.loadedCount = slot.requestedCount == UNKNOWN_COUNT ? replacement.size() : slot.requestedCount;
                slot.errorMessage = null;
                reloadNow = slot.reloadQueued;
                slot.reloadQueued = false;
                slot.status = reloadNow ? ChildLoadState.Status.STALE : ChildLoadState.Status.LOADED;
            }
            snapshot = slot.snapshot();
        }

        if (failure != null) {
            log.warn("children.load.failed parentId={} keptChildren={} reason={}",
                    slot.parentId, snapshot.children().size(), failure.getCause().getMessage());
        } else {
            log.info("children.load.done parentId={} children={} declaredCount={}",
                    slot.parentId, snapshot.children().size(), snapshot.declaredCount());
        }
        if (slots.get(slot.parentId) == slot) {
            notifyListeners(slot.parentId, snapshot, changed);
        }

        if (failure != null) {
            shared.completeExceptionally(failure);
        } else {
            shared.complete(snapshot.children());
        }
        if (reloadNow && slots.get(slot.parentId) == slot) {
            log.info("children.reload parentId={} reason=count-changed-during-load", slot.parentId);
            loadChildren(slot.parentId);
        }
    }

    private void notifyListeners(long parentId, ChildLoadState state, boolean childrenChanged) {
        for (ChildStateListener listener : listeners) {
            try {
                listener.onStateChanged(parentId, state, childrenChanged);
            } catch (RuntimeException e) {
                log.warn("children.listener.failed parentId={} listener={}", parentId, listener, e);
            }
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

    private static final class ParentSlot {
        private final long parentId;
        private ChildLoadState.Status status = ChildLoadState.Status.EMPTY;
        private List<ChildArtifact> children = List.of();
        private int declaredCount = UNKNOWN_COUNT;
        private int requestedCount = UNKNOWN_COUNT;
        private int loadedCount = UNKNOWN_COUNT;
        private String errorMessage;
        private CompletableFuture<List<ChildArtifact>> inFlight;
        private boolean reloadQueued;

        private ParentSlot(long parentId) {
            this.parentId = parentId;
        }

        private ChildLoadState snapshot() {
            return new ChildLoadState(status, children, declaredCount, errorMessage);
        }
    }
}
