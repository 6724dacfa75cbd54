package com.assetcore.hierarchy;

@FunctionalInterface
public interface ChildStateListener {
    void onStateChanged(long parentId, ChildLoadState state, boolean childrenChanged);
}
