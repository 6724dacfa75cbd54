package com.assetcore.fragment;

public enum FragmentSortMode {
    ALPHABETICAL,
    RECENCY
}
