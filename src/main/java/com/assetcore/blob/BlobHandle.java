package com.assetcore.blob;

import java.net.URI;
import java.nio.file.Path;

public interface BlobHandle {
    String blobPath();

    Path localFile();

    long size();

    default URI uri() {
        return localFile().toUri();
    }

    boolean isReleased();

    void release();
}
