package com.assetcore.blob;

import java.io.IOException;

@FunctionalInterface
public interface BlobHandleFactory {
    BlobHandle create(String blobPath, byte[] content) throws IOException;
}
