package com.assetcore.remote;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

import com.assetcore.hierarchy.Artifact;

public class HttpAssetReader {
    private final RemoteApiClient client;

    public HttpAssetReader(RemoteApiClient client) {
        this.client = client;
    }

    public CompletableFuture<Artifact> read(long assetId) {
        return client.send(client.authorized(client.assetUrl(assetId).build()).get().build())
                .thenApply(this::decode);
    }

    private Artifact decode(byte[] body) {
        try {
            return client.mapper().readValue(body, Artifact.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed asset payload", e);
        }
    }
}
