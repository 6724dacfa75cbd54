package com.assetcore.remote;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import com.assetcore.hierarchy.Artifact;
import com.assetcore.hierarchy.ChildArtifact;
import com.assetcore.hierarchy.ChildLister;
import com.fasterxml.jackson.core.type.TypeReference;

import okhttp3.HttpUrl;

public class HttpChildLister implements ChildLister {
    private final RemoteApiClient client;
    private final int pageSize;

    public HttpChildLister(RemoteApiClient client, int pageSize) {
        this.client = client;
        this.pageSize = pageSize;
    }

    @Override
    public CompletableFuture<List<ChildArtifact>> listChildren(long parentId) {
        HttpUrl url = client.assetUrl(parentId)
                .addPathSegment("children")
                .addQueryParameter("skip", "0")
                .addQueryParameter("limit", Integer.toString(pageSize))
                .build();
        return client.send(client.authorized(url).get().build()).thenApply(this::decode);
    }

    List<ChildArtifact> decode(byte[] body) {
        List<Artifact> artifacts;
        try {
            artifacts = client.mapper().readValue(body, new TypeReference<List<Artifact>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed child listing", e);
        }
        List<ChildArtifact> children = new ArrayList<>(artifacts.size());
        for (int i = 0; i < artifacts.size(); i++) {
            Artifact artifact = artifacts.get(i);
            int partIndex = artifact.partIndex() != null ? artifact.partIndex() : i;
            children.add(new ChildArtifact(artifact, partIndex));
        }
        return children;
    }
}
