package com.assetcore.remote;

import java.util.concurrent.CompletableFuture;

import com.assetcore.blob.BlobFetcher;

import okhttp3.HttpUrl;

public class HttpBlobFetcher implements BlobFetcher {
    private final RemoteApiClient client;

    public HttpBlobFetcher(RemoteApiClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<byte[]> fetch(String path) {
        HttpUrl url = client.apiUrl()
                .addPathSegment("files")
                .addPathSegment("stream")
                .addPathSegment(path)
                .build();
        return client.send(client.authorized(url).get().build());
    }
}
