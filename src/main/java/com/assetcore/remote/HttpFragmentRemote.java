package com.assetcore.remote;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletableFuture;

import com.assetcore.fragment.FragmentRemote;
import com.fasterxml.jackson.databind.JsonNode;

import okhttp3.HttpUrl;

public class HttpFragmentRemote implements FragmentRemote {
    private final RemoteApiClient client;

    public HttpFragmentRemote(RemoteApiClient client) {
        this.client = client;
    }

    @Override
    public CompletableFuture<Void> deleteFragment(long artifactId, String key) {
        HttpUrl url = client.assetUrl(artifactId)
                .addPathSegment("fragments")
                .addPathSegment(key)
                .build();
        return client.send(client.authorized(url).delete().build()).thenAccept(this::checkSuccess);
    }

    private void checkSuccess(byte[] body) {
        if (body.length == 0) {
            return;
        }
        JsonNode root;
        try {
            root = client.mapper().readTree(body);
        } catch (IOException e) {
            throw new UncheckedIOException("Malformed fragment deletion response", e);
        }
        if (root.has("success") && !root.path("success").asBoolean()) {
            String message = root.path("message").asText("");
            throw new IllegalStateException(message.isBlank() ? "Failed to delete fragment" : message);
        }
    }
}
