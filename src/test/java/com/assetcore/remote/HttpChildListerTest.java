package com.assetcore.remote;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.assetcore.hierarchy.ArtifactKind;
import com.assetcore.hierarchy.ChildArtifact;

import okhttp3.Request;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HttpChildListerTest {

    @Test
    void shouldRequestChildrenPageWithBearerToken() throws Exception {
        CannedResponses canned = new CannedResponses().respond(200, """
                [
                  {"id": 21, "kind": "csv_row", "part_index": 1, "parent_asset_id": 5},
                  {"id": 20, "kind": "csv_row", "part_index": 0, "parent_asset_id": 5}
                ]
                """);
        HttpChildLister lister = new HttpChildLister(canned.client("secret"), 250);

        List<ChildArtifact> children = lister.listChildren(5L).get(5, TimeUnit.SECONDS);

        Request request = canned.requests.get(0);
        assertEquals("/api/v1/infospaces/3/assets/5/children", request.url().encodedPath());
        assertEquals("0", request.url().queryParameter("skip"));
        assertEquals("250", request.url().queryParameter("limit"));
        assertEquals("Bearer secret", request.header("Authorization"));
        assertEquals(2, children.size());
        assertEquals(1, children.get(0).partIndex());
        assertEquals(ArtifactKind.CSV_ROW, children.get(0).artifact().kind());
    }

    @Test
    void shouldFallBackToListPositionWithoutPartIndex() {
        HttpChildLister lister = new HttpChildLister(new CannedResponses().client(null), 10);

        List<ChildArtifact> children = lister.decode("[{\"id\": 8}, {\"id\": 9, \"part_index\": 7}, {\"id\": 10}]"
                .getBytes(StandardCharsets.UTF_8));

        assertEquals(List.of(0, 7, 2), children.stream().map(ChildArtifact::partIndex).toList());
    }

    @Test
    void shouldFailOnHttpError() {
        CannedResponses canned = new CannedResponses().respond(500, "{\"detail\": \"database unavailable\"}");
        HttpChildLister lister = new HttpChildLister(canned.client(null), 10);

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> lister.listChildren(5L).get(5, TimeUnit.SECONDS));

        RemoteApiException error = assertInstanceOf(RemoteApiException.class, thrown.getCause());
        assertEquals(500, error.statusCode());
        assertEquals("HTTP 500 from http://catalog.test/api/v1/infospaces/3/assets/5/children?skip=0&limit=10: "
                + "database unavailable", error.getMessage());
        assertNull(canned.requests.get(0).header("Authorization"));
    }

    @Test
    void shouldFailOnMalformedListing() {
        CannedResponses canned = new CannedResponses().respond(200, "{not json");
        HttpChildLister lister = new HttpChildLister(canned.client(null), 10);

        ExecutionException thrown = assertThrows(ExecutionException.class,
                () -> lister.listChildren(5L).get(5, TimeUnit.SECONDS));

        assertInstanceOf(UncheckedIOException.class, thrown.getCause());
    }
}
