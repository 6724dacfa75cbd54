package com.assetcore.hierarchy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Artifact(
        @JsonProperty("id") long id,
        @JsonProperty("uuid") String uuid,
        @JsonProperty("title") String title,
        @JsonProperty("kind") ArtifactKind kind,
        @JsonProperty("blob_path") String blobPath,
        @JsonProperty("source_identifier") String sourceIdentifier,
        @JsonProperty("text_content") String textContent,
        @JsonProperty("source_metadata") Map<String, Object> sourceMetadata,
        @JsonProperty("is_container") boolean container,
        @JsonProperty("children_count") Integer childCount,
        @JsonProperty("parent_asset_id") Long parentId,
        @JsonProperty("part_index") Integer partIndex,
        @JsonProperty("fragments") JsonNode fragments) {

    public Artifact {
        kind = kind == null ? ArtifactKind.UNKNOWN : kind;
        sourceMetadata = sourceMetadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(sourceMetadata));
    }

    public static Artifact of(long id, ArtifactKind kind, String blobPath, boolean container, Integer childCount) {
        return new Artifact(id, null, null, kind, blobPath, null, null, Map.of(), container, childCount, null, null, null);
    }

    public boolean hasBlob() {
        return blobPath != null && !blobPath.isBlank();
    }

    public boolean isHierarchical() {
        return container || kind.decomposes();
    }

    public int declaredChildCount() {
        if (childCount != null) {
            return childCount;
        }
        Object fromMetadata = switch (kind) {
            case CSV -> sourceMetadata.get("row_count");
            case PDF -> sourceMetadata.get("page_count");
            default -> null;
        };
        return fromMetadata instanceof Number ? ((Number) fromMetadata).intValue() : 0;
    }
}
