package com.assetcore.fragment;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

public record FragmentEntry(
        String key,
        JsonNode value,
        String sourceRef,
        String curatedByRef,
        Instant timestamp,
        String schemaFieldRef) {
    static final String ANNOTATION_RUN_PREFIX = "annotation_run:";

    public FragmentEntry {
        Objects.requireNonNull(key, "key");
    }

    public static FragmentEntry of(String key, String value, Instant timestamp) {
        return new FragmentEntry(key, TextNode.valueOf(value), null, null, timestamp, null);
    }

    public String displayKey() {
        return FragmentCollection.displayKey(key);
    }

    public boolean isFromAnnotationRun() {
        return sourceRef != null && sourceRef.startsWith(ANNOTATION_RUN_PREFIX);
    }

    public Optional<Long> sourceRunId() {
        if (!isFromAnnotationRun()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Long.parseLong(sourceRef.substring(ANNOTATION_RUN_PREFIX.length()).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public String valueText() {
        if (value == null || value.isNull()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
