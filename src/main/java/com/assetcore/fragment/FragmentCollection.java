package com.assetcore.fragment;

import java.text.Collator;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;

public class FragmentCollection {
    private static final Logger log = LoggerFactory.getLogger(FragmentCollection.class);

    // longest first; only the first match is stripped
    private static final List<String> NAMESPACE_PREFIXES = List.of(
            "annotation.",
            "fragment.",
            "document.",
            "curated.",
            "asset.");

    private final long artifactId;
    private final FragmentRemote remote;
    private final Locale locale;
    private final Map<String, FragmentEntry> entries = new LinkedHashMap<>();

    public FragmentCollection(long artifactId, Map<String, FragmentEntry> entries, FragmentRemote remote) {
        this(artifactId, entries, remote, Locale.getDefault());
    }

    public FragmentCollection(long artifactId, Map<String, FragmentEntry> entries, FragmentRemote remote, Locale locale) {
        this.artifactId = artifactId;
        this.remote = Objects.requireNonNull(remote, "remote");
        this.locale = Objects.requireNonNull(locale, "locale");
        this.entries.putAll(entries);
    }

    public static FragmentCollection fromJson(long artifactId, JsonNode fragments, FragmentRemote remote) {
        Map<String, FragmentEntry> parsed = new LinkedHashMap<>();
        if (fragments != null && fragments.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = fragments.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                parsed.put(field.getKey(), toEntry(field.getKey(), field.getValue()));
            }
        }
        return new FragmentCollection(artifactId, parsed, remote);
    }

    public static String displayKey(String key) {
        if (key == null) {
            return "";
        }
        for (String prefix : NAMESPACE_PREFIXES) {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                return key.substring(prefix.length());
            }
        }
        return key;
    }

    public long artifactId() {
        return artifactId;
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized Optional<FragmentEntry> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    public synchronized List<FragmentEntry> entries() {
        return List.copyOf(entries.values());
    }

    public synchronized void put(FragmentEntry entry) {
        entries.put(entry.key(), entry);
    }

    public List<FragmentEntry> sortedEntries(FragmentSortMode mode) {
        List<FragmentEntry> sorted = new ArrayList<>(entries());
        switch (mode) {
            case ALPHABETICAL -> {
                Collator collator = Collator.getInstance(locale);
                sorted.sort(Comparator.comparing(FragmentEntry::key, collator));
            }
            case RECENCY -> sorted.sort(Comparator.comparing(
                    FragmentEntry::timestamp,
                    Comparator.nullsLast(Comparator.<Instant>reverseOrder())));
            default -> throw new IllegalArgumentException("Unsupported sort mode: " + mode);
        }
        return sorted;
    }

    // no rollback: a failed delete reports the removed entry and the caller decides
    public CompletableFuture<Optional<FragmentEntry>> delete(String key) {
        Objects.requireNonNull(key, "key");
        FragmentEntry removed;
        synchronized (this) {
            removed = entries.remove(key);
        }
        log.debug("fragment.delete.start artifactId={} key={} heldLocally={}", artifactId, key, removed != null);

        CompletableFuture<Void> call;
        try {
            call = Objects.requireNonNull(remote.deleteFragment(artifactId, key), "remote returned null future");
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<Optional<FragmentEntry>> result = new CompletableFuture<>();
        call.whenComplete((ignored, error) -> {
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
                log.warn("fragment.delete.failed artifactId={} key={} reason={}", artifactId, key, cause.getMessage());
                result.completeExceptionally(new FragmentDeletionException(artifactId, key, removed, cause));
            } else {
                result.complete(Optional.ofNullable(removed));
            }
        });
        return result;
    }

    private static FragmentEntry toEntry(String key, JsonNode node) {
        if (node == null || !node.isObject() || !node.has("value")) {
            return new FragmentEntry(key, node, null, null, null, null);
        }
        return new FragmentEntry(
                key,
                node.get("value"),
                textOrNull(node, "source_ref"),
                textOrNull(node, "curated_by_ref"),
                parseTimestamp(key, textOrNull(node, "timestamp")),
                textOrNull(node, "schema_field"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static Instant parseTimestamp(String key, String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(raw).toInstant();
        } catch (DateTimeParseException e) {
            try {
                return Instant.parse(raw);
            } catch (DateTimeParseException inner) {
                log.debug("fragment.timestamp.unparseable key={} value={}", key, raw);
                return null;
            }
        }
    }
}
