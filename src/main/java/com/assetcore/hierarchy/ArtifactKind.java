package com.assetcore.hierarchy;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ArtifactKind {
    PDF("pdf"),
    WEB("web"),
    IMAGE("image"),
    VIDEO("video"),
    AUDIO("audio"),
    TEXT("text"),
    CSV("csv"),
    CSV_ROW("csv_row"),
    MBOX("mbox"),
    EMAIL("email"),
    PDF_PAGE("pdf_page"),
    TEXT_CHUNK("text_chunk"),
    IMAGE_REGION("image_region"),
    VIDEO_SCENE("video_scene"),
    AUDIO_SEGMENT("audio_segment"),
    ARTICLE("article"),
    RSS_FEED("rss_feed"),
    FILE("file"),
    UNKNOWN("unknown");

    private final String value;

    ArtifactKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ArtifactKind fromValue(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ArtifactKind kind : values()) {
            if (kind.value.equals(normalized)) {
                return kind;
            }
        }
        return UNKNOWN;
    }

    public boolean decomposes() {
        return this == CSV || this == PDF || this == MBOX || this == WEB || this == ARTICLE || this == RSS_FEED;
    }
}
