package com.assetcore.hierarchy;

import java.util.Comparator;
import java.util.Objects;

public record ChildArtifact(Artifact artifact, int partIndex) {
    public static final Comparator<ChildArtifact> BY_PART_INDEX = Comparator
            .comparingInt(ChildArtifact::partIndex)
            .thenComparingLong(ChildArtifact::id);

    public ChildArtifact {
        Objects.requireNonNull(artifact, "artifact");
    }

    public long id() {
        return artifact.id();
    }

    public String blobPath() {
        return artifact.blobPath();
    }
}
