package com.company.matching.core.model;

import java.util.Objects;

/**
 * Maps a unified company back to the natural key of one originating record.
 */
public record SourceLink(SourceSystem sourceSystem, String sourceKey) {
    public SourceLink {
        Objects.requireNonNull(sourceSystem, "sourceSystem is required");
        Objects.requireNonNull(sourceKey, "sourceKey is required");
    }
}
