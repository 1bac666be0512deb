package com.cascade.merge;

import java.util.Objects;

/**
 * One raw source inside a layer: a slash-separated identifier (e.g. {@code database/primary.json}) and its text.
 * The identifier determines where the unit's content lands in the layer tree; see {@link SourceUnitPaths}.
 */
public record SourceUnit(String id, String text) {

    public SourceUnit {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(text, "text");
    }
}
