package com.cascade.merge;

import java.util.Objects;

/**
 * A named configuration layer with fixed precedence (0 = lowest) and the locator its source units are read from
 * (for {@link com.cascade.merge.load.DirectoryLayerSourceLoader}, a folder path).
 */
public record LayerDefinition(String name, int precedence, String sourceLocator) {

    public LayerDefinition {
        Objects.requireNonNull(name, "name");
        if (precedence < 0) {
            throw new IllegalArgumentException("Layer precedence must be >= 0, got " + precedence + " for " + name);
        }
    }
}
