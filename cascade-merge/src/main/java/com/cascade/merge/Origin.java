package com.cascade.merge;

import java.util.List;

/**
 * Where a merged node came from: the winning layer (highest precedence that defined the path and survived) and
 * every layer that defined it, ascending by precedence.
 */
public record Origin(String path, int winner, String winnerName, List<Integer> contributors) {

    public Origin {
        contributors = List.copyOf(contributors);
    }

    /** True when a lower layer's definition of this path was overridden. */
    public boolean isOverridden() {
        return contributors.size() > 1;
    }
}
