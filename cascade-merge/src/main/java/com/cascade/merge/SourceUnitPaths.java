package com.cascade.merge;

import com.cascade.dom.DomPaths;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Maps a source unit identifier to its DOM path prefix: the extension {@value #EXTENSION} is dropped and the rest
 * split on {@code /} or {@code \}. {@code database/primary.json} maps to {@code /database/primary}.
 */
public final class SourceUnitPaths {

    public static final String EXTENSION = ".json";

    private SourceUnitPaths() {
    }

    public static List<String> segments(String unitId) {
        String withoutExtension = unitId;
        if (unitId.toLowerCase(Locale.ROOT).endsWith(EXTENSION)) {
            withoutExtension = unitId.substring(0, unitId.length() - EXTENSION.length());
        }
        List<String> segments = new ArrayList<>();
        for (String segment : withoutExtension.split("[/\\\\]")) {
            if (!segment.isEmpty()) {
                segments.add(segment);
            }
        }
        return segments;
    }

    public static String prefix(String unitId) {
        return DomPaths.join(segments(unitId));
    }
}
