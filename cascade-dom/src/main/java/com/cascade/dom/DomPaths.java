package com.cascade.dom;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Path syntax shared by the DOM, the reference resolver and the mount registry.
 * Absolute paths start with {@code /}; segments use JSON-Pointer escaping ({@code ~0} for {@code ~},
 * {@code ~1} for {@code /}) so every property name is addressable.
 */
public final class DomPaths {

    public static final String ROOT = "/";
    private static final char SEPARATOR = '/';

    private DomPaths() {
    }

    public static String escape(String segment) {
        if (segment.indexOf('~') < 0 && segment.indexOf(SEPARATOR) < 0) {
            return segment;
        }
        return segment.replace("~", "~0").replace("/", "~1");
    }

    public static String unescape(String segment) {
        if (segment.indexOf('~') < 0) {
            return segment;
        }
        return segment.replace("~1", "/").replace("~0", "~");
    }

    /**
     * Splits a path into unescaped segments. Empty segments are ignored, so {@code "/"}, {@code ""} and
     * {@code "//"} all denote the root; a missing leading slash is tolerated.
     */
    public static List<String> split(String path) {
        if (path == null || path.isEmpty() || ROOT.equals(path)) {
            return Collections.emptyList();
        }
        List<String> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= path.length(); i++) {
            if (i == path.length() || path.charAt(i) == SEPARATOR) {
                if (i > start) {
                    segments.add(unescape(path.substring(start, i)));
                }
                start = i + 1;
            }
        }
        return segments;
    }

    /** Joins unescaped segments into an absolute path. */
    public static String join(Iterable<String> segments) {
        StringBuilder sb = new StringBuilder();
        for (String segment : segments) {
            sb.append(SEPARATOR).append(escape(segment));
        }
        return sb.length() == 0 ? ROOT : sb.toString();
    }

    /** Appends one unescaped segment to an absolute path. */
    public static String child(String parentPath, String segment) {
        if (parentPath == null || parentPath.isEmpty() || ROOT.equals(parentPath)) {
            return SEPARATOR + escape(segment);
        }
        return parentPath + SEPARATOR + escape(segment);
    }

    /** Canonical form: absolute, no empty segments, no trailing slash. */
    public static String normalize(String path) {
        return join(split(path));
    }

    /** True when {@code path} equals {@code prefix} or lies beneath it. Both must be normalized. */
    public static boolean isSameOrDescendant(String path, String prefix) {
        if (ROOT.equals(prefix)) {
            return true;
        }
        return path.equals(prefix) || path.startsWith(prefix + SEPARATOR);
    }
}
