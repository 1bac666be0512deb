package com.cascade.query;

/** Thrown when a queried path does not exist in the tree. */
public final class PathNotFoundException extends QueryException {

    public PathNotFoundException(String path) {
        super(path, String.format("Path not found: %s", path), null);
    }
}
