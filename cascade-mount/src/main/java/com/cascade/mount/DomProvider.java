package com.cascade.mount;

import java.io.IOException;

/**
 * Source of one mounted subtree. Called from refresh worker threads, possibly concurrently with itself across
 * overlapping refreshes.
 */
@FunctionalInterface
public interface DomProvider {

    /**
     * Loads a fresh tree. The returned root must be detached and not shared with other callers.
     *
     * @throws IOException when the source cannot be read; the mount is reported as failed
     */
    ProviderSnapshot load() throws IOException;
}
