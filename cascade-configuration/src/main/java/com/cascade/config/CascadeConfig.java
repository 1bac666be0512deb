package com.cascade.config;

import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the cascade runtime.
 * <p>
 * Project: CASCADE_PROJECT_FILE (layer list, default {@code cascade.json}), mounted at CASCADE_MOUNT_PATH
 * (default {@code /}). Validation: CASCADE_STRICT_VALIDATION reports undeclared keys. Refresh:
 * CASCADE_REFRESH_THREADS providers loaded in parallel.
 */
public final class CascadeConfig {

    static final String ENV_PROJECT_FILE = "CASCADE_PROJECT_FILE";
    static final String ENV_MOUNT_PATH = "CASCADE_MOUNT_PATH";
    static final String ENV_STRICT_VALIDATION = "CASCADE_STRICT_VALIDATION";
    static final String ENV_REFRESH_THREADS = "CASCADE_REFRESH_THREADS";

    private static final String DEFAULT_PROJECT_FILE = "cascade.json";
    private static final String DEFAULT_MOUNT_PATH = "/";
    private static final boolean DEFAULT_STRICT_VALIDATION = false;
    private static final int DEFAULT_REFRESH_THREADS = 4;

    private final String projectFile;
    private final String mountPath;
    private final boolean strictValidation;
    private final int refreshThreads;

    private CascadeConfig(Builder b) {
        this.projectFile = b.projectFile;
        this.mountPath = b.mountPath;
        this.strictValidation = b.strictValidation;
        this.refreshThreads = b.refreshThreads;
    }

    /** Cascade project file listing the layers (CASCADE_PROJECT_FILE). Default {@code cascade.json}. */
    public String getProjectFile() {
        return projectFile;
    }

    /** Where the cascade is mounted in the master tree (CASCADE_MOUNT_PATH). Default {@code /}. */
    public String getMountPath() {
        return mountPath;
    }

    /** Whether schema validation reports undeclared keys (CASCADE_STRICT_VALIDATION). Default false. */
    public boolean isStrictValidation() {
        return strictValidation;
    }

    /** Threads used to load providers during a refresh (CASCADE_REFRESH_THREADS). Default 4, at least 1. */
    public int getRefreshThreads() {
        return refreshThreads;
    }

    public static CascadeConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same rules as {@link #fromEnvironment()} over an explicit variable map. */
    public static CascadeConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .projectFile(get(env, ENV_PROJECT_FILE, DEFAULT_PROJECT_FILE))
                .mountPath(get(env, ENV_MOUNT_PATH, DEFAULT_MOUNT_PATH))
                .strictValidation(parseBoolean(env.get(ENV_STRICT_VALIDATION), DEFAULT_STRICT_VALIDATION))
                .refreshThreads(parseInt(env.get(ENV_REFRESH_THREADS), DEFAULT_REFRESH_THREADS))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "CascadeConfig{projectFile=" + projectFile + ", mountPath=" + mountPath
                + ", strictValidation=" + strictValidation + ", refreshThreads=" + refreshThreads + "}";
    }

    public static final class Builder {
        private String projectFile = DEFAULT_PROJECT_FILE;
        private String mountPath = DEFAULT_MOUNT_PATH;
        private boolean strictValidation = DEFAULT_STRICT_VALIDATION;
        private int refreshThreads = DEFAULT_REFRESH_THREADS;

        public Builder projectFile(String projectFile) {
            this.projectFile = projectFile != null ? projectFile : DEFAULT_PROJECT_FILE;
            return this;
        }

        public Builder mountPath(String mountPath) {
            this.mountPath = mountPath != null ? mountPath : DEFAULT_MOUNT_PATH;
            return this;
        }

        public Builder strictValidation(boolean strictValidation) {
            this.strictValidation = strictValidation;
            return this;
        }

        /** Values below 1 are raised to 1. */
        public Builder refreshThreads(int refreshThreads) {
            this.refreshThreads = Math.max(1, refreshThreads);
            return this;
        }

        public CascadeConfig build() {
            return new CascadeConfig(this);
        }
    }
}
