package com.cascade.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CascadeConfigTest {

    @Test
    void fromMap_usesDefaultsWhenUnset() {
        CascadeConfig config = CascadeConfig.fromMap(Map.of());

        assertEquals("cascade.json", config.getProjectFile());
        assertEquals("/", config.getMountPath());
        assertFalse(config.isStrictValidation());
        assertEquals(4, config.getRefreshThreads());
    }

    @Test
    void fromMap_readsAndTrimsValues() {
        CascadeConfig config = CascadeConfig.fromMap(Map.of(
                CascadeConfig.ENV_PROJECT_FILE, " /etc/app/cascade.json ",
                CascadeConfig.ENV_MOUNT_PATH, "/app",
                CascadeConfig.ENV_STRICT_VALIDATION, "TRUE",
                CascadeConfig.ENV_REFRESH_THREADS, "8"));

        assertEquals("/etc/app/cascade.json", config.getProjectFile());
        assertEquals("/app", config.getMountPath());
        assertTrue(config.isStrictValidation());
        assertEquals(8, config.getRefreshThreads());
    }

    @Test
    void fromMap_fallsBackOnInvalidNumbersAndClampsThreads() {
        assertEquals(4, CascadeConfig.fromMap(Map.of(CascadeConfig.ENV_REFRESH_THREADS, "many")).getRefreshThreads());
        assertEquals(1, CascadeConfig.fromMap(Map.of(CascadeConfig.ENV_REFRESH_THREADS, "0")).getRefreshThreads());
        assertTrue(CascadeConfig.fromMap(Map.of(CascadeConfig.ENV_STRICT_VALIDATION, "1")).isStrictValidation());
    }
}
