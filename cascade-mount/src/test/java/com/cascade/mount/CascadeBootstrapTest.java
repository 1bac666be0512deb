package com.cascade.mount;

import com.cascade.config.CascadeConfig;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.schema.SchemaCatalog;
import com.cascade.schema.Schemas;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CascadeBootstrapTest {

    @TempDir
    Path tempDir;

    @Test
    void initialize_mountsProjectCascadeAtConfiguredPath() throws IOException {
        write("base/network.json", "{\"ip\": \"10.0.0.1\", \"port\": 80, \"host\": {\"$ref\": \"/app/shared/host\"}}");
        write("base/shared.json", "{\"host\": \"a.example.com\"}");
        write("site/network.json", "{\"ip\": \"10.0.0.2\"}");
        Path project = write("cascade.json", """
                { "layers": [ { "name": "Base", "folderPath": "base" }, { "name": "Site", "folderPath": "site" } ] }
                """);
        CascadeConfig config = CascadeConfig.fromMap(Map.of(
                "CASCADE_PROJECT_FILE", project.toString(),
                "CASCADE_MOUNT_PATH", "/app",
                "CASCADE_REFRESH_THREADS", "2"));
        SchemaCatalog catalog = new SchemaCatalog()
                .register("/app/network", Schemas.object()
                        .required("ip", Schemas.string().build())
                        .required("port", Schemas.integer().build())
                        .build());

        try (MountRegistry registry = CascadeBootstrap.initialize(config, catalog)) {
            ResolvedConfiguration configuration = registry.snapshot().orElseThrow();

            assertTrue(configuration.diagnostics().isEmpty());
            assertEquals("10.0.0.2", registry.query().get("/app/network/ip", String.class));
            assertEquals("a.example.com", registry.query().get("/app/network/host", String.class));
        }
    }

    @Test
    void initialize_checksUnitPathCasingAgainstMountSchema() throws IOException {
        write("base/Network.json", "{\"ip\": \"10.0.0.1\"}");
        Path project = write("cascade.json", """
                { "layers": [ { "name": "Base", "folderPath": "base" } ] }
                """);
        CascadeConfig config = CascadeConfig.builder()
                .projectFile(project.toString())
                .mountPath("/app")
                .build();
        SchemaCatalog catalog = new SchemaCatalog()
                .register("/app", Schemas.object()
                        .optional("network", Schemas.object().build())
                        .build());

        try (MountRegistry registry = CascadeBootstrap.initialize(config, catalog)) {
            ResolvedConfiguration configuration = registry.snapshot().orElseThrow();

            assertEquals(1, configuration.diagnostics().size());
            assertEquals(DiagnosticKind.CASING_MISMATCH, configuration.diagnostics().get(0).kind());
            assertEquals("/app/Network", configuration.diagnostics().get(0).path());
            assertFalse(configuration.hasErrors());
        }
    }

    @Test
    void initialize_reportsMissingProjectAsMountFailure() {
        CascadeConfig config = CascadeConfig.builder()
                .projectFile(tempDir.resolve("absent.json").toString())
                .mountPath("/app")
                .build();

        try (MountRegistry registry = CascadeBootstrap.initialize(config, null)) {
            ResolvedConfiguration configuration = registry.snapshot().orElseThrow();

            assertEquals(1, configuration.diagnostics().size());
            assertEquals(DiagnosticKind.MOUNT_FAILURE, configuration.diagnostics().get(0).kind());
            assertEquals("/app", configuration.diagnostics().get(0).path());
        }
    }

    private Path write(String relative, String content) throws IOException {
        Path file = tempDir.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }
}
