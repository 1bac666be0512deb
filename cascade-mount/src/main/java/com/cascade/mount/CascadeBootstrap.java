package com.cascade.mount;

import com.cascade.config.CascadeConfig;
import com.cascade.diagnostics.Diagnostic;
import com.cascade.merge.load.CascadeLoader;
import com.cascade.merge.load.DirectoryLayerSourceLoader;
import com.cascade.mount.provider.CascadeDomProvider;
import com.cascade.schema.SchemaCatalog;
import com.cascade.schema.SchemaNode;
import com.cascade.schema.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Builds a {@link MountRegistry} from {@link CascadeConfig}: the project file's cascade mounted at the configured
 * path, refreshed once before returning.
 */
public final class CascadeBootstrap {

    private static final Logger log = LoggerFactory.getLogger(CascadeBootstrap.class);

    private CascadeBootstrap() {
    }

    public static MountRegistry initialize() {
        return initialize(CascadeConfig.fromEnvironment(), null);
    }

    /**
     * @param schemaCatalog schemas to validate each refresh against, or null to skip validation
     */
    public static MountRegistry initialize(CascadeConfig config, SchemaCatalog schemaCatalog) {
        Objects.requireNonNull(config, "config");
        log.info("Bootstrap: {}", config);
        Path projectFile = Path.of(config.getProjectFile());
        MountRegistry registry = MountRegistry.builder()
                .refreshThreads(config.getRefreshThreads())
                .schemaCatalog(schemaCatalog)
                .validationOptions(new ValidationOptions(config.isStrictValidation()))
                .build();
        SchemaNode cascadeSchema = schemaCatalog != null
                ? schemaCatalog.schemaFor(config.getMountPath()).orElse(null) : null;
        CascadeLoader loader = new CascadeLoader(new DirectoryLayerSourceLoader(), cascadeSchema);
        registry.register(config.getMountPath(), new CascadeDomProvider(projectFile, loader));
        ResolvedConfiguration initial = registry.refresh();
        for (Diagnostic diagnostic : initial.diagnostics()) {
            if (diagnostic.isError()) {
                log.warn("Bootstrap: {}", diagnostic);
            } else {
                log.info("Bootstrap: {}", diagnostic);
            }
        }
        log.info("Bootstrap: configuration generation {} ready from {} ({} diagnostic(s))",
                initial.generation(), projectFile.toAbsolutePath(), initial.diagnostics().size());
        return registry;
    }
}
