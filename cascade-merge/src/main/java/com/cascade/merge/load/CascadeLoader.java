package com.cascade.merge.load;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.dom.DomPaths;
import com.cascade.merge.CascadeLayer;
import com.cascade.merge.IntraLayerMerger;
import com.cascade.merge.LayerDefinition;
import com.cascade.merge.LayerMerger;
import com.cascade.merge.MergeResult;
import com.cascade.merge.SourceUnit;
import com.cascade.merge.integrity.IntegrityChecker;
import com.cascade.schema.SchemaNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Loads a layered cascade: units per layer, intra-layer merge, inter-layer merge, then the advisory
 * {@link IntegrityChecker} checks, whose warnings are added to the result.
 * <p>
 * Load failures never abort the cascade. A layer whose source cannot be read becomes a failed layer with a
 * LOAD_ERROR diagnostic and the remaining layers still merge.
 */
public final class CascadeLoader {

    private static final Logger log = LoggerFactory.getLogger(CascadeLoader.class);

    private final LayerSourceLoader sourceLoader;
    private final IntraLayerMerger intraLayerMerger = new IntraLayerMerger();
    private final LayerMerger layerMerger = new LayerMerger();
    private final IntegrityChecker integrityChecker = new IntegrityChecker();
    private final SchemaNode schema;

    public CascadeLoader() {
        this(new DirectoryLayerSourceLoader());
    }

    public CascadeLoader(LayerSourceLoader sourceLoader) {
        this(sourceLoader, null);
    }

    /**
     * @param schema schema of the cascade root, used to check unit path casing; null skips that check
     */
    public CascadeLoader(LayerSourceLoader sourceLoader, SchemaNode schema) {
        this.sourceLoader = Objects.requireNonNull(sourceLoader, "sourceLoader");
        this.schema = schema;
    }

    /**
     * Reads the project file and loads its layers.
     *
     * @throws IOException when the project file itself cannot be read
     */
    public MergeResult loadProject(Path projectFile) throws IOException {
        List<LayerDefinition> definitions = CascadeProjectLoader.load(projectFile);
        log.info("Loading cascade project {} with {} layer(s)", projectFile, definitions.size());
        return load(definitions);
    }

    public MergeResult load(List<LayerDefinition> definitions) {
        Objects.requireNonNull(definitions, "definitions");
        List<CascadeLayer> layers = new ArrayList<>(definitions.size());
        for (LayerDefinition definition : definitions) {
            layers.add(loadLayer(definition));
        }
        MergeResult result = layerMerger.merge(layers);
        List<Diagnostic> warnings = integrityChecker.check(layers, schema);
        if (!warnings.isEmpty()) {
            log.info("Integrity checks raised {} warning(s)", warnings.size());
            result = result.withDiagnostics(warnings);
        }
        log.info("Cascade merged: {} layer(s), {} diagnostic(s)", layers.size(), result.getDiagnostics().size());
        return result;
    }

    public CascadeLayer loadLayer(LayerDefinition definition) {
        List<SourceUnit> units;
        try {
            units = sourceLoader.load(definition);
        } catch (IOException e) {
            log.warn("Failed to load layer {} from {}: {}", definition.name(), definition.sourceLocator(),
                    e.getMessage());
            return CascadeLayer.failed(definition, List.of(Diagnostic.of(DomPaths.ROOT, DiagnosticKind.LOAD_ERROR,
                    "Failed to load layer '" + definition.name() + "': " + e, definition.name())));
        }
        CascadeLayer layer = intraLayerMerger.merge(definition, units);
        if (!layer.isFailed()) {
            log.info("Loaded layer {} ({} source unit(s))", definition.name(), layer.getUnitIds().size());
        }
        return layer;
    }
}
