package com.cascade.mount.provider;

import com.cascade.merge.MergeResult;
import com.cascade.merge.load.CascadeLoader;
import com.cascade.mount.DomProvider;
import com.cascade.mount.ProviderSnapshot;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Mounts a layered cascade read from a project file. Layer and unit problems surface as diagnostics of the
 * snapshot; only an unreadable project file fails the mount. The last merge result is kept for origin lookups.
 */
public final class CascadeDomProvider implements DomProvider {

    private final Path projectFile;
    private final CascadeLoader loader;
    private volatile MergeResult lastMergeResult;

    public CascadeDomProvider(Path projectFile) {
        this(projectFile, new CascadeLoader());
    }

    public CascadeDomProvider(Path projectFile, CascadeLoader loader) {
        this.projectFile = Objects.requireNonNull(projectFile, "projectFile");
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    @Override
    public ProviderSnapshot load() throws IOException {
        MergeResult result = loader.loadProject(projectFile);
        lastMergeResult = result;
        return new ProviderSnapshot(result.getRoot(), result.getDiagnostics());
    }

    /** Merge result of the most recent successful load, for winner/contributor lookups. */
    public Optional<MergeResult> getLastMergeResult() {
        return Optional.ofNullable(lastMergeResult);
    }

    public Path getProjectFile() {
        return projectFile;
    }
}
