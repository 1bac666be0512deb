package com.cascade.mount;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomPaths;
import com.cascade.dom.DomTree;
import com.cascade.dom.NodeKind;
import com.cascade.dom.ObjectNode;
import com.cascade.query.DomQuery;
import com.cascade.reference.ReferenceResolver;
import com.cascade.reference.ResolutionResult;
import com.cascade.schema.SchemaCatalog;
import com.cascade.schema.ValidationOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Composes a master tree from independently loaded providers mounted at distinct paths.
 * <p>
 * A refresh loads every provider concurrently, splices the results into a fresh master tree in sorted mount-path
 * order (so nested mounts land inside their parent), runs one reference resolution pass over the whole tree, so
 * references may cross mounts, and validates against the schema catalog when one is configured. A failing
 * provider only costs its own mount: the path stays absent and a MOUNT_FAILURE diagnostic is recorded.
 * <p>
 * Each refresh takes a generation number. Its result is published only if no newer refresh has started by the
 * time it completes, so a slow refresh never overwrites a newer one.
 */
public final class MountRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MountRegistry.class);

    private final Map<String, DomProvider> mounts = new ConcurrentSkipListMap<>();
    private final ExecutorService loadExecutor;
    private final ExecutorService refreshExecutor;
    private final boolean ownsLoadExecutor;
    private final ReferenceResolver resolver = new ReferenceResolver();
    private final SchemaCatalog schemaCatalog;
    private final ValidationOptions validationOptions;
    private final AtomicLong generations = new AtomicLong();
    private final AtomicReference<ResolvedConfiguration> published = new AtomicReference<>();

    private MountRegistry(Builder b) {
        this.ownsLoadExecutor = b.executor == null;
        this.loadExecutor = b.executor != null
                ? b.executor
                : Executors.newFixedThreadPool(b.refreshThreads, daemonThreads("cascade-mount-load"));
        this.refreshExecutor = Executors.newCachedThreadPool(daemonThreads("cascade-mount-refresh"));
        this.schemaCatalog = b.schemaCatalog;
        this.validationOptions = b.validationOptions;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mounts a provider. Takes effect on the next refresh.
     *
     * @throws IllegalArgumentException when the path is not absolute or already mounted
     */
    public void register(String mountPath, DomProvider provider) {
        Objects.requireNonNull(mountPath, "mountPath");
        Objects.requireNonNull(provider, "provider");
        if (!mountPath.startsWith(DomPaths.ROOT)) {
            throw new IllegalArgumentException("Mount path must be absolute: " + mountPath);
        }
        String normalized = DomPaths.normalize(mountPath);
        if (mounts.putIfAbsent(normalized, provider) != null) {
            throw new IllegalArgumentException("Mount path already registered: " + normalized);
        }
        log.info("Mounted provider at {}", normalized);
    }

    public boolean unregister(String mountPath) {
        return mounts.remove(DomPaths.normalize(mountPath)) != null;
    }

    public Set<String> mountPaths() {
        return Collections.unmodifiableSet(mounts.keySet());
    }

    /**
     * Loads all providers, builds and resolves a new master tree, and publishes it unless superseded.
     * Returns the configuration built by this call even when it was not published.
     */
    public ResolvedConfiguration refresh() {
        long generation = generations.incrementAndGet();
        Map<String, DomProvider> current = new TreeMap<>(mounts);
        log.debug("Refresh {} started for {} mount(s)", generation, current.size());

        Map<String, Future<ProviderSnapshot>> loads = new TreeMap<>();
        current.forEach((path, provider) -> loads.put(path, loadExecutor.submit(provider::load)));

        ObjectNode master = ObjectNode.root();
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (Map.Entry<String, Future<ProviderSnapshot>> entry : loads.entrySet()) {
            String mountPath = entry.getKey();
            ProviderSnapshot snapshot;
            try {
                snapshot = entry.getValue().get();
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.warn("Provider at {} failed to load: {}", mountPath, cause.toString());
                diagnostics.add(Diagnostic.of(mountPath, DiagnosticKind.MOUNT_FAILURE,
                        "Provider failed to load: " + cause, mountPath));
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                loads.values().forEach(f -> f.cancel(true));
                throw new IllegalStateException("Refresh " + generation + " interrupted", e);
            }
            for (Diagnostic d : snapshot.diagnostics()) {
                diagnostics.add(new Diagnostic(rebase(mountPath, d.path()), d.kind(), d.message(), d.severity(),
                        d.source() != null ? d.source() : mountPath));
            }
            splice(master, mountPath, snapshot.root(), diagnostics);
        }

        ResolutionResult resolution = resolver.resolve(master);
        diagnostics.addAll(resolution.diagnostics());
        if (schemaCatalog != null && !schemaCatalog.isEmpty()) {
            diagnostics.addAll(schemaCatalog.validate(resolution.root(), validationOptions).issues());
        }

        ResolvedConfiguration configuration = new ResolvedConfiguration(generation, resolution.root(), diagnostics);
        if (publish(configuration)) {
            log.info("Refresh {} published: {} mount(s), {} diagnostic(s)", generation, current.size(),
                    configuration.diagnostics().size());
        } else {
            log.info("Refresh {} superseded by a newer refresh; result discarded", generation);
        }
        return configuration;
    }

    public CompletableFuture<ResolvedConfiguration> refreshAsync() {
        return CompletableFuture.supplyAsync(this::refresh, refreshExecutor);
    }

    /** Last published configuration; empty before the first refresh completes. */
    public Optional<ResolvedConfiguration> snapshot() {
        return Optional.ofNullable(published.get());
    }

    /**
     * Query over the last published configuration.
     *
     * @throws IllegalStateException before the first publish
     */
    public DomQuery query() {
        ResolvedConfiguration configuration = published.get();
        if (configuration == null) {
            throw new IllegalStateException("No configuration published yet; call refresh() first");
        }
        return configuration.query();
    }

    @Override
    public void close() {
        refreshExecutor.shutdownNow();
        if (ownsLoadExecutor) {
            loadExecutor.shutdownNow();
        }
    }

    private boolean publish(ResolvedConfiguration configuration) {
        long generation = configuration.generation();
        ResolvedConfiguration result = published.updateAndGet(previous -> {
            boolean newest = generations.get() == generation;
            boolean newerPublished = previous != null && previous.generation() > generation;
            return newest && !newerPublished ? configuration : previous;
        });
        return result == configuration;
    }

    private static void splice(ObjectNode master, String mountPath, DomNode root, List<Diagnostic> diagnostics) {
        List<String> segments = DomPaths.split(mountPath);
        if (segments.isEmpty()) {
            if (root.getKind() != NodeKind.OBJECT) {
                diagnostics.add(Diagnostic.of(mountPath, DiagnosticKind.MOUNT_FAILURE,
                        "Provider mounted at the root must return an object, got " + root.getKind(), mountPath));
                return;
            }
            for (DomNode child : ((ObjectNode) root).children()) {
                master.putChild(DomTree.clone(child));
            }
            return;
        }
        ObjectNode parent = master;
        for (String segment : segments.subList(0, segments.size() - 1)) {
            DomNode next = parent.getChild(segment);
            if (next == null) {
                next = parent.addChild(new ObjectNode(segment));
            } else if (next.getKind() != NodeKind.OBJECT) {
                diagnostics.add(Diagnostic.of(mountPath, DiagnosticKind.MOUNT_FAILURE,
                        "Mount path is blocked by " + next.getKind() + " at " + next.getPath(), mountPath));
                return;
            }
            parent = (ObjectNode) next;
        }
        parent.putChild(DomTree.cloneAs(root, segments.get(segments.size() - 1)));
    }

    private static String rebase(String mountPath, String path) {
        if (DomPaths.ROOT.equals(mountPath)) {
            return path;
        }
        return DomPaths.ROOT.equals(path) ? mountPath : mountPath + path;
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public static final class Builder {
        private int refreshThreads = 4;
        private ExecutorService executor;
        private SchemaCatalog schemaCatalog;
        private ValidationOptions validationOptions = ValidationOptions.DEFAULT;

        private Builder() {
        }

        /** Size of the owned load pool. Ignored when an executor is supplied. Values below 1 are raised to 1. */
        public Builder refreshThreads(int refreshThreads) {
            this.refreshThreads = Math.max(1, refreshThreads);
            return this;
        }

        /** Executor for provider loads. Not shut down by {@link MountRegistry#close()}. */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder schemaCatalog(SchemaCatalog schemaCatalog) {
            this.schemaCatalog = schemaCatalog;
            return this;
        }

        public Builder validationOptions(ValidationOptions validationOptions) {
            this.validationOptions = Objects.requireNonNull(validationOptions, "validationOptions");
            return this;
        }

        public MountRegistry build() {
            return new MountRegistry(this);
        }
    }
}
