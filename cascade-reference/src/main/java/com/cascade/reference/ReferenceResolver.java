package com.cascade.reference;

import com.cascade.diagnostics.Diagnostic;
import com.cascade.diagnostics.DiagnosticKind;
import com.cascade.dom.ArrayNode;
import com.cascade.dom.DomNode;
import com.cascade.dom.DomPaths;
import com.cascade.dom.DomTree;
import com.cascade.dom.NodeKind;
import com.cascade.dom.ObjectNode;
import com.cascade.dom.RefNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Replaces every {@link RefNode} with a deep copy of the subtree it points to.
 * <p>
 * The input is never touched; resolution runs on a clone. Resolution is best effort: a reference whose target is
 * missing, or that takes part in (or depends on) a cycle, keeps its marker and is reported once at its own path,
 * while every other reference is still resolved. Targets that contain references, or whose path runs through a
 * reference, are resolved first, so copies never carry resolvable markers.
 */
public final class ReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(ReferenceResolver.class);

    public ResolutionResult resolve(DomNode root) {
        Objects.requireNonNull(root, "root");
        DomNode working = DomTree.clone(root);
        if (working.getKind() == NodeKind.REF) {
            return new ResolutionResult(working, List.of(Diagnostic.of(DomPaths.ROOT,
                    DiagnosticKind.UNRESOLVED_REFERENCE, "Root node cannot be a reference to '"
                            + ((RefNode) working).getReferencePath() + "'")));
        }
        Session session = new Session(working);
        for (RefNode ref : DomTree.references(working)) {
            if (!session.status.containsKey(ref) && ref.getRoot() == working) {
                session.resolve(ref);
            }
        }
        if (!session.diagnostics.isEmpty()) {
            log.debug("Reference resolution finished with {} unresolved reference(s)", session.diagnostics.size());
        }
        return new ResolutionResult(working, session.diagnostics);
    }

    private enum Status {
        RESOLVED, CYCLE, MISSING
    }

    /** Target lookup outcome; {@code node} is null unless found. */
    private record Lookup(DomNode node, Status failure) {
        static Lookup found(DomNode node) {
            return new Lookup(node, null);
        }

        static Lookup failed(Status status) {
            return new Lookup(null, status);
        }
    }

    private static final class Session {

        private final DomNode root;
        private final Map<RefNode, Status> status = new IdentityHashMap<>();
        private final Set<RefNode> visiting = Collections.newSetFromMap(new IdentityHashMap<>());
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        Session(DomNode root) {
            this.root = root;
        }

        Status resolve(RefNode ref) {
            Status known = status.get(ref);
            if (known != null) {
                return known;
            }
            if (!visiting.add(ref)) {
                return Status.CYCLE;
            }
            try {
                Status result = resolveTarget(ref);
                status.put(ref, result);
                return result;
            } finally {
                visiting.remove(ref);
            }
        }

        private Status resolveTarget(RefNode ref) {
            String path = ref.getPath();
            String target = ref.getReferencePath();
            if (!target.startsWith(DomPaths.ROOT)) {
                return missing(ref, "Reference target '" + target + "' is not an absolute path");
            }
            Lookup lookup = locate(target);
            if (lookup.failure() == Status.CYCLE) {
                return cycle(ref, "Reference path '" + target + "' runs through a reference cycle");
            }
            if (lookup.failure() == Status.MISSING) {
                return missing(ref, "Reference target '" + target + "' not found");
            }
            DomNode targetNode = lookup.node();

            if (targetNode.getKind() == NodeKind.REF) {
                Status chained = resolve((RefNode) targetNode);
                if (chained == Status.CYCLE) {
                    return cycle(ref, "Reference to '" + target + "' is part of a reference cycle");
                }
                if (chained == Status.MISSING) {
                    return missing(ref, "Reference target '" + target + "' is itself unresolved");
                }
                targetNode = DomTree.find(root, target).orElse(null);
                if (targetNode == null) {
                    return missing(ref, "Reference target '" + target + "' not found");
                }
            } else if (DomPaths.isSameOrDescendant(path, targetNode.getPath())) {
                return cycle(ref, "Reference to '" + target + "' points at its own ancestor");
            }

            for (RefNode nested : DomTree.references(targetNode)) {
                if (resolve(nested) == Status.CYCLE) {
                    return cycle(ref, "Reference target '" + target + "' contains a reference cycle");
                }
            }

            DomNode replacement = DomTree.cloneAs(targetNode, ref.getName());
            replace(ref, replacement);
            // Copies of markers that already failed are reported at their original path only.
            for (RefNode copied : DomTree.references(replacement)) {
                status.put(copied, Status.MISSING);
            }
            log.debug("Resolved reference {} -> {}", path, target);
            return Status.RESOLVED;
        }

        /** Walks the target path, resolving any reference the path runs through. */
        private Lookup locate(String target) {
            DomNode current = root;
            List<String> walked = new ArrayList<>();
            for (String segment : DomPaths.split(target)) {
                if (current.getKind() == NodeKind.REF) {
                    Status through = resolve((RefNode) current);
                    if (through != Status.RESOLVED) {
                        return Lookup.failed(through);
                    }
                    current = DomTree.find(root, DomPaths.join(walked)).orElse(null);
                    if (current == null) {
                        return Lookup.failed(Status.MISSING);
                    }
                }
                current = DomTree.child(current, segment);
                if (current == null) {
                    return Lookup.failed(Status.MISSING);
                }
                walked.add(segment);
            }
            return Lookup.found(current);
        }

        private void replace(RefNode ref, DomNode replacement) {
            DomNode parent = ref.getParent();
            switch (parent.getKind()) {
                case OBJECT -> ((ObjectNode) parent).putChild(replacement);
                case ARRAY -> {
                    ArrayNode array = (ArrayNode) parent;
                    array.replaceItem(array.items().indexOf(ref), replacement);
                }
                case VALUE, REF -> throw new IllegalStateException("Leaf node " + parent.getPath() + " has children");
            }
        }

        private Status cycle(RefNode ref, String message) {
            diagnostics.add(Diagnostic.of(ref.getPath(), DiagnosticKind.REFERENCE_CYCLE, message));
            return Status.CYCLE;
        }

        private Status missing(RefNode ref, String message) {
            diagnostics.add(Diagnostic.of(ref.getPath(), DiagnosticKind.UNRESOLVED_REFERENCE, message));
            return Status.MISSING;
        }
    }
}
