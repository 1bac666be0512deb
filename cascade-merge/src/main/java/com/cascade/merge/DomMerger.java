package com.cascade.merge;

import com.cascade.dom.DomNode;
import com.cascade.dom.DomTree;
import com.cascade.dom.NodeKind;
import com.cascade.dom.ObjectNode;

/**
 * Recursive deep merge shared by the intra-layer and inter-layer merges. Objects on both sides merge by child
 * name; any other pairing (value, array, reference, mismatched kinds) is a conflict decided by the
 * {@link MergeHandler}. Everything copied into the target is a clone, so the source tree is never shared.
 */
public final class DomMerger {

    /** Higher-precedence side replaces the node wholesale; arrays are never merged item by item. */
    public static final MergeHandler REPLACE = (existing, incoming) -> true;

    private DomMerger() {
    }

    /** Callbacks for one merge pass. */
    @FunctionalInterface
    public interface MergeHandler {

        /**
         * Called when {@code existing} and {@code incoming} share a path and are not both objects.
         *
         * @return true to replace {@code existing} with a clone of {@code incoming}; false to keep it
         */
        boolean onConflict(DomNode existing, DomNode incoming);

        /** Called for every subtree attached to the target (new key or replacement). */
        default void onAttached(DomNode attached) {
        }
    }

    public static void mergeInto(ObjectNode target, ObjectNode source, MergeHandler handler) {
        for (DomNode incoming : source.children()) {
            DomNode existing = target.getChild(incoming.getName());
            if (existing == null) {
                handler.onAttached(target.addChild(DomTree.clone(incoming)));
            } else if (existing.getKind() == NodeKind.OBJECT && incoming.getKind() == NodeKind.OBJECT) {
                mergeInto((ObjectNode) existing, (ObjectNode) incoming, handler);
            } else if (handler.onConflict(existing, incoming)) {
                DomNode replacement = DomTree.clone(incoming);
                target.putChild(replacement);
                handler.onAttached(replacement);
            }
        }
    }
}
