package com.cascade.mount.provider;

import com.cascade.dom.DomNode;
import com.cascade.dom.DomTree;
import com.cascade.mount.DomProvider;
import com.cascade.mount.ProviderSnapshot;

import java.util.Objects;

/** Serves a fixed in-memory tree, cloned on every load. */
public final class StaticDomProvider implements DomProvider {

    private final DomNode root;

    public StaticDomProvider(DomNode root) {
        this.root = DomTree.clone(Objects.requireNonNull(root, "root"));
    }

    @Override
    public ProviderSnapshot load() {
        return ProviderSnapshot.of(DomTree.clone(root));
    }
}
