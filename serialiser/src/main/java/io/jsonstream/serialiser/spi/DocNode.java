package io.jsonstream.serialiser.spi;

import io.jsonstream.serialiser.NodeKind;

/**
 * Single entry of the {@link NodeStack}: the structural kind and whether at least one child has been emitted.
 */
public final class DocNode {
    private final NodeKind kind;
    private boolean hasChildren;

    public DocNode(final NodeKind kind) {
        this.kind = kind;
    }

    public NodeKind getKind() {
        return kind;
    }

    public boolean hasChildren() {
        return hasChildren;
    }

    /**
     * flags the first emitted child; never reverts
     */
    void markChild() {
        hasChildren = true;
    }

    @Override
    public String toString() {
        return kind + (hasChildren ? "(+)" : "");
    }
}
