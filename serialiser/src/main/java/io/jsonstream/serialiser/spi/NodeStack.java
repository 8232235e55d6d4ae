package io.jsonstream.serialiser.spi;

import io.jsonstream.serialiser.NodeKind;

import it.unimi.dsi.fastutil.objects.ObjectArrayList;

/**
 * Path from the document root to the currently open context. The bottom entry is always {@link NodeKind#ROOT} and is
 * never popped.
 */
public final class NodeStack {
    private final ObjectArrayList<DocNode> nodes;

    /**
     * @param initialCapacity number of nesting levels reserved up-front
     */
    public NodeStack(final int initialCapacity) {
        nodes = new ObjectArrayList<>(initialCapacity + 1);
        nodes.push(new DocNode(NodeKind.ROOT));
    }

    public DocNode top() {
        return nodes.top();
    }

    void push(final NodeKind kind) {
        nodes.push(new DocNode(kind));
    }

    DocNode pop() {
        if (nodes.size() == 1) {
            throw new IllegalStateException("root node cannot be popped");
        }
        return nodes.pop();
    }

    /**
     * @return number of entries including the root node
     */
    public int size() {
        return nodes.size();
    }

    @Override
    public String toString() {
        return nodes.toString();
    }
}
