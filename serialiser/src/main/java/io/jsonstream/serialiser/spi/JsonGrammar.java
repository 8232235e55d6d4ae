package io.jsonstream.serialiser.spi;

import io.jsonstream.serialiser.JsonGrammarException;
import io.jsonstream.serialiser.NodeKind;

/**
 * State machine enforcing the JSON production rules over a sequence of structural events.
 *
 * <p>
 * The grammar holds no value data, only the structural tags of the open contexts. Every transition is validated before
 * the stack is touched, so a rejected call leaves the state as it was. Legal pushes:
 * <ul>
 * <li>{@link NodeKind#OBJECT}, {@link NodeKind#ARRAY} and {@link NodeKind#VALUE} below {@code ROOT} (only while the root
 * is still empty), below {@code ARRAY} or below a pending {@code KEY} (which is resolved by it),</li>
 * <li>{@link NodeKind#KEY} only below {@code OBJECT}.</li>
 * </ul>
 * Not thread-safe.
 */
public class JsonGrammar {
    public static final String MULTIPLE_ROOTS = "multiple roots: document already holds its top-level value";

    /**
     * token to be emitted in front of the next structural element
     */
    public enum Separator {
        NONE(0),
        /** ',' between siblings */
        ITEM(','),
        /** ':' between key and value */
        KEY(':');

        private final byte symbol;

        Separator(final int symbol) {
            this.symbol = (byte) symbol;
        }

        public byte getSymbol() {
            return symbol;
        }
    }

    private final NodeStack nodes;

    public JsonGrammar() {
        this(0);
    }

    /**
     * @param initialCapacity number of nesting levels reserved up-front
     */
    public JsonGrammar(final int initialCapacity) {
        nodes = new NodeStack(initialCapacity);
    }

    /**
     * Validates and pushes a new node.
     *
     * @param kind kind of the node to be opened, {@link NodeKind#ROOT} is never legal
     * @return separator that must precede the token of the new node
     * @throws JsonGrammarException if the node is not allowed in the current context
     */
    public Separator enter(final NodeKind kind) {
        validate(kind);
        final Separator separator = separator();
        nodes.push(kind);
        return separator;
    }

    /**
     * Validates a push without modifying the state.
     *
     * @param kind kind of the node to be opened
     * @throws JsonGrammarException if the node is not allowed in the current context
     */
    public void validate(final NodeKind kind) {
        final DocNode top = nodes.top();
        checkNotComplete();
        switch (kind) {
        case KEY:
            if (top.getKind() == NodeKind.KEY) {
                throw new JsonGrammarException("key written while previous key still awaits its value");
            }
            if (top.getKind() != NodeKind.OBJECT) {
                throw new JsonGrammarException("key written outside of an object (current context: " + top.getKind() + ')');
            }
            return;
        case OBJECT:
        case ARRAY:
        case VALUE:
            if (top.getKind() == NodeKind.OBJECT) {
                throw new JsonGrammarException(kind + " written where an object key is expected");
            }
            if (top.getKind() == NodeKind.VALUE) {
                throw new JsonGrammarException(kind + " written while a scalar value is still open");
            }
            return;
        default:
            throw new JsonGrammarException("cannot enter " + kind);
        }
    }

    /**
     * Pops the currently open container and resolves it as a child of its parent.
     *
     * @param kind expected kind of the open container ({@link NodeKind#OBJECT} or {@link NodeKind#ARRAY})
     * @throws JsonGrammarException if the open context is not of the given kind
     */
    public void exit(final NodeKind kind) {
        checkNotComplete();
        final NodeKind open = nodes.top().getKind();
        if (open != kind || (kind != NodeKind.OBJECT && kind != NodeKind.ARRAY)) {
            throw new JsonGrammarException("cannot close " + kind + " while " + open + " is open");
        }
        nodes.pop();
        resolveChild();
    }

    /**
     * Resolves a completed scalar value: pops the transient {@link NodeKind#VALUE} marker and the pending key (if any)
     * and marks the parent as having children.
     */
    public void endChild() {
        if (nodes.top().getKind() == NodeKind.VALUE) {
            nodes.pop();
        }
        resolveChild();
    }

    /**
     * @return {@code true} if the next token must be preceded by ',' (non-empty container) or ':' (pending key)
     */
    public boolean needsSeparator() {
        final DocNode top = nodes.top();
        switch (top.getKind()) {
        case OBJECT:
        case ARRAY:
            return top.hasChildren();
        case KEY:
            return true;
        default:
            return false;
        }
    }

    /**
     * @return the separator implied by {@link #needsSeparator()}
     */
    public Separator separator() {
        if (!needsSeparator()) {
            return Separator.NONE;
        }
        return nodes.top().getKind() == NodeKind.KEY ? Separator.KEY : Separator.ITEM;
    }

    /**
     * @return kind of the innermost open node, e.g. {@link NodeKind#OBJECT} after an object has been started until it
     *         is closed or another node is opened
     */
    public NodeKind parentNode() {
        return nodes.top().getKind();
    }

    /**
     * @return number of open nodes above the root
     */
    public int depth() {
        return nodes.size() - 1;
    }

    /**
     * @return {@code true} once the single top-level value has been fully written
     */
    public boolean isComplete() {
        return nodes.size() == 1 && nodes.top().hasChildren();
    }

    @Override
    public String toString() {
        return "JsonGrammar" + nodes;
    }

    private void checkNotComplete() {
        if (isComplete()) {
            throw new JsonGrammarException(MULTIPLE_ROOTS);
        }
    }

    private void resolveChild() {
        if (nodes.top().getKind() == NodeKind.KEY) {
            nodes.pop();
        }
        nodes.top().markChild();
    }
}
