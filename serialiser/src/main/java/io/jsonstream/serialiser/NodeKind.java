package io.jsonstream.serialiser;

/**
 * Structural tags tracked while a document is being written.
 */
public enum NodeKind {
    /** document level, bottom of the nesting stack */
    ROOT,
    OBJECT,
    ARRAY,
    /** object key awaiting its value */
    KEY,
    /** scalar value being written */
    VALUE
}
