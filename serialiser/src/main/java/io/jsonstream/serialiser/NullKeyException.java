package io.jsonstream.serialiser;

/**
 * Thrown if an object key is written without key text.
 */
public class NullKeyException extends IllegalArgumentException {
    private static final long serialVersionUID = 4967003950658839424L;

    public NullKeyException() {
        super("key is null");
    }
}
