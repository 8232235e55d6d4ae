package io.jsonstream.serialiser;

/**
 * Thrown if a structural call is illegal in the current state of the document, e.g. a second root value, a key where
 * a value is expected or a mismatched container close. Nothing is written for the offending call.
 */
public class JsonGrammarException extends IllegalStateException {
    private static final long serialVersionUID = -3106715046386245101L;

    public JsonGrammarException(final String message) {
        super(message);
    }
}
