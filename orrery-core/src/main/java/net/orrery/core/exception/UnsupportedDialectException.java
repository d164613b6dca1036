package net.orrery.core.exception;

/** The storage backend has no adapter. A configuration problem, not a data problem. */
public class UnsupportedDialectException extends OrreryException {
    public UnsupportedDialectException(String dialect) {
        super("Unrecognized storage dialect: " + dialect);
    }
}
