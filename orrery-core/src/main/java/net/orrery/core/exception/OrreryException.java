package net.orrery.core.exception;

public class OrreryException extends RuntimeException {
    public OrreryException(String message) {
        super(message);
    }

    public OrreryException(String message, Throwable cause) {
        super(message, cause);
    }
}
