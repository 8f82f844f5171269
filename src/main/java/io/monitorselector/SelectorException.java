package io.monitorselector;

/**
 * Base runtime exception of the selector.
 */
public class SelectorException extends RuntimeException {

    public SelectorException(String message) {
        super(message);
    }

    public SelectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
