package dev.fumaz.bracket.exception;

/**
 * Base unchecked exception for failures reported by the bracket library itself.
 */
public class BracketException extends RuntimeException {

    public BracketException(String message) {
        super(message);
    }

    public BracketException(String message, Throwable cause) {
        super(message, cause);
    }

    public BracketException(Throwable cause) {
        super(cause);
    }
}
