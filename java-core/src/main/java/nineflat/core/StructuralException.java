package nineflat.core;

/**
 * Raised when the network cannot be lowered at all: an unknown role, a name
 * clash, a dangling exposure. The message names the offending population or
 * projection.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
