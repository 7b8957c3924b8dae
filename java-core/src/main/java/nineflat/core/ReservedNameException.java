package nineflat.core;

public class ReservedNameException extends StructuralException {

    public ReservedNameException(String message) {
        super(message);
    }
}
