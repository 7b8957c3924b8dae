package nineflat.core;

public class InvalidRoleException extends StructuralException {

    public InvalidRoleException(String message) {
        super(message);
    }
}
