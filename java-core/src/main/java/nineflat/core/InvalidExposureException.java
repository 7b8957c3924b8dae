package nineflat.core;

public class InvalidExposureException extends StructuralException {

    public InvalidExposureException(String message) {
        super(message);
    }
}
