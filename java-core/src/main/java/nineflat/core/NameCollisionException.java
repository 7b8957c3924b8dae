package nineflat.core;

/**
 * Two derived outputs ended up with the same name.
 */
public class NameCollisionException extends StructuralException {

    private final String name;

    public NameCollisionException(String name, String message) {
        super(message);
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
