package nineflat.core;

/**
 * Namespaced names would become ambiguous, either because two sub-components
 * share a name or because two symbols map to the same flattened name.
 */
public class NamespaceCollisionException extends StructuralException {

    public NamespaceCollisionException(String message) {
        super(message);
    }
}
