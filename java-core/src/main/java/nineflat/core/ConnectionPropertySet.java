package nineflat.core;

import nineflat.core.values.Property;

import java.util.List;

/**
 * Per-connection values that ride along the edges of a shared synapse and are
 * applied when an event arrives on {@code port}.
 */
public record ConnectionPropertySet(String port, List<Property> properties) {

    public ConnectionPropertySet {
        properties = properties.stream().sorted().toList();
    }
}
