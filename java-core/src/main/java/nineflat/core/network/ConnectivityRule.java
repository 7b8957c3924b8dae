package nineflat.core.network;

import nineflat.core.values.Quantity;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Which source instances connect to which target instances. The rule is
 * opaque here; sampling it is the backend's job.
 */
public record ConnectivityRule(String rule, Map<String, Quantity> properties) {

    public ConnectivityRule {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(properties));
    }

    public static ConnectivityRule of(String rule) {
        return new ConnectivityRule(rule, Map.of());
    }
}
