package nineflat.core.dynamics;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.values.Quantity;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public record DynamicsProperties(
        String name,
        Dynamics dynamics,
        Map<String, Quantity> properties,
        @JsonProperty("initial_values") Map<String, Quantity> initialValues) implements ComponentProperties {

    public DynamicsProperties {
        properties = properties == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(properties));
        initialValues = initialValues == null ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(initialValues));
    }

    @Override
    public Dynamics componentClass() {
        return dynamics;
    }
}
