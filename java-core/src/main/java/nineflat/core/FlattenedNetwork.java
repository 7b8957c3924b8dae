package nineflat.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * The result of lowering a network, keyed by name.
 */
public record FlattenedNetwork(
        String name,
        @JsonProperty("component_arrays") Map<String, ComponentArray> componentArrays,
        @JsonProperty("connection_groups") Map<String, ConnectionGroup> connectionGroups) implements LoweredModel {

    public FlattenedNetwork {
        componentArrays = Collections.unmodifiableMap(new TreeMap<>(componentArrays));
        connectionGroups = Collections.unmodifiableMap(new TreeMap<>(connectionGroups));
    }

    @Override
    public Set<String> part() {
        var part = new TreeSet<String>();
        componentArrays.values().forEach(a -> part.addAll(a.part()));
        connectionGroups.values().forEach(g -> part.addAll(g.part()));
        return part;
    }
}
