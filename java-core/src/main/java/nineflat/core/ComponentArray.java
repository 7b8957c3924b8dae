package nineflat.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.multi.MultiComponent;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * The flattened form of one population: its cell dynamics merged with every
 * synapse that could be embedded, the synapses that have to stay per
 * connection, and the per-connection property sets of embedded synapses.
 */
public record ComponentArray(
        String name,
        int size,
        MultiComponent dynamics,
        List<SynapseDefinition> synapses,
        @JsonProperty("connection_property_sets") List<ConnectionPropertySet> connectionPropertySets)
        implements LoweredModel {

    public ComponentArray {
        synapses = List.copyOf(synapses);
        connectionPropertySets = List.copyOf(connectionPropertySets);
    }

    public Optional<SynapseDefinition> synapse(String synapseName) {
        return synapses.stream().filter(s -> s.name().equals(synapseName)).findAny();
    }

    public Optional<ConnectionPropertySet> connectionPropertySet(String port) {
        return connectionPropertySets.stream().filter(s -> s.port().equals(port)).findAny();
    }

    @Override
    public Set<String> part() {
        var part = new TreeSet<String>();
        part.add(name);
        part.addAll(dynamics.subComponents().keySet());
        synapses.forEach(s -> part.add(s.name()));
        return part;
    }
}
