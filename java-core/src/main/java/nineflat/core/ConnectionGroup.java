package nineflat.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.dynamics.Communication;
import nineflat.core.values.Quantity;

import java.util.Set;

/**
 * The edges carrying one port-to-port link of a projection, in one direction.
 */
public record ConnectionGroup(
        String name,
        String source,
        String destination,
        @JsonProperty("source_port") String sourcePort,
        @JsonProperty("destination_port") String destinationPort,
        Connectivity connectivity,
        Quantity delay,
        Communication communication) implements LoweredModel {

    @Override
    public Set<String> part() {
        return Set.of(name, source, destination);
    }
}
