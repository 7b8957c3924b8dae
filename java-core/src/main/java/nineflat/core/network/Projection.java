package nineflat.core.network;

import com.fasterxml.jackson.annotation.JsonIgnore;

import nineflat.core.dynamics.DynamicsProperties;
import nineflat.core.values.Quantity;

import java.util.List;
import java.util.Optional;

/**
 * Edges from the {@code pre} population (or selection) to the {@code post}
 * one, through a synapse made of a response and an optional plasticity part.
 */
public record Projection(
        String name,
        String pre,
        String post,
        ConnectivityRule connectivity,
        Quantity delay,
        DynamicsProperties response,
        DynamicsProperties plasticity,
        List<PortConnection> portConnections) {

    public Projection {
        portConnections = portConnections == null ? List.of() : List.copyOf(portConnections);
    }

    @JsonIgnore
    public Optional<DynamicsProperties> plasticityIfPresent() {
        return Optional.ofNullable(plasticity);
    }
}
