package nineflat.core;

import com.fasterxml.jackson.annotation.JsonProperty;

import nineflat.core.multi.MultiComponent;
import nineflat.core.network.PortConnection;

import java.util.List;

/**
 * A synapse that could not be folded into its target cells and has to be
 * instantiated once per connection, together with the connections binding it
 * to the post-synaptic cell.
 */
public record SynapseDefinition(
        String name,
        MultiComponent dynamics,
        @JsonProperty("port_connections") List<PortConnection> portConnections) {

    public SynapseDefinition {
        portConnections = List.copyOf(portConnections);
    }
}
