package nineflat.common;

import nineflat.core.multi.MultiComponent;
import nineflat.core.network.PortConnection;
import nineflat.core.network.Role;

import java.util.List;

/**
 * A projection's response and plasticity merged into one synapse, and the
 * projection's port connections rewritten to address it through the
 * {@link Role#SYNAPSE} role.
 */
public record FlattenedSynapse(
        String projection,
        MultiComponent synapse,
        List<PortConnection> portConnections) {

    public FlattenedSynapse {
        portConnections = List.copyOf(portConnections);
    }

    /**
     * @return the connections to or from the pre-synaptic cell, without
     *         duplicates
     */
    public List<PortConnection> preConnections() {
        return portConnections.stream().filter(pc -> pc.touches(Role.PRE)).distinct().toList();
    }

    /**
     * @return the connections between the synapse and the post-synaptic cell
     */
    public List<PortConnection> postConnections() {
        return portConnections.stream().filter(pc -> !pc.touches(Role.PRE)).toList();
    }
}
